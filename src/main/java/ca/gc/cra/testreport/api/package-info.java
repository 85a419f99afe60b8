/**
 * Command-line entry points: argument parsing, dispatch, exit codes and console summaries.
 * <p><strong>Role:</strong> Outermost adapter; everything here delegates to the parse use case.</p>
 */
package ca.gc.cra.testreport.api;
