/**
 * Input validation helpers shared by the CLI and configuration layers.
 * <p><strong>Errors:</strong> Violations raise {@link java.lang.IllegalArgumentException} with the offending
 * parameter named.</p>
 */
package ca.gc.cra.testreport.validation;
