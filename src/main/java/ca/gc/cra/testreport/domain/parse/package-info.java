/**
 * Line classification and report building for test-runner output.
 * <p><strong>Role:</strong> Domain services turning a text stream into the
 * {@link ca.gc.cra.testreport.domain.report.Report} model.</p>
 * <p><strong>Concurrency:</strong> Compiled patterns and decoders are shareable; parse state lives in one call.</p>
 * <p><strong>Errors:</strong> Only read failures propagate. Lines that match no known shape are dropped or
 * attributed to the active test.</p>
 */
package ca.gc.cra.testreport.domain.parse;
