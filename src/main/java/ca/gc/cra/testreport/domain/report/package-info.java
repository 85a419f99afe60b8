/**
 * Report model produced from test-runner output: packages, test cases, benchmarks and results.
 * <p><strong>Role:</strong> Domain layer without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.testreport.domain.report.TestCase} is mutable while a
 * parse is in progress; everything else is immutable.</p>
 */
package ca.gc.cra.testreport.domain.report;
