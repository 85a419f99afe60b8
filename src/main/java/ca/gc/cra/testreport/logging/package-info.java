/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound logged line sizes.
 * <p><strong>Role:</strong> Cross-cutting support for the CLI and the parser's diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.testreport.logging;
