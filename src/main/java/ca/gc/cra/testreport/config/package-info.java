/**
 * Configuration for CLI runs: embedded defaults, YAML files and key=value overrides.
 * <p><strong>Role:</strong> Bootstrap layer between the CLI and the parse use case.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths and values through {@code ca.gc.cra.testreport.validation}.</p>
 */
package ca.gc.cra.testreport.config;
