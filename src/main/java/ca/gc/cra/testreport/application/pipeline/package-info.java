/**
 * Use cases that connect configured inputs to the report builder.
 * <p><strong>Role:</strong> Application layer invoked by the CLI.</p>
 * <p><strong>Concurrency:</strong> Each run is synchronous and single-threaded.</p>
 */
package ca.gc.cra.testreport.application.pipeline;
