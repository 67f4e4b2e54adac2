/**
 * <strong>Purpose:</strong> Output module framework: contexts, registry, and activation from configuration.
 * <p><strong>Pipeline role:</strong> Startup and shutdown only; per-packet work lives in the modules.</p>
 * <p><strong>Concurrency:</strong> Contexts are read-only once built and shared by every worker.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.application.output;
