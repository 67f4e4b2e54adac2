/**
 * <strong>Purpose:</strong> YAML configuration model and the composition root for the output subsystem.
 * <p><strong>Pipeline role:</strong> Startup only; translates configuration into registered modules and
 * active outputs.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.config;
