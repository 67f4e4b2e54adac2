/**
 * <strong>Purpose:</strong> Flow abstractions consumed by output modules.
 * <p><strong>Pipeline role:</strong> Flow tracking happens upstream; this package exposes counters read-only.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.flowstart.domain.flow.Flow} uses atomic counters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.domain.flow;
