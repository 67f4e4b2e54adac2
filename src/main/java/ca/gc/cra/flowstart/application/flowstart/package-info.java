/**
 * <strong>Purpose:</strong> Flow-start event logger: condition, per-worker state, formatting and
 * registration.
 * <p><strong>Pipeline role:</strong> Runs inside the host's packet workers after flow tracking.</p>
 * <p><strong>Concurrency:</strong> Thread state is worker-confined; the sink handles cross-thread writes.</p>
 * <p><strong>Observability:</strong> Emits {@code flowstart.event.*} metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.application.flowstart;
