/**
 * <strong>Purpose:</strong> Host-side harness driving output modules from packet worker threads.
 * <p><strong>Concurrency:</strong> One {@code PacketOutputWorker} per worker thread; no shared mutable state.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.application.pipeline;
