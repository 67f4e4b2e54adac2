/**
 * <strong>Purpose:</strong> Network value objects shared by packet views and event headers.
 * <p><strong>Concurrency:</strong> Immutable types; safe to share across worker threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.domain.net;
