/**
 * <strong>Purpose:</strong> Sink adapters: regular files, unix domain sockets and Kafka topics.
 * <p><strong>Concurrency:</strong> Every sink serializes concurrent writers internally.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.infrastructure.sink;
