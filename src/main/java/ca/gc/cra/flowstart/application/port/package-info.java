/**
 * <strong>Purpose:</strong> Ports between output modules and the host/platform: sinks, metrics, engine
 * mode, interface lookup and header construction.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.application.port;
