/**
 * <strong>Purpose:</strong> Packet views consumed by output modules on the hot path.
 * <p><strong>Concurrency:</strong> Packets are confined to the worker thread processing them.
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.domain.packet;
