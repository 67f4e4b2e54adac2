/**
 * <strong>Purpose:</strong> Domain model for the flow-start logger: packets, flows and event records.
 * <p><strong>Pipeline role:</strong> Shared vocabulary between the host pipeline and output modules.
 * <p><strong>Concurrency:</strong> Value types are immutable; {@code EventRecord} is thread-confined.
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.domain;
