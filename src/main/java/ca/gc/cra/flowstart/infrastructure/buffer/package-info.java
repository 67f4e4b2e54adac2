/**
 * Reusable byte buffers for serialization hot paths.
 */
package ca.gc.cra.flowstart.infrastructure.buffer;
