/**
 * JSON event construction and serialization backed by Jackson's streaming generator.
 */
package ca.gc.cra.flowstart.infrastructure.json;
