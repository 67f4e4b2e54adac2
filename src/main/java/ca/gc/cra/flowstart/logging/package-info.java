/**
 * Logging backend helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.logging;
