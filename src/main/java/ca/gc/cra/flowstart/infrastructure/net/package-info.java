/**
 * Native network interface lookups.
 *
 * @since 0.1.0
 */
package ca.gc.cra.flowstart.infrastructure.net;
