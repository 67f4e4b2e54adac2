package ca.gc.cra.flowstart.application.output;

/**
 * Ownership a {@link ModuleContext} holds over its sink.
 *
 * @since 0.1.0
 */
public enum SinkOwnership {
  /** The context opened the sink and closes it on shutdown. */
  OWNED,
  /** The sink belongs to a parent output; the context never closes it. */
  BORROWED
}
