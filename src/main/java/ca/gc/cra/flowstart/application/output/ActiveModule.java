package ca.gc.cra.flowstart.application.output;

import java.util.Objects;

/**
 * An instantiated packet module: its logger callbacks plus the context built for it.
 *
 * @param name configuration key the module was activated under
 * @param logger packet callbacks
 * @param context module context
 * @param <T> thread state type
 * @since 0.1.0
 */
public record ActiveModule<T>(String name, PacketLogger<T> logger, ModuleContext context) {
  /**
   * Validates components.
   */
  public ActiveModule {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(logger, "logger");
    Objects.requireNonNull(context, "context");
  }
}
