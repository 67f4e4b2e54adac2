package ca.gc.cra.flowstart.application.output;

import ca.gc.cra.flowstart.config.OutputConfig;

/**
 * Builds the context of a standalone output module.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ModuleContextFactory {
  /**
   * Creates a context for the given section.
   *
   * @param conf output section
   * @return context owning its sink
   * @throws OutputInitException if the context cannot be built
   */
  ModuleContext create(OutputConfig conf) throws OutputInitException;
}
