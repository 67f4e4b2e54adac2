package ca.gc.cra.flowstart.application.output;

import ca.gc.cra.flowstart.config.OutputConfig;

/**
 * Builds the context of a module nested under a parent JSON output.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SubModuleContextFactory {
  /**
   * Creates a context for the given sub-output entry.
   *
   * @param conf entry listed under the parent's {@code types}
   * @param parent parent context exposing the shared sink
   * @return context borrowing the parent's sink
   * @throws OutputInitException if the context cannot be built
   */
  ModuleContext create(OutputConfig conf, JsonOutputContext parent) throws OutputInitException;
}
