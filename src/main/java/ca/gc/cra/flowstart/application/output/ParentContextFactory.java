package ca.gc.cra.flowstart.application.output;

import ca.gc.cra.flowstart.config.OutputConfig;

/**
 * Builds a parent multiplexing JSON output.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ParentContextFactory {
  /**
   * Creates the parent context.
   *
   * @param conf parent section
   * @return parent context owning its sink
   * @throws OutputInitException if the sink cannot be opened
   */
  JsonOutputContext create(OutputConfig conf) throws OutputInitException;
}
