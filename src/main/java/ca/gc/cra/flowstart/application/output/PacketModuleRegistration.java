package ca.gc.cra.flowstart.application.output;

import java.util.Objects;

/**
 * Registry entry binding a packet logger to one way of constructing its context.
 * <p>Root registrations carry a {@link ModuleContextFactory}; sub-module registrations carry a parent name
 * and a {@link SubModuleContextFactory}.</p>
 *
 * @param moduleName module name used in logs and metrics
 * @param confName configuration key ({@code flow_start-json-log}, {@code eve-log.flow_start})
 * @param parentName parent output name, or {@code null} for root modules
 * @param rootFactory factory for root modules, otherwise {@code null}
 * @param subFactory factory for sub-modules, otherwise {@code null}
 * @param logger packet callbacks shared by both variants
 * @param <T> per-worker thread state of the logger
 * @since 0.1.0
 */
public record PacketModuleRegistration<T>(
    String moduleName,
    String confName,
    String parentName,
    ModuleContextFactory rootFactory,
    SubModuleContextFactory subFactory,
    PacketLogger<T> logger) {

  /**
   * Validates that exactly one construction variant is present.
   */
  public PacketModuleRegistration {
    Objects.requireNonNull(moduleName, "moduleName");
    Objects.requireNonNull(confName, "confName");
    Objects.requireNonNull(logger, "logger");
    if (parentName == null) {
      if (rootFactory == null || subFactory != null) {
        throw new IllegalArgumentException("root module " + confName + " needs exactly a root factory");
      }
    } else if (subFactory == null || rootFactory != null) {
      throw new IllegalArgumentException("sub-module " + confName + " needs exactly a sub-module factory");
    }
  }

  /** @return {@code true} when nested under a parent output */
  public boolean isSubModule() {
    return parentName != null;
  }
}
