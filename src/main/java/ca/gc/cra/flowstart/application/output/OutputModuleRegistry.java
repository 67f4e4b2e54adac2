package ca.gc.cra.flowstart.application.output;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of packet output modules and parent outputs, keyed by configuration name.
 * <p>Populated once during startup before any worker runs; not thread-safe for concurrent registration.</p>
 *
 * @since 0.1.0
 */
public final class OutputModuleRegistry {
  private static final Logger log = LoggerFactory.getLogger(OutputModuleRegistry.class);

  private final Map<String, PacketModuleRegistration<?>> modules = new LinkedHashMap<>();
  private final Map<String, ParentContextFactory> parents = new LinkedHashMap<>();

  /**
   * Registers a standalone packet module.
   *
   * @param moduleName module name
   * @param confName configuration key of the module's output section
   * @param factory context constructor
   * @param logger packet callbacks
   * @param <T> thread state type
   * @throws IllegalStateException if {@code confName} is already registered
   */
  public <T> void registerPacketModule(
      String moduleName, String confName, ModuleContextFactory factory, PacketLogger<T> logger) {
    add(new PacketModuleRegistration<>(moduleName, confName, null, factory, null, logger));
  }

  /**
   * Registers a packet module nested under a parent output.
   *
   * @param parentName parent output name (e.g., {@code eve-log})
   * @param moduleName module name
   * @param confName configuration key, conventionally {@code <parent>.<type>}
   * @param factory sub-module context constructor
   * @param logger packet callbacks
   * @param <T> thread state type
   * @throws IllegalStateException if {@code confName} is already registered
   */
  public <T> void registerPacketSubModule(
      String parentName,
      String moduleName,
      String confName,
      SubModuleContextFactory factory,
      PacketLogger<T> logger) {
    Objects.requireNonNull(parentName, "parentName");
    add(new PacketModuleRegistration<>(moduleName, confName, parentName, null, factory, logger));
  }

  /**
   * Registers a parent multiplexing output.
   *
   * @param confName parent output name
   * @param factory parent constructor
   * @throws IllegalStateException if {@code confName} is already registered
   */
  public void registerParentOutput(String confName, ParentContextFactory factory) {
    Objects.requireNonNull(confName, "confName");
    Objects.requireNonNull(factory, "factory");
    if (parents.putIfAbsent(confName, factory) != null) {
      throw new IllegalStateException("Parent output already registered: " + confName);
    }
    log.debug("Registered parent output {}", confName);
  }

  private void add(PacketModuleRegistration<?> registration) {
    if (modules.putIfAbsent(registration.confName(), registration) != null) {
      throw new IllegalStateException("Output module already registered: " + registration.confName());
    }
    log.debug("Registered packet module {} as {}", registration.moduleName(), registration.confName());
  }

  /**
   * Looks up a module by configuration key.
   *
   * @param confName configuration key
   * @return registration if present
   */
  public Optional<PacketModuleRegistration<?>> module(String confName) {
    return Optional.ofNullable(modules.get(confName));
  }

  /**
   * Looks up a parent output.
   *
   * @param confName parent output name
   * @return parent factory if present
   */
  public Optional<ParentContextFactory> parent(String confName) {
    return Optional.ofNullable(parents.get(confName));
  }

  /** @return number of registered packet modules */
  public int moduleCount() {
    return modules.size();
  }
}
