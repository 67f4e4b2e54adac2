package ca.gc.cra.flowstart.application.output;

import ca.gc.cra.flowstart.config.OutputConfig;
import ca.gc.cra.flowstart.config.OutputsConfig;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instantiates the outputs named in configuration from the modules present in a registry.
 * <p>Parent outputs are opened first and each sub-module listed under their {@code types} borrows the
 * parent's sink. Unknown output names are logged and skipped. Any construction failure closes what was
 * already built and aborts setup.</p>
 *
 * @since 0.1.0
 */
public final class OutputSetup {
  private static final Logger log = LoggerFactory.getLogger(OutputSetup.class);

  private final OutputModuleRegistry registry;

  /**
   * Creates a setup bound to a registry.
   *
   * @param registry populated module registry
   */
  public OutputSetup(OutputModuleRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Activates every enabled output.
   *
   * @param config output configuration
   * @return activated outputs, owned by the caller
   * @throws OutputInitException if an enabled output fails to initialize
   */
  public ActiveOutputs initialize(OutputsConfig config) throws OutputInitException {
    Objects.requireNonNull(config, "config");
    List<ActiveModule<?>> modules = new ArrayList<>();
    List<JsonOutputContext> parents = new ArrayList<>();
    try {
      for (OutputConfig output : config.outputs()) {
        if (!output.enabled()) {
          log.debug("Output {} is disabled", output.name());
          continue;
        }
        Optional<ParentContextFactory> parentFactory = registry.parent(output.name());
        if (parentFactory.isPresent()) {
          JsonOutputContext parent = parentFactory.get().create(output);
          parents.add(parent);
          activateSubModules(output, parent, modules);
          continue;
        }
        Optional<PacketModuleRegistration<?>> registration = registry.module(output.name());
        if (registration.isEmpty() || registration.get().isSubModule()) {
          log.warn("No output module registered for {}; ignoring", output.name());
          continue;
        }
        modules.add(activate(registration.get(), registration.get().rootFactory().create(output)));
      }
    } catch (OutputInitException | RuntimeException ex) {
      abort(modules, parents, ex);
      throw ex;
    }
    log.info("Activated {} output module(s) under {} parent output(s)", modules.size(), parents.size());
    return new ActiveOutputs(modules, parents);
  }

  private void activateSubModules(
      OutputConfig parentConf, JsonOutputContext parent, List<ActiveModule<?>> modules)
      throws OutputInitException {
    for (OutputConfig type : parentConf.types()) {
      if (!type.enabled()) {
        continue;
      }
      String confName = parentConf.name() + "." + type.name();
      Optional<PacketModuleRegistration<?>> registration = registry.module(confName);
      if (registration.isEmpty()
          || !parentConf.name().equals(registration.get().parentName())) {
        log.warn("No sub-module registered for {}; ignoring", confName);
        continue;
      }
      ModuleContext context = registration.get().subFactory().create(type, parent);
      modules.add(activate(registration.get(), context));
    }
  }

  private static <T> ActiveModule<T> activate(PacketModuleRegistration<T> registration, ModuleContext context) {
    log.info("Output module {} enabled ({})", registration.confName(), context.ownership());
    return new ActiveModule<>(registration.confName(), registration.logger(), context);
  }

  private static void abort(List<ActiveModule<?>> modules, List<JsonOutputContext> parents, Exception cause) {
    try {
      new ActiveOutputs(modules, parents).close();
    } catch (IOException ex) {
      cause.addSuppressed(ex);
    }
  }
}
