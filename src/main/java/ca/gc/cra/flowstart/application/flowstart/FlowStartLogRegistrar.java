package ca.gc.cra.flowstart.application.flowstart;

import ca.gc.cra.flowstart.application.output.OutputModuleRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the flow-start logger with the output registry, once standalone and once nested under
 * {@code eve-log}. Both registrations share the same logger instance.
 *
 * @since 0.1.0
 */
public final class FlowStartLogRegistrar {
  /** Module name used in logs. */
  public static final String MODULE_NAME = "JsonFlowstartLog";
  /** Configuration key of the standalone module. */
  public static final String STANDALONE_CONF_NAME = "flow_start-json-log";
  /** Parent output the sub-module nests under. */
  public static final String PARENT_NAME = "eve-log";
  /** Configuration key of the sub-module. */
  public static final String SUB_MODULE_CONF_NAME = PARENT_NAME + ".flow_start";

  private static final Logger log = LoggerFactory.getLogger(FlowStartLogRegistrar.class);

  private FlowStartLogRegistrar() {}

  /**
   * Registers both variants, or nothing when JSON output is unavailable at runtime.
   *
   * @param registry output registry
   * @param logger shared logger callbacks
   * @param contexts context factories
   * @param jsonAvailable whether the JSON serializer is present
   * @return {@code true} when the module was registered
   */
  public static boolean register(
      OutputModuleRegistry registry,
      FlowStartLogger logger,
      FlowStartContexts contexts,
      boolean jsonAvailable) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(logger, "logger");
    Objects.requireNonNull(contexts, "contexts");
    if (!jsonAvailable) {
      log.debug("JSON support unavailable; {} not registered", MODULE_NAME);
      return false;
    }
    registry.registerPacketModule(MODULE_NAME, STANDALONE_CONF_NAME, contexts::standalone, logger);
    registry.registerPacketSubModule(
        PARENT_NAME, MODULE_NAME, SUB_MODULE_CONF_NAME, contexts::subModule, logger);
    return true;
  }
}
