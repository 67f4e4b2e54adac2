package ca.gc.cra.flowstart.config;

import ca.gc.cra.flowstart.application.flowstart.FlowStartCondition;
import ca.gc.cra.flowstart.application.flowstart.FlowStartContexts;
import ca.gc.cra.flowstart.application.flowstart.FlowStartLogRegistrar;
import ca.gc.cra.flowstart.application.flowstart.FlowStartLogger;
import ca.gc.cra.flowstart.application.flowstart.FlowStartRecordFormatter;
import ca.gc.cra.flowstart.application.output.JsonOutputContext;
import ca.gc.cra.flowstart.application.output.OutputModuleRegistry;
import ca.gc.cra.flowstart.application.port.InterfaceNameResolver;
import ca.gc.cra.flowstart.application.port.LogSinkFactory;
import ca.gc.cra.flowstart.application.port.MetricsPort;
import ca.gc.cra.flowstart.infrastructure.json.JsonEventHeaderBuilder;
import ca.gc.cra.flowstart.infrastructure.json.JsonRecordWriter;

/**
 * Registers the JSON outputs: the {@code eve-log} parent and the flow-start module.
 * <p>Only {@link CompositionRoot} touches this class, and only after the JSON serializer was found on the
 * class path, so the serializer classes are never linked when it is absent.</p>
 */
final class JsonOutputModules {
  private JsonOutputModules() {}

  static void register(
      OutputModuleRegistry registry,
      EngineMode engineMode,
      LogSinkFactory sinks,
      InterfaceNameResolver interfaces,
      MetricsPort metrics) {
    registry.registerParentOutput(JsonOutputContext.CONF_NAME, conf -> JsonOutputContext.open(conf, sinks));
    FlowStartLogger logger = new FlowStartLogger(
        new FlowStartCondition(engineMode),
        new FlowStartRecordFormatter(new JsonEventHeaderBuilder(), interfaces, new JsonRecordWriter(), metrics));
    FlowStartLogRegistrar.register(registry, logger, new FlowStartContexts(sinks), true);
  }
}
