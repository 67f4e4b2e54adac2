package ca.gc.cra.flowstart.config;

import ca.gc.cra.flowstart.application.output.ActiveOutputs;
import ca.gc.cra.flowstart.application.output.OutputInitException;
import ca.gc.cra.flowstart.application.output.OutputModuleRegistry;
import ca.gc.cra.flowstart.application.output.OutputSetup;
import ca.gc.cra.flowstart.application.pipeline.PacketOutputWorker;
import ca.gc.cra.flowstart.application.port.InterfaceNameResolver;
import ca.gc.cra.flowstart.application.port.LogSinkFactory;
import ca.gc.cra.flowstart.application.port.MetricsPort;
import ca.gc.cra.flowstart.infrastructure.json.JsonSupport;
import ca.gc.cra.flowstart.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.flowstart.infrastructure.net.InterfaceNameResolvers;
import ca.gc.cra.flowstart.infrastructure.sink.LogSinks;
import ca.gc.cra.flowstart.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the output registry, the flow-start module and its adapters from an
 * {@link OutputsConfig}.
 * <p><strong>Role:</strong> Startup composition root; host engines call {@link #startOutputs()} once and
 * create one {@link PacketOutputWorker} per packet thread.</p>
 * <p><strong>Thread-safety:</strong> Construct and start on a single thread; the returned workers are
 * confined to their threads.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final OutputsConfig config;
  private final MetricsPort metrics;
  private final LogSinkFactory sinks;
  private final InterfaceNameResolver interfaces;
  private final boolean jsonAvailable;

  /**
   * Creates a composition root using the OpenTelemetry metrics adapter and the platform interface lookup.
   *
   * @param config output configuration
   */
  public CompositionRoot(OutputsConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), InterfaceNameResolvers.detect());
  }

  /**
   * Creates a composition root with explicit metrics and interface lookup.
   *
   * @param config output configuration
   * @param metrics metrics port handed to loggers and workers
   * @param interfaces interface index lookup
   */
  public CompositionRoot(OutputsConfig config, MetricsPort metrics, InterfaceNameResolver interfaces) {
    this(config, metrics, interfaces, new LogSinks(config.defaultLogDir()), JsonSupport.isAvailable());
  }

  CompositionRoot(
      OutputsConfig config,
      MetricsPort metrics,
      InterfaceNameResolver interfaces,
      LogSinkFactory sinks,
      boolean jsonAvailable) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.interfaces = Objects.requireNonNull(interfaces, "interfaces");
    this.sinks = Objects.requireNonNull(sinks, "sinks");
    this.jsonAvailable = jsonAvailable;
    if (config.verboseLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  /**
   * Builds a registry holding the {@code eve-log} parent and every available module. Without a JSON
   * serializer on the class path the registry stays empty and configured JSON outputs are skipped.
   *
   * @return populated registry
   */
  public OutputModuleRegistry registry() {
    OutputModuleRegistry registry = new OutputModuleRegistry();
    if (jsonAvailable) {
      JsonOutputModules.register(registry, config.engineMode(), sinks, interfaces, metrics);
    } else {
      log.debug("JSON support unavailable; JSON outputs not registered");
    }
    log.debug("Registry holds {} packet module(s)", registry.moduleCount());
    return registry;
  }

  /**
   * Activates the configured outputs.
   *
   * @return active outputs; the caller closes them at shutdown after every worker is closed
   * @throws OutputInitException if an enabled output cannot be initialized
   */
  public ActiveOutputs startOutputs() throws OutputInitException {
    return new OutputSetup(registry()).initialize(config);
  }

  /**
   * Reopens the sinks of the active outputs after external log rotation.
   *
   * @param outputs active outputs from {@link #startOutputs()}
   * @throws IOException the first reopen failure, with later failures suppressed
   */
  public void rotateLogs(ActiveOutputs outputs) throws IOException {
    Objects.requireNonNull(outputs, "outputs").reopen();
  }

  /**
   * Creates a worker bound to the calling packet thread.
   *
   * @param outputs active outputs from {@link #startOutputs()}
   * @return worker holding per-thread state for every active module
   */
  public PacketOutputWorker newWorker(ActiveOutputs outputs) {
    return new PacketOutputWorker(outputs, metrics);
  }

  /** @return metrics port shared by the wired components */
  public MetricsPort metrics() {
    return metrics;
  }
}
