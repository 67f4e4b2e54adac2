package ca.gc.cra.flowstart.application.flowstart;

import ca.gc.cra.flowstart.application.output.JsonOutputContext;
import ca.gc.cra.flowstart.application.output.ModuleContext;
import ca.gc.cra.flowstart.application.output.OutputInitException;
import ca.gc.cra.flowstart.application.port.LogSink;
import ca.gc.cra.flowstart.application.port.LogSinkFactory;
import ca.gc.cra.flowstart.config.OutputConfig;
import ca.gc.cra.flowstart.config.SinkConfig;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The two ways of building the flow-start module context.
 *
 * @since 0.1.0
 */
public final class FlowStartContexts {
  /** Filename used by the standalone module when none is configured. */
  public static final String DEFAULT_LOG_FILENAME = "flowstart.json";

  private static final Logger log = LoggerFactory.getLogger(FlowStartContexts.class);

  private final LogSinkFactory sinks;

  /**
   * Creates the context factories.
   *
   * @param sinks factory used by the standalone variant
   */
  public FlowStartContexts(LogSinkFactory sinks) {
    this.sinks = Objects.requireNonNull(sinks, "sinks");
  }

  /**
   * Standalone variant: opens a dedicated sink, owned by the returned context.
   *
   * @param conf {@code flow_start-json-log} section
   * @return owning context
   * @throws OutputInitException if the sink options are invalid or the sink cannot be opened
   */
  public ModuleContext standalone(OutputConfig conf) throws OutputInitException {
    Objects.requireNonNull(conf, "conf");
    SinkConfig sinkConfig;
    try {
      sinkConfig = SinkConfig.from(conf);
    } catch (IllegalArgumentException ex) {
      throw new OutputInitException("Invalid sink options for " + conf.name(), ex);
    }
    LogSink sink = sinks.open(sinkConfig, DEFAULT_LOG_FILENAME);
    log.info("flow_start log writing to {}", sink.describe());
    return ModuleContext.owning(FlowStartLogRegistrar.MODULE_NAME, sink);
  }

  /**
   * Sub-module variant: borrows the parent's sink. Sink options in {@code conf} are ignored.
   *
   * @param conf entry listed under the parent's {@code types}
   * @param parent parent JSON output
   * @return borrowing context
   */
  public ModuleContext subModule(OutputConfig conf, JsonOutputContext parent) {
    Objects.requireNonNull(parent, "parent");
    return ModuleContext.borrowing(FlowStartLogRegistrar.MODULE_NAME, parent.sink());
  }
}
