package ca.gc.cra.flowstart.application.pipeline;

import ca.gc.cra.flowstart.application.output.ActiveModule;
import ca.gc.cra.flowstart.application.output.ActiveOutputs;
import ca.gc.cra.flowstart.application.output.PacketLogger;
import ca.gc.cra.flowstart.application.port.MetricsPort;
import ca.gc.cra.flowstart.domain.packet.PacketView;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the active packet output modules on behalf of one host worker thread.
 * <p>Construct on the worker thread that will call {@link #process(PacketView)}; the per-module thread
 * state created here must never be touched by another thread. {@link #close()} must run on the same thread
 * after the worker stops receiving packets.</p>
 * <p>A sink failure is counted under {@code output.<module>.write.failed}, logged, and does not stop the
 * remaining modules or later packets.</p>
 *
 * @since 0.1.0
 */
public final class PacketOutputWorker implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PacketOutputWorker.class);

  private final List<BoundLogger<?>> loggers;
  private final MetricsPort metrics;
  private boolean closed;

  /**
   * Initializes thread state for every active module. If one module fails, state already created is
   * released and the failure propagates, preventing the worker from starting.
   *
   * @param outputs activated outputs
   * @param metrics metrics sink; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public PacketOutputWorker(ActiveOutputs outputs, MetricsPort metrics) {
    Objects.requireNonNull(outputs, "outputs");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    List<BoundLogger<?>> bound = new ArrayList<>(outputs.modules().size());
    try {
      for (ActiveModule<?> module : outputs.modules()) {
        bound.add(bind(module));
      }
    } catch (RuntimeException | Error ex) {
      bound.forEach(BoundLogger::deinit);
      throw ex;
    }
    this.loggers = List.copyOf(bound);
  }

  private static <T> BoundLogger<T> bind(ActiveModule<T> module) {
    return new BoundLogger<>(module.name(), module.logger(), module.logger().threadInit(module.context()));
  }

  /**
   * Offers a packet to every module.
   *
   * @param packet packet delivered by the pipeline
   * @return number of modules that logged the packet successfully
   */
  public int process(PacketView packet) {
    Objects.requireNonNull(packet, "packet");
    if (closed) {
      throw new IllegalStateException("worker already closed");
    }
    int logged = 0;
    for (BoundLogger<?> logger : loggers) {
      if (!logger.condition(packet)) {
        continue;
      }
      try {
        logger.log(packet);
        logged++;
      } catch (IOException ex) {
        metrics.increment("output." + logger.name() + ".write.failed");
        log.warn("Output {} failed to write event for {}", logger.name(), packet.tuple(), ex);
      }
    }
    return logged;
  }

  /**
   * Releases per-module thread state. Repeated calls are ignored.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    loggers.forEach(BoundLogger::deinit);
  }

  private record BoundLogger<T>(String name, PacketLogger<T> logger, T state) {
    boolean condition(PacketView packet) {
      return logger.condition(packet);
    }

    void log(PacketView packet) throws IOException {
      logger.log(state, packet);
    }

    void deinit() {
      logger.threadDeinit(state);
    }
  }
}
