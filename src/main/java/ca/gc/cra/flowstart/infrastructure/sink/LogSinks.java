package ca.gc.cra.flowstart.infrastructure.sink;

import ca.gc.cra.flowstart.application.output.OutputInitException;
import ca.gc.cra.flowstart.application.port.LogSink;
import ca.gc.cra.flowstart.application.port.LogSinkFactory;
import ca.gc.cra.flowstart.config.SinkConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.kafka.common.KafkaException;

/**
 * Opens sinks for every supported {@code filetype}. Relative filenames resolve against the default log
 * directory.
 */
public final class LogSinks implements LogSinkFactory {
  private final Path defaultLogDir;

  /**
   * Creates a factory.
   *
   * @param defaultLogDir directory for relative filenames
   */
  public LogSinks(Path defaultLogDir) {
    this.defaultLogDir = Objects.requireNonNull(defaultLogDir, "defaultLogDir");
  }

  @Override
  public LogSink open(SinkConfig config, String defaultFilename) throws OutputInitException {
    Objects.requireNonNull(config, "config");
    switch (config.type()) {
      case REGULAR -> {
        Path path = config.resolvePath(defaultLogDir, defaultFilename);
        try {
          return FileLogSink.open(path, config.append());
        } catch (IOException ex) {
          throw new OutputInitException("Failed to open log file " + path, ex);
        }
      }
      case UNIX_STREAM -> {
        return new UnixSocketLogSink(config.resolvePath(defaultLogDir, defaultFilename));
      }
      case KAFKA -> {
        try {
          return KafkaLogSink.connect(config.kafkaBootstrapServers(), config.kafkaTopic());
        } catch (IllegalArgumentException | KafkaException ex) {
          throw new OutputInitException("Failed to create Kafka sink", ex);
        }
      }
      default -> throw new OutputInitException("Unsupported filetype " + config.type());
    }
  }
}
