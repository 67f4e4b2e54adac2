package ca.gc.cra.flowstart.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed sink options of an output section.
 * <p><strong>Role:</strong> Input to {@code LogSinkFactory} when a context opens its own sink.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param type transport selected by {@code filetype}
 * @param filename configured file or socket name; {@code null} selects the module default
 * @param append whether regular files are appended to rather than truncated
 * @param kafkaBootstrapServers bootstrap servers for {@link SinkType#KAFKA}; may be {@code null}
 * @param kafkaTopic topic for {@link SinkType#KAFKA}; may be {@code null}
 * @since 0.1.0
 */
public record SinkConfig(
    SinkType type,
    String filename,
    boolean append,
    String kafkaBootstrapServers,
    String kafkaTopic) {

  /**
   * Validates the record.
   */
  public SinkConfig {
    Objects.requireNonNull(type, "type");
    if (filename != null && filename.isBlank()) {
      filename = null;
    }
  }

  /**
   * Reads sink options from an output section.
   *
   * @param conf output section
   * @return typed sink configuration
   * @throws IllegalArgumentException if {@code filetype} is invalid
   */
  public static SinkConfig from(OutputConfig conf) {
    Objects.requireNonNull(conf, "conf");
    return new SinkConfig(
        SinkType.parse(conf.get("filetype")),
        conf.get("filename"),
        conf.getBoolean("append", true),
        conf.get("kafka.bootstrap-servers"),
        conf.get("kafka.topic"));
  }

  /**
   * Resolves the file or socket path, applying the module default filename and the default log
   * directory to relative names.
   *
   * @param defaultLogDir directory for relative names
   * @param defaultFilename name used when none is configured
   * @return resolved path
   */
  public Path resolvePath(Path defaultLogDir, String defaultFilename) {
    Objects.requireNonNull(defaultLogDir, "defaultLogDir");
    String name = filename != null ? filename : Objects.requireNonNull(defaultFilename, "defaultFilename");
    Path path = Path.of(name);
    return path.isAbsolute() ? path : defaultLogDir.resolve(path);
  }
}
