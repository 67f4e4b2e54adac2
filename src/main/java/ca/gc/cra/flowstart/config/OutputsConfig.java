package ca.gc.cra.flowstart.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable runtime configuration for the output subsystem.
 *
 * @param defaultLogDir directory used to resolve relative sink filenames
 * @param engineMode engine operating mode injected into output conditions
 * @param outputs configured outputs in declaration order
 * @param verboseLogging whether {@code logging.verbose} asks for DEBUG logging at startup
 * @since 0.1.0
 */
public record OutputsConfig(
    Path defaultLogDir, EngineMode engineMode, List<OutputConfig> outputs, boolean verboseLogging) {

  /** Directory used when {@code default-log-dir} is not configured. */
  public static final Path DEFAULT_LOG_DIR = Path.of("/var/log/flowstart");

  /**
   * Copies and validates components.
   */
  public OutputsConfig {
    Objects.requireNonNull(defaultLogDir, "defaultLogDir");
    Objects.requireNonNull(engineMode, "engineMode");
    outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
  }

  /**
   * Creates a configuration with verbose logging off.
   *
   * @param defaultLogDir directory used to resolve relative sink filenames
   * @param engineMode engine operating mode
   * @param outputs configured outputs in declaration order
   */
  public OutputsConfig(Path defaultLogDir, EngineMode engineMode, List<OutputConfig> outputs) {
    this(defaultLogDir, engineMode, outputs, false);
  }
}
