package ca.gc.cra.flowstart.config;

import java.util.Locale;

/**
 * Transports accepted by the {@code filetype} output option.
 *
 * @since 0.1.0
 */
public enum SinkType {
  /** Plain file, newline-delimited. */
  REGULAR("regular"),
  /** Unix domain stream socket, newline-delimited. */
  UNIX_STREAM("unix_stream"),
  /** Kafka topic, one message per record. */
  KAFKA("kafka");

  private final String configName;

  SinkType(String configName) {
    this.configName = configName;
  }

  /**
   * Returns the value used in configuration files.
   *
   * @return configuration name
   */
  public String configName() {
    return configName;
  }

  /**
   * Parses a {@code filetype} value. {@code file} is accepted as an alias for {@code regular}.
   *
   * @param raw configured value; blank selects {@link #REGULAR}
   * @return sink type
   * @throws IllegalArgumentException if the value is not a supported filetype
   */
  public static SinkType parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return REGULAR;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("file")) {
      return REGULAR;
    }
    for (SinkType type : values()) {
      if (type.configName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid entry for filetype: " + raw);
  }
}
