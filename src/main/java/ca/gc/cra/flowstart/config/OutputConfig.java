package ca.gc.cra.flowstart.config;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One configured output (or sub-output listed under a parent's {@code types}).
 * <p><strong>Why:</strong> Gives module constructors typed access to their section instead of a raw tree.</p>
 * <p><strong>Role:</strong> Configuration record consumed by output context factories.</p>
 * <p><strong>Thread-safety:</strong> Immutable; options and types are defensively copied.</p>
 *
 * @param name output name as written in configuration (e.g., {@code eve-log}, {@code flow_start})
 * @param options flattened scalar options; nested mappings use dotted keys
 * @param types sub-outputs listed under {@code types}; empty for leaf outputs
 * @since 0.1.0
 */
public record OutputConfig(String name, Map<String, String> options, List<OutputConfig> types) {

  /**
   * Copies and validates components.
   */
  public OutputConfig {
    Objects.requireNonNull(name, "name");
    options = Map.copyOf(Objects.requireNonNull(options, "options"));
    types = List.copyOf(Objects.requireNonNull(types, "types"));
  }

  /**
   * Creates a leaf output section.
   *
   * @param name output name
   * @param options scalar options
   * @return output configuration without sub-outputs
   */
  public static OutputConfig of(String name, Map<String, String> options) {
    return new OutputConfig(name, options, List.of());
  }

  /**
   * Returns a raw option value.
   *
   * @param key option key (dotted for nested options)
   * @return value or {@code null} when absent
   */
  public String get(String key) {
    return options.get(key);
  }

  /**
   * Parses a boolean option, accepting {@code yes/no}, {@code true/false}, {@code on/off} and {@code 1/0}.
   *
   * @param key option key
   * @param defaultValue value used when the option is absent or blank
   * @return parsed value
   * @throws IllegalArgumentException if the value is not a recognised boolean
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "yes", "true", "on", "1" -> true;
      case "no", "false", "off", "0" -> false;
      default -> throw new IllegalArgumentException(
          "Option " + name + "." + key + " is not a boolean: " + raw);
    };
  }

  /**
   * Indicates whether the output is enabled. Outputs without an {@code enabled} option are enabled.
   *
   * @return {@code true} when enabled
   */
  public boolean enabled() {
    return getBoolean("enabled", true);
  }
}
