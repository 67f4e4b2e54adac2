package ca.gc.cra.flowstart.config;

import ca.gc.cra.flowstart.application.port.EngineModePort;
import java.util.Locale;

/**
 * <strong>What:</strong> Engine operating modes recognised in configuration.
 * <p><strong>Role:</strong> Fixed at startup and injected into output conditions as an {@link EngineModePort}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum EngineMode implements EngineModePort {
  /** Passive monitoring; traffic cannot be blocked. */
  IDS(false),
  /** Inline operation; the engine can drop traffic. */
  IPS(true);

  private final boolean inline;

  EngineMode(boolean inline) {
    this.inline = inline;
  }

  @Override
  public boolean inline() {
    return inline;
  }

  /**
   * Parses a configured mode name.
   *
   * @param raw value such as {@code ips}, {@code inline} or {@code ids}; blank selects {@link #IDS}
   * @return matching mode
   * @throws IllegalArgumentException if the value is not recognised
   */
  public static EngineMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return IDS;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "ips", "inline" -> IPS;
      case "ids", "passive" -> IDS;
      default -> throw new IllegalArgumentException("Unknown engine mode: " + raw);
    };
  }
}
