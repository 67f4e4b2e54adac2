package ca.gc.cra.flowstart.application.port;

/**
 * <strong>What:</strong> Read-only view of the engine's operating mode.
 * <p><strong>Why:</strong> Output conditions depend on inline operation; injecting the mode keeps them
 * deterministic under test.</p>
 * <p><strong>Thread-safety:</strong> Must be safe for concurrent reads from every worker thread.</p>
 * <p><strong>Performance:</strong> Queried once per packet; must be a plain field read.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EngineModePort {
  /**
   * Indicates whether the engine runs inline (IPS), able to block traffic.
   *
   * @return {@code true} in inline mode, {@code false} when passively monitoring
   */
  boolean inline();
}
