package ca.gc.cra.flowstart.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Platform capability translating OS interface indexes into interface names.
 * <p><strong>Why:</strong> Inline capture methods report the ingress interface by index; events carry the
 * name.</p>
 * <p><strong>Role:</strong> Optional capability; {@link #NONE} stands in where the platform offers no lookup.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface InterfaceNameResolver {
  /**
   * Resolves an interface index.
   *
   * @param index OS interface index; non-positive values never resolve
   * @return interface name, or empty when the index is unknown
   */
  Optional<String> nameOf(int index);

  /**
   * Indicates whether the platform supports index lookups at all.
   *
   * @return {@code false} for {@link #NONE}
   */
  default boolean available() {
    return true;
  }

  /**
   * Resolver used when the platform has no index-to-name lookup.
   */
  InterfaceNameResolver NONE = new InterfaceNameResolver() {
    @Override
    public Optional<String> nameOf(int index) {
      return Optional.empty();
    }

    @Override
    public boolean available() {
      return false;
    }
  };
}
