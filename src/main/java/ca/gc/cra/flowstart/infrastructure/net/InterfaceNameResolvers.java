package ca.gc.cra.flowstart.infrastructure.net;

import ca.gc.cra.flowstart.application.port.InterfaceNameResolver;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the interface name resolver available on the running platform.
 */
public final class InterfaceNameResolvers {
  private static final Logger log = LoggerFactory.getLogger(InterfaceNameResolvers.class);

  private InterfaceNameResolvers() {
    // Utility
  }

  /**
   * Returns the libc-backed resolver, or {@link InterfaceNameResolver#NONE} when the platform has no
   * {@code if_indextoname} or libc cannot be bound.
   *
   * @return resolver; never {@code null}
   */
  public static InterfaceNameResolver detect() {
    String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    if (osName.contains("win")) {
      log.debug("Interface name lookup not supported on {}", osName);
      return InterfaceNameResolver.NONE;
    }
    try {
      InterfaceNameResolver resolver = new LibcInterfaceNameResolver();
      // symbols bind on first call, so probe once here rather than on the packet path
      resolver.nameOf(1);
      return resolver;
    } catch (UnsatisfiedLinkError | RuntimeException ex) {
      log.debug("libc if_indextoname unavailable; in_dev will be omitted", ex);
      return InterfaceNameResolver.NONE;
    }
  }
}
