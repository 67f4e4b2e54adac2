package ca.gc.cra.flowstart.infrastructure.net;

import ca.gc.cra.flowstart.application.port.InterfaceNameResolver;
import java.util.Objects;
import java.util.Optional;
import jnr.ffi.LibraryLoader;
import jnr.ffi.Memory;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;

/**
 * Resolves interface names through libc {@code if_indextoname}. Each thread reuses its own native
 * name buffer, so lookups do not allocate native memory after the first call on a thread.
 */
public final class LibcInterfaceNameResolver implements InterfaceNameResolver {
  private final LibC libc;
  private final ThreadLocal<Pointer> scratch;

  /**
   * Loads libc.
   *
   * @throws UnsatisfiedLinkError if libc cannot be loaded on this platform
   */
  public LibcInterfaceNameResolver() {
    this(LibraryLoader.create(LibC.class).load("c"));
  }

  LibcInterfaceNameResolver(LibC libc) {
    this.libc = Objects.requireNonNull(libc, "libc");
    Runtime runtime = Runtime.getSystemRuntime();
    this.scratch = ThreadLocal.withInitial(() -> Memory.allocateDirect(runtime, LibC.IF_NAMESIZE));
  }

  @Override
  public Optional<String> nameOf(int interfaceIndex) {
    if (interfaceIndex <= 0) {
      return Optional.empty();
    }
    Pointer name = libc.if_indextoname(interfaceIndex, scratch.get());
    if (name == null) {
      return Optional.empty();
    }
    String value = name.getString(0);
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }
}
