package ca.gc.cra.flowstart.infrastructure.net;

import jnr.ffi.Pointer;

/**
 * JNR-FFI binding for the libc network interface lookups used by the output modules.
 */
public interface LibC {
  /** Size of the buffer {@code if_indextoname} writes into, including the terminating NUL. */
  int IF_NAMESIZE = 16;

  /**
   * Maps an interface index to its name.
   *
   * @param ifindex kernel interface index
   * @param ifname buffer of at least {@link #IF_NAMESIZE} bytes receiving the NUL-terminated name
   * @return {@code ifname} on success or {@code null} when the index is unknown
   */
  Pointer if_indextoname(int ifindex, Pointer ifname);
}
