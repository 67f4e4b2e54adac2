package ca.gc.cra.flowstart.application.output;

import ca.gc.cra.flowstart.domain.packet.PacketView;
import java.io.IOException;

/**
 * <strong>What:</strong> Callbacks a packet output module supplies to the host pipeline.
 * <p><strong>Role:</strong> The host evaluates {@link #condition(PacketView)} for every packet and, when it
 * holds, calls {@link #log(Object, PacketView)} with the calling worker's thread state.</p>
 * <p><strong>Thread-safety:</strong> {@code condition} and {@code log} run concurrently on every worker; thread
 * state {@code T} is confined to the worker that created it.</p>
 * <p><strong>Performance:</strong> {@code condition} is on the hot path and must not allocate.</p>
 *
 * @param <T> per-worker thread state
 * @since 0.1.0
 */
public interface PacketLogger<T> {
  /**
   * Decides whether the packet produces an event.
   *
   * @param packet packet under inspection
   * @return {@code true} to invoke {@link #log(Object, PacketView)}
   */
  boolean condition(PacketView packet);

  /**
   * Emits the event for a packet accepted by {@link #condition(PacketView)}.
   *
   * @param thread calling worker's state
   * @param packet triggering packet
   * @throws IOException if the sink write fails; reported once per failed write
   */
  void log(T thread, PacketView packet) throws IOException;

  /**
   * Creates thread state for a worker starting up.
   *
   * @param context module context; must not be {@code null}
   * @return new thread state
   */
  T threadInit(ModuleContext context);

  /**
   * Releases thread state when a worker exits. Must accept {@code null}.
   *
   * @param thread state returned by {@link #threadInit(ModuleContext)}, or {@code null}
   */
  void threadDeinit(T thread);
}
