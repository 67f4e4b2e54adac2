package ca.gc.cra.flowstart.infrastructure.sink;

import ca.gc.cra.flowstart.application.port.LogSink;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unix domain stream socket sink for a local collector.
 * <p>An unreachable collector at startup is not fatal: the sink connects lazily and reconnects once per
 * failed write before reporting the failure.</p>
 */
public final class UnixSocketLogSink implements LogSink {
  private static final Logger log = LoggerFactory.getLogger(UnixSocketLogSink.class);

  private final UnixDomainSocketAddress address;
  private final ReentrantLock lock = new ReentrantLock();
  private SocketChannel channel;
  private boolean closed;

  /**
   * Creates a sink for the socket at {@code path} and attempts an initial connection.
   *
   * @param path socket path
   */
  public UnixSocketLogSink(Path path) {
    this.address = UnixDomainSocketAddress.of(Objects.requireNonNull(path, "path"));
    lock.lock();
    try {
      connect();
    } catch (IOException ex) {
      log.warn("Unix socket {} not reachable yet; will retry on first write", path, ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void write(byte[] buffer, int offset, int length) throws IOException {
    lock.lock();
    try {
      if (closed) {
        throw new IOException("sink closed: " + address.getPath());
      }
      try {
        send(buffer, offset, length);
      } catch (IOException first) {
        disconnect();
        log.debug("Write to {} failed; reconnecting", address.getPath(), first);
        send(buffer, offset, length);
      }
    } finally {
      lock.unlock();
    }
  }

  private void send(byte[] buffer, int offset, int length) throws IOException {
    if (channel == null) {
      connect();
    }
    ByteBuffer src = ByteBuffer.wrap(buffer, offset, length);
    while (src.hasRemaining()) {
      channel.write(src);
    }
  }

  private void connect() throws IOException {
    SocketChannel candidate = SocketChannel.open(StandardProtocolFamily.UNIX);
    try {
      candidate.connect(address);
    } catch (IOException ex) {
      candidate.close();
      throw ex;
    }
    channel = candidate;
  }

  private void disconnect() {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException ex) {
      log.debug("Ignoring close failure on {}", address.getPath(), ex);
    }
    channel = null;
  }

  @Override
  public void reopen() throws IOException {
    lock.lock();
    try {
      if (closed) {
        throw new IOException("sink closed: " + address.getPath());
      }
      disconnect();
      connect();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String describe() {
    return "unix:" + address.getPath();
  }

  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      if (channel != null) {
        channel.close();
        channel = null;
      }
    } finally {
      lock.unlock();
    }
  }
}
