package ca.gc.cra.flowstart.infrastructure.sink;

import ca.gc.cra.flowstart.application.port.LogSink;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regular-file sink. Each record is written in one locked section so lines from different workers never
 * interleave.
 * <p>{@link #reopen()} closes and reopens the path in append mode, for use after external rotation.</p>
 */
public final class FileLogSink implements LogSink {
  private static final Logger log = LoggerFactory.getLogger(FileLogSink.class);

  private final Path path;
  private final ReentrantLock lock = new ReentrantLock();
  private FileChannel channel;
  private boolean closed;

  private FileLogSink(Path path, FileChannel channel) {
    this.path = path;
    this.channel = channel;
  }

  /**
   * Opens {@code path}, creating parent directories as needed.
   *
   * @param path target file
   * @param append {@code true} to keep existing content, {@code false} to truncate
   * @return open sink
   * @throws IOException if the file cannot be opened
   */
  public static FileLogSink open(Path path, boolean append) throws IOException {
    Objects.requireNonNull(path, "path");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return new FileLogSink(path, openChannel(path, append));
  }

  private static FileChannel openChannel(Path path, boolean append) throws IOException {
    OpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
    return FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode);
  }

  @Override
  public void write(byte[] buffer, int offset, int length) throws IOException {
    ByteBuffer src = ByteBuffer.wrap(buffer, offset, length);
    lock.lock();
    try {
      if (closed) {
        throw new IOException("sink closed: " + path);
      }
      while (src.hasRemaining()) {
        channel.write(src);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void reopen() throws IOException {
    lock.lock();
    try {
      if (closed) {
        throw new IOException("sink closed: " + path);
      }
      channel.close();
      channel = openChannel(path, true);
      log.info("Reopened log file {}", path);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String describe() {
    return path.toString();
  }

  /** @return file path */
  public Path path() {
    return path;
  }

  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      channel.close();
    } finally {
      lock.unlock();
    }
  }
}
