package ca.gc.cra.flowstart.infrastructure.buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * Reusable, growable scratch buffer used to serialize one record at a time.
 * <p>{@link #reset()} truncates logically and keeps the backing array, so a worker serializing events
 * of similar size stops allocating after the first few events. Not thread-safe; owned by one worker.
 */
public final class MemBuffer {
  private static final int MAX_CAPACITY = 32 * 1024 * 1024; // 32 MiB safety guard

  private byte[] data;
  private int length;
  private final OutputStream stream = new AppendingStream();

  /**
   * Creates a buffer with a fixed initial capacity.
   *
   * @param initialCapacity initial backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive or exceeds the guard
   */
  public MemBuffer(int initialCapacity) {
    if (initialCapacity <= 0 || initialCapacity > MAX_CAPACITY) {
      throw new IllegalArgumentException("initialCapacity out of range: " + initialCapacity);
    }
    data = new byte[initialCapacity];
  }

  /**
   * Discards the contents; capacity is retained.
   */
  public void reset() {
    length = 0;
  }

  /**
   * Appends a single byte, growing the buffer if required.
   *
   * @param value byte to append
   */
  public void write(byte value) {
    ensureWritable(1);
    data[length++] = value;
  }

  /**
   * Appends a region of {@code src}, growing the buffer if required.
   *
   * @param src source array; must not be {@code null}
   * @param offset starting offset within {@code src}
   * @param count number of bytes to append
   */
  public void write(byte[] src, int offset, int count) {
    Objects.requireNonNull(src, "src");
    if (offset < 0 || count < 0 || offset + count > src.length) {
      throw new IndexOutOfBoundsException("invalid offset/length");
    }
    if (count == 0) {
      return;
    }
    ensureWritable(count);
    System.arraycopy(src, offset, data, length, count);
    length += count;
  }

  /** @return number of bytes written since the last {@link #reset()} */
  public int length() {
    return length;
  }

  /** @return current backing array size */
  public int capacity() {
    return data.length;
  }

  /**
   * Provides the backing array for zero-copy hand-off; only the first {@link #length()} bytes are valid.
   *
   * @return backing array (do not retain)
   */
  public byte[] array() {
    return data;
  }

  /**
   * Copies the written bytes.
   *
   * @return fresh array holding the contents
   */
  byte[] toByteArray() {
    return Arrays.copyOf(data, length);
  }

  /**
   * Returns an {@link OutputStream} view appending to this buffer. Closing the view is a no-op.
   *
   * @return appending stream
   */
  public OutputStream asOutputStream() {
    return stream;
  }

  private void ensureWritable(int extra) {
    int required = length + extra;
    if (required <= data.length) {
      return;
    }
    if (required > MAX_CAPACITY || required < 0) {
      throw new IllegalStateException("MemBuffer would exceed " + MAX_CAPACITY + " bytes");
    }
    int newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity = Math.min(MAX_CAPACITY, newCapacity << 1);
    }
    data = Arrays.copyOf(data, newCapacity);
  }

  private final class AppendingStream extends OutputStream {
    @Override
    public void write(int b) {
      MemBuffer.this.write((byte) b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      MemBuffer.this.write(b, off, len);
    }

    @Override
    public void close() {
      // buffer outlives the stream view
    }
  }
}
