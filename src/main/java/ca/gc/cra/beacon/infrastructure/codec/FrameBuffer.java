package ca.gc.cra.beacon.infrastructure.codec;

import java.nio.charset.StandardCharsets;

/**
 * Expandable little-endian byte sink used to assemble one frame.
 * <p>Amortized O(1) appends with exponential growth; not thread-safe, one instance per encode call.</p>
 */
final class FrameBuffer {
  private static final int MAX_CAPACITY = 64 * 1024 * 1024;

  private byte[] data;
  private int writeIndex;

  FrameBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[initialCapacity];
  }

  void writeShort(int value) {
    ensureWritable(2);
    data[writeIndex++] = (byte) value;
    data[writeIndex++] = (byte) (value >>> 8);
  }

  void writeInt(int value) {
    ensureWritable(4);
    putInt(writeIndex, value);
    writeIndex += 4;
  }

  void writeLong(long value) {
    ensureWritable(8);
    for (int i = 0; i < 8; i++) {
      data[writeIndex++] = (byte) (value >>> (8 * i));
    }
  }

  /** Writes an {@code int32} length followed by the bytes; {@code null} becomes length -1. */
  void writeBytes(byte[] value) {
    if (value == null) {
      writeInt(-1);
      return;
    }
    writeInt(value.length);
    ensureWritable(value.length);
    System.arraycopy(value, 0, data, writeIndex, value.length);
    writeIndex += value.length;
  }

  void writeString(String value) {
    writeBytes(value == null ? null : value.getBytes(StandardCharsets.UTF_8));
  }

  int position() {
    return writeIndex;
  }

  /** Overwrites four bytes at {@code offset}; used to back-patch the body size. */
  void putInt(int offset, int value) {
    data[offset] = (byte) value;
    data[offset + 1] = (byte) (value >>> 8);
    data[offset + 2] = (byte) (value >>> 16);
    data[offset + 3] = (byte) (value >>> 24);
  }

  byte[] toByteArray() {
    byte[] out = new byte[writeIndex];
    System.arraycopy(data, 0, out, 0, writeIndex);
    return out;
  }

  private void ensureWritable(int minWritableBytes) {
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    long required = (long) writeIndex + minWritableBytes;
    if (required > MAX_CAPACITY) {
      throw new IllegalStateException("frame would exceed max size: " + required);
    }
    int newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity <<= 1;
    }
    byte[] next = new byte[Math.min(newCapacity, MAX_CAPACITY)];
    System.arraycopy(data, 0, next, 0, writeIndex);
    data = next;
  }
}
