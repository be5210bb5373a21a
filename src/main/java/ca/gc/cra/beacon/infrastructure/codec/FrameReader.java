package ca.gc.cra.beacon.infrastructure.codec;

import ca.gc.cra.beacon.application.port.ProtocolException;
import java.nio.charset.StandardCharsets;

/**
 * Bounds-checked little-endian cursor over a frame. Truncation surfaces as {@link ProtocolException}.
 */
final class FrameReader {
  private final byte[] data;
  private final int limit;
  private int readIndex;

  FrameReader(byte[] data, int offset, int limit) {
    this.data = data;
    this.readIndex = offset;
    this.limit = limit;
  }

  int readShort() throws ProtocolException {
    require(2);
    int value = (data[readIndex] & 0xFF) | ((data[readIndex + 1] & 0xFF) << 8);
    readIndex += 2;
    return value;
  }

  int readInt() throws ProtocolException {
    require(4);
    int value = (data[readIndex] & 0xFF)
        | ((data[readIndex + 1] & 0xFF) << 8)
        | ((data[readIndex + 2] & 0xFF) << 16)
        | ((data[readIndex + 3] & 0xFF) << 24);
    readIndex += 4;
    return value;
  }

  long readLong() throws ProtocolException {
    require(8);
    long value = 0;
    for (int i = 0; i < 8; i++) {
      value |= (data[readIndex + i] & 0xFFL) << (8 * i);
    }
    readIndex += 8;
    return value;
  }

  byte[] readBytes() throws ProtocolException {
    int length = readInt();
    if (length == -1) {
      return null;
    }
    if (length < 0) {
      throw new ProtocolException("negative field length " + length);
    }
    require(length);
    byte[] out = new byte[length];
    System.arraycopy(data, readIndex, out, 0, length);
    readIndex += length;
    return out;
  }

  String readString() throws ProtocolException {
    byte[] raw = readBytes();
    return raw == null ? null : new String(raw, StandardCharsets.UTF_8);
  }

  int remaining() {
    return limit - readIndex;
  }

  private void require(int count) throws ProtocolException {
    if (count > limit - readIndex) {
      throw new ProtocolException(
          "frame truncated: need " + count + " bytes at offset " + readIndex + ", limit " + limit);
    }
  }
}
