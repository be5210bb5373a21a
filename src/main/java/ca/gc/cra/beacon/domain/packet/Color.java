package ca.gc.cra.beacon.domain.packet;

/**
 * RGBA background colour for log entries.
 *
 * @param red red channel 0-255
 * @param green green channel 0-255
 * @param blue blue channel 0-255
 * @param alpha alpha channel 0-255
 * @since 0.1.0
 */
public record Color(int red, int green, int blue, int alpha) {
  /** Marker telling the console to use its own default colour. */
  public static final Color DEFAULT = fromWire(0xFF000005);

  public Color {
    checkChannel("red", red);
    checkChannel("green", green);
    checkChannel("blue", blue);
    checkChannel("alpha", alpha);
  }

  /**
   * Creates an opaque colour.
   *
   * @param red red channel
   * @param green green channel
   * @param blue blue channel
   * @return colour with alpha 255
   */
  public static Color of(int red, int green, int blue) {
    return new Color(red, green, blue, 0xFF);
  }

  /**
   * Packs the channels as {@code r | g << 8 | b << 16 | a << 24}.
   *
   * @return packed wire value
   */
  public int toWire() {
    return red | (green << 8) | (blue << 16) | (alpha << 24);
  }

  public static Color fromWire(int packed) {
    return new Color(packed & 0xFF, (packed >>> 8) & 0xFF, (packed >>> 16) & 0xFF, (packed >>> 24) & 0xFF);
  }

  private static void checkChannel(String name, int value) {
    if (value < 0 || value > 255) {
      throw new IllegalArgumentException(name + " must be between 0 and 255 (was " + value + ")");
    }
  }
}
