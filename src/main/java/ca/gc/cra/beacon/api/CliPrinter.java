package ca.gc.cra.beacon.api;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Stdout writer for usage text, send summaries and frame dumps.
 *
 * <p>Diagnostics go through SLF4J to stderr; only command results are printed here so they can be piped.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  public static void println(String line) {
    out().println(line);
  }

  /**
   * Formats with {@link Locale#ROOT} so numbers print the same on every host.
   *
   * @param format {@link String#format} pattern
   * @param args pattern arguments
   */
  public static void printf(String format, Object... args) {
    out().println(String.format(Locale.ROOT, format, args));
  }

  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = out();
    for (String line : lines) {
      writer.println(line);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = testWriter;
    return writer == null ? STDOUT : writer;
  }
}
