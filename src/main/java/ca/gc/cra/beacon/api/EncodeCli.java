package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.port.ProtocolException;
import ca.gc.cra.beacon.application.session.SessionRegistry;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.LogEntry;
import ca.gc.cra.beacon.domain.packet.LogEntryType;
import ca.gc.cra.beacon.domain.packet.Packet;
import ca.gc.cra.beacon.domain.packet.PacketHeader;
import ca.gc.cra.beacon.domain.packet.ViewerId;
import ca.gc.cra.beacon.domain.packet.Watch;
import ca.gc.cra.beacon.domain.packet.WatchType;
import ca.gc.cra.beacon.infrastructure.codec.PacketCodec;
import ca.gc.cra.beacon.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import ca.gc.cra.beacon.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes a single log entry or watch into a wire frame and prints its size and hex dump.
 *
 * <p>Intended for inspecting the frame layout when debugging a console integration.</p>
 *
 * @since 0.1.0
 */
public final class EncodeCli {
  private static final Logger log = LoggerFactory.getLogger(EncodeCli.class);
  private static final int HEX_LINE_BYTES = 32;
  private static final String SUMMARY_USAGE =
      "usage: encode kind=log|watch [message=TEXT] [name=NAME value=VALUE] [level=LEVEL] [session=NAME] "
          + "[appName=NAME] [out=PATH] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      BEACON encode

      Usage:
        encode kind=log message="hello" [options]
        encode kind=watch name=retries value=3 [options]

      Options:
        kind=log|watch           Packet kind to encode (default log)
        message=TEXT             Log entry title (kind=log)
        name=NAME value=VALUE    Watch name and value (kind=watch)
        level=LEVEL              DEBUG|VERBOSE|MESSAGE|WARNING|ERROR|FATAL (default MESSAGE)
        session=NAME             Session name (default Main)
        appName=NAME             Application name (default beacon-cli)
        out=PATH                 Also write the raw frame to PATH
        --allow-overwrite        Permit replacing an existing out file
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private EncodeCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the encode command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Packet packet;
    Path out;
    try {
      Map<String, String> kv = input.options();
      String rawOut = kv.remove("out");
      out = rawOut == null ? null : Path.of(Strings.requireNonBlank("out", rawOut));
      packet = buildPacket(kv);
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown arguments: " + kv.keySet());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EncodedPacket encoded;
    try {
      encoded = new PacketCodec().encode(packet);
    } catch (ProtocolException ex) {
      log.error("Unable to encode {}: {}", packet.kind(), ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    }

    if (out != null) {
      if (Files.exists(out) && !input.hasFlag("--allow-overwrite")) {
        log.error("Output file {} exists; pass --allow-overwrite to replace it", out);
        return ExitCode.INVALID_ARGS;
      }
      try {
        Files.write(out, encoded.frame());
        log.info("Wrote {} bytes to {}", encoded.size(), out);
      } catch (IOException ex) {
        log.error("Unable to write frame to {}", out, ex);
        return ExitCode.IO_ERROR;
      }
    }

    CliPrinter.printf("kind=%s level=%s bytes=%d", encoded.kind(), encoded.level(), encoded.size());
    CliPrinter.printLines(hexLines(encoded.frame()));
    return ExitCode.SUCCESS;
  }

  static Packet buildPacket(Map<String, String> kv) {
    String kind = valueOr(kv.remove("kind"), "log").toLowerCase(Locale.ROOT);
    Level level = SendCli.SendRequest.parseLevel(kv.remove("level"));
    String session = valueOr(kv.remove("session"), SessionRegistry.MAIN);
    String appName = valueOr(kv.remove("appName"), "beacon-cli");
    PacketHeader header = PacketHeader.of(level, new SystemClockAdapter().nowMicros(), session);
    return switch (kind) {
      case "log" -> new LogEntry(
          header,
          LogEntryType.forLevel(level),
          ViewerId.TITLE,
          Strings.requireNonBlank("message", SendCli.SendRequest.require(kv, "message")),
          appName,
          "localhost",
          (int) ProcessHandle.current().pid(),
          (int) Thread.currentThread().getId(),
          null,
          0,
          null);
      case "watch" -> new Watch(
          header,
          Strings.requireNonBlank("name", SendCli.SendRequest.require(kv, "name")),
          SendCli.SendRequest.require(kv, "value"),
          WatchType.STRING,
          null,
          null);
      default -> throw new IllegalArgumentException("kind must be 'log' or 'watch' (was '" + kind + "')");
    };
  }

  static String[] hexLines(byte[] frame) {
    HexFormat hex = HexFormat.of().withDelimiter(" ");
    int lines = (frame.length + HEX_LINE_BYTES - 1) / HEX_LINE_BYTES;
    String[] out = new String[lines];
    for (int i = 0; i < lines; i++) {
      int from = i * HEX_LINE_BYTES;
      int to = Math.min(frame.length, from + HEX_LINE_BYTES);
      out[i] = String.format(Locale.ROOT, "%04x  %s", from, hex.formatHex(frame, from, to));
    }
    return out;
  }

  private static String valueOr(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
