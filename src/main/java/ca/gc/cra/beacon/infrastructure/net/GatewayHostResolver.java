package ca.gc.cra.beacon.infrastructure.net;

import ca.gc.cra.beacon.application.port.HostResolver;
import ca.gc.cra.beacon.validation.Net;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HostResolver} that swaps loopback for the Windows host when running under WSL.
 * <p><strong>Why:</strong> Inside WSL, {@code 127.0.0.1} is the Linux VM, not the Windows desktop where the console
 * usually runs.</p>
 * <p><strong>Detection:</strong> {@code /proc/version} mentions {@code microsoft} or {@code wsl}. The host is then
 * the first private {@code nameserver} from {@code /etc/resolv.conf}, or failing that the {@code via} address of
 * {@code ip route show default}. The result is computed once and cached.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class GatewayHostResolver implements HostResolver {
  private static final Logger log = LoggerFactory.getLogger(GatewayHostResolver.class);
  private static final String LOOPBACK = "127.0.0.1";
  private static final Pattern NAMESERVER = Pattern.compile("^\\s*nameserver\\s+(\\S+)");
  private static final Pattern VIA = Pattern.compile("via\\s+(\\d+\\.\\d+\\.\\d+\\.\\d+)");
  private static final long ROUTE_TIMEOUT_SECONDS = 5;

  /** Runs {@code ip route show default}; replaceable for tests. */
  @FunctionalInterface
  interface RouteLookup {
    String defaultRoute() throws IOException;
  }

  private final Path procVersion;
  private final Path resolvConf;
  private final RouteLookup routeLookup;
  private volatile Optional<String> gateway;

  public GatewayHostResolver() {
    this(Path.of("/proc/version"), Path.of("/etc/resolv.conf"), GatewayHostResolver::runIpRoute);
  }

  GatewayHostResolver(Path procVersion, Path resolvConf, RouteLookup routeLookup) {
    this.procVersion = Objects.requireNonNull(procVersion, "procVersion");
    this.resolvConf = Objects.requireNonNull(resolvConf, "resolvConf");
    this.routeLookup = Objects.requireNonNull(routeLookup, "routeLookup");
  }

  @Override
  public String resolve(String configuredHost) {
    boolean auto = configuredHost == null || configuredHost.isBlank();
    if (!auto && !Net.isLoopback(configuredHost.trim())) {
      return configuredHost.trim();
    }
    Optional<String> detected = gateway();
    if (detected.isPresent()) {
      return detected.get();
    }
    return auto ? LOOPBACK : configuredHost.trim();
  }

  Optional<String> gateway() {
    Optional<String> cached = gateway;
    if (cached == null) {
      cached = detect();
      gateway = cached;
      cached.ifPresent(ip -> log.info("WSL detected; console host resolved to Windows gateway {}", ip));
    }
    return cached;
  }

  private Optional<String> detect() {
    if (!isWsl()) {
      return Optional.empty();
    }
    Optional<String> nameserver = privateNameserver();
    if (nameserver.isPresent()) {
      return nameserver;
    }
    try {
      String routes = routeLookup.defaultRoute();
      Matcher matcher = VIA.matcher(routes == null ? "" : routes);
      if (matcher.find()) {
        return Optional.of(matcher.group(1));
      }
    } catch (IOException ex) {
      log.debug("Default route lookup failed: {}", ex.getMessage());
    }
    return Optional.empty();
  }

  private boolean isWsl() {
    try {
      String version = Files.readString(procVersion, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
      return version.contains("microsoft") || version.contains("wsl");
    } catch (IOException ex) {
      return false;
    }
  }

  private Optional<String> privateNameserver() {
    List<String> lines;
    try {
      lines = Files.readAllLines(resolvConf, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      log.debug("Cannot read {}: {}", resolvConf, ex.getMessage());
      return Optional.empty();
    }
    for (String line : lines) {
      Matcher matcher = NAMESERVER.matcher(line);
      if (matcher.find() && Net.isPrivateIpv4(matcher.group(1))) {
        return Optional.of(matcher.group(1));
      }
    }
    return Optional.empty();
  }

  private static String runIpRoute() throws IOException {
    Process process = new ProcessBuilder("ip", "route", "show", "default").redirectErrorStream(true).start();
    try (InputStream in = process.getInputStream()) {
      String output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      if (!process.waitFor(ROUTE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException("ip route timed out");
      }
      return output;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new IOException("interrupted running ip route", ex);
    }
  }
}
