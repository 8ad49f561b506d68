package ca.gc.cra.portalwatch.api;

import ca.gc.cra.portalwatch.config.CompositionRoot;
import ca.gc.cra.portalwatch.config.ConfigMerger;
import ca.gc.cra.portalwatch.config.Defaults;
import ca.gc.cra.portalwatch.config.ValidationConfig;
import ca.gc.cra.portalwatch.config.YamlConfigLoader;
import ca.gc.cra.portalwatch.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.portalwatch.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code check} and {@code watch} commands.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final Logger log = LoggerFactory.getLogger(CheckCli.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final String SUMMARY_USAGE =
      "usage: portalwatch <check|watch> [dns=IP,...] [iface=NAME] [ifindex=N] [mode=full|http-only|disabled] "
          + "[config=PATH] [--dry-run] [--verbose] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      portalwatch captive portal detection

      Usage:
        portalwatch check dns=8.8.8.8 [options]
        portalwatch watch dns=8.8.8.8 [options]

      Commands:
        check     Validate until online or maxAttempts, print the verdict and exit
                  (0 online, 10 redirect-found, 11 no-connectivity)
        watch     Keep validating and print every state transition until interrupted

      Options (validated):
        dns=IP[,IP...]           Resolvers of the interface; required for validation to start
        iface=NAME               Interface name used in log tags (default eth0)
        ifindex=N                Interface index (default 1)
        ipFamily=IPV4|IPV6       Address family to probe over (default IPV4)
        mode=full|http-only|disabled  Validation mode (default full)
        httpUrl=URL              Primary HTTP probe URL
        httpsUrl=URL             Primary HTTPS probe URL
        fallbackHttpUrls=URL,... Fallback HTTP probe URLs
        fallbackHttpsUrls=URL,.. Fallback HTTPS probe URLs
        probeTimeoutMs=N         Per-probe timeout (default 10000)
        backoffInitialMs=N       First retry interval (default 3000)
        backoffMaxMs=N           Maximum retry interval (default 300000)
        maxAttempts=N            check gives up after N attempts; 0 = unbounded (default 3)
        retryOnFailure=BOOL      Retry after a verdict other than online (default true)
        validationLogCapacity=N  Retained validation results (default 25)
        userAgent=TEXT           User-Agent sent with probes
        config=PATH              YAML file with common/check/watch sections
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                Print the effective configuration and exit
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private CheckCli() {}

  /**
   * Runs {@code check} or {@code watch}.
   *
   * @param command {@code check} or {@code watch}
   * @param args arguments following the command
   * @return exit code capturing the outcome
   */
  static ExitCode run(String command, String[] args) {
    String normalized = command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
    if (!Defaults.COMMANDS.contains(normalized)) {
      log.error("Unknown command: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", normalized);
    }

    Map<String, String> kv;
    Optional<Path> configPath;
    try {
      kv = CliArgsParser.toMap(input.settings());
      configPath = takeConfigPath(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath.isPresent()) {
      Path yamlPath = configPath.get();
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, normalized);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          yamlConfig, kv, Defaults.asFlatMap(normalized), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", normalized, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    TelemetrySettings telemetry;
    ValidationConfig config;
    try {
      telemetry = TelemetryConfigurator.configureMetrics(configInputs);
      config = ValidationConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", normalized, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return yamlConfig.isPresent() ? ExitCode.CONFIG_ERROR : ExitCode.INVALID_ARGS;
    }

    if (input.dryRun()) {
      printDryRunPlan(normalized, config, telemetry);
      return ExitCode.SUCCESS;
    }
    if (config.dnsServers().isEmpty()) {
      log.warn("No dns servers configured; validation cannot start (set dns=IP[,IP...])");
    }

    ValidationSession.Kind kind =
        normalized.equals("watch") ? ValidationSession.Kind.WATCH : ValidationSession.Kind.CHECK;
    try (CompositionRoot root = CompositionRoot.create(config, telemetry)) {
      return runSession(root, kind);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", normalized, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Removes {@code config} from the settings; it names the YAML source and is not itself a setting.
   */
  private static Optional<Path> takeConfigPath(Map<String, String> kv) {
    String value = kv.remove("config");
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(value.trim()));
  }

  private static ExitCode runSession(CompositionRoot root, ValidationSession.Kind kind) {
    ValidationSession session = new ValidationSession(root, kind);
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      session.finish(ExitCode.SUCCESS);
      try {
        if (!finished.await(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Shutdown did not finish within {} ms", SHUTDOWN_TIMEOUT.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "portalwatch-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      log.info("Validating {} (ifindex={}, mode={})",
          root.config().iface(), root.config().ifindex(), root.config().mode());
      session.start();
      ExitCode code = session.await();
      session.stop(SHUTDOWN_TIMEOUT);
      log.info("Finished after {} attempt(s): {}", session.attempts(), code);
      return code;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Validation interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException ex) {
      log.error("Validation failed", ex.getCause());
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; leaving shutdown hook registered");
    }
  }

  private static void printDryRunPlan(String command, ValidationConfig config, TelemetrySettings telemetry) {
    List<String> lines = new ArrayList<>();
    lines.add("portalwatch " + command + " dry-run: no probes will be sent.");
    config.describe().forEach((key, value) -> lines.add(String.format(Locale.ROOT, " %-22s: %s", key, value)));
    lines.add(String.format(Locale.ROOT, " %-22s: %s", "metricsExporter",
        telemetry.exporter().name().toLowerCase(Locale.ROOT)));
    lines.add(String.format(Locale.ROOT, " %-22s: %s", "otelEndpoint", telemetry.endpoint()));
    lines.add(" Re-run without --dry-run to validate.");
    CliPrinter.printLines(lines);
  }
}
