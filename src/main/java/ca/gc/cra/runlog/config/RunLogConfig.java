package ca.gc.cra.runlog.config;

import ca.gc.cra.runlog.application.LoggerRegistry;
import ca.gc.cra.runlog.domain.ConsoleTarget;
import ca.gc.cra.runlog.domain.LogFormat;
import ca.gc.cra.runlog.domain.Severity;
import ca.gc.cra.runlog.domain.SinkKind;
import ca.gc.cra.runlog.validation.Names;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable description of a registry setup: base directory, run name, loggers, and their
 * handlers.
 * <p><strong>Why:</strong> Lets operators declare log outputs in YAML instead of code.</p>
 * <p><strong>Role:</strong> Configuration value consumed by {@link RunLogBootstrap}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> Unknown keys are logged at warn level and ignored.</p>
 *
 * <p>Recognized flat keys (as produced by {@link YamlConfigLoader}):</p>
 * <pre>
 * baseDir: data/logs
 * runName: nightly
 * loggers.&lt;logger&gt;.baseDir: other/logs
 * loggers.&lt;logger&gt;.handlers.&lt;handler&gt;.kind: console | file
 * loggers.&lt;logger&gt;.handlers.&lt;handler&gt;.level: debug | info | warning | error | critical
 * loggers.&lt;logger&gt;.handlers.&lt;handler&gt;.format: basic | logger_name | ...
 * loggers.&lt;logger&gt;.handlers.&lt;handler&gt;.target: stdout | stderr
 * loggers.&lt;logger&gt;.join.&lt;handler&gt;: &lt;source logger&gt;
 * </pre>
 * Logger names used in configuration must not contain dots.
 *
 * @param baseDirectory default root for file handlers
 * @param runName optional run name folded into the run identifier
 * @param loggers declared loggers in document order
 * @since 0.1.0
 */
public record RunLogConfig(Path baseDirectory, Optional<String> runName, List<LoggerSpec> loggers) {
  /** System property overriding {@link #baseDirectory()}. */
  public static final String BASE_DIR_PROPERTY = "runlog.baseDir";
  /** System property overriding {@link #runName()}. */
  public static final String RUN_NAME_PROPERTY = "runlog.runName";
  /** Environment variable overriding {@link #baseDirectory()}. */
  public static final String BASE_DIR_ENV = "RUNLOG_BASE_DIR";
  /** Environment variable overriding {@link #runName()}. */
  public static final String RUN_NAME_ENV = "RUNLOG_RUN_NAME";

  private static final Logger log = LoggerFactory.getLogger(RunLogConfig.class);
  private static final String LOGGERS_PREFIX = "loggers.";

  public RunLogConfig {
    Objects.requireNonNull(baseDirectory, "baseDirectory");
    runName = Objects.requireNonNull(runName, "runName").map(n -> Names.requireFileNameSegment("runName", n));
    loggers = List.copyOf(Objects.requireNonNull(loggers, "loggers"));
  }

  /**
   * Returns a configuration with the default base directory, no run name, and no loggers.
   *
   * @return default configuration
   */
  public static RunLogConfig defaults() {
    return new RunLogConfig(LoggerRegistry.DEFAULT_BASE_DIRECTORY, Optional.empty(), List.of());
  }

  /**
   * Reads {@code path} with {@link YamlConfigLoader}, then applies system property and environment overrides.
   *
   * @param path YAML file; a missing file yields the defaults
   * @return effective configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the document or a value is invalid
   */
  public static RunLogConfig load(Path path) throws IOException {
    RunLogConfig fromFile = YamlConfigLoader.load(path).map(RunLogConfig::fromMap).orElseGet(RunLogConfig::defaults);
    return fromFile.withOverrides(systemProperties(), System.getenv(), log::warn);
  }

  /**
   * Reads the {@code common} section of {@code path} overlaid with the {@code profile} section, then applies system
   * property and environment overrides.
   *
   * @param path YAML file with {@code common} and per-profile sections; a missing file yields the defaults
   * @param profile section name such as {@code dev} or {@code test}
   * @return effective configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the document or a value is invalid
   */
  public static RunLogConfig load(Path path, String profile) throws IOException {
    RunLogConfig fromFile = YamlConfigLoader.load(path, profile)
        .map(RunLogConfig::fromMap)
        .orElseGet(RunLogConfig::defaults);
    log.debug("Loaded profile {} from {}", profile, path);
    return fromFile.withOverrides(systemProperties(), System.getenv(), log::warn);
  }

  /**
   * Builds a configuration from flattened keys.
   *
   * @param flat key/value pairs; {@code null} is treated as empty
   * @return parsed configuration
   * @throws IllegalArgumentException if a level, format, kind, target, or name is invalid
   */
  public static RunLogConfig fromMap(Map<String, String> flat) {
    Map<String, String> source = flat == null ? Map.of() : flat;
    Path baseDirectory = LoggerRegistry.DEFAULT_BASE_DIRECTORY;
    Optional<String> runName = Optional.empty();
    Map<String, LoggerDraft> drafts = new LinkedHashMap<>();

    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue() == null ? "" : entry.getValue().trim();
      if (key.equals("baseDir")) {
        if (!value.isEmpty()) {
          baseDirectory = Path.of(value);
        }
      } else if (key.equals("runName")) {
        runName = value.isEmpty() ? Optional.empty() : Optional.of(value);
      } else if (key.startsWith(LOGGERS_PREFIX)) {
        applyLoggerKey(drafts, key, key.substring(LOGGERS_PREFIX.length()).split("\\.", -1), value);
      } else if (!key.equals("loggers")) {
        log.warn("Ignoring unknown RunLog configuration key {}", key);
      }
    }

    List<LoggerSpec> loggers = new ArrayList<>(drafts.size());
    for (LoggerDraft draft : drafts.values()) {
      loggers.add(draft.build());
    }
    return new RunLogConfig(baseDirectory, runName, loggers);
  }

  /**
   * Applies overrides with precedence system property &gt; environment &gt; this configuration.
   *
   * @param systemProperties system properties snapshot; may be {@code null}
   * @param environment environment variables; may be {@code null}
   * @param warn receives one message per overridden setting; may be {@code null}
   * @return configuration with overrides applied
   */
  public RunLogConfig withOverrides(
      Map<String, String> systemProperties, Map<String, String> environment, Consumer<String> warn) {
    Map<String, String> props = systemProperties == null ? Map.of() : systemProperties;
    Map<String, String> env = environment == null ? Map.of() : environment;

    Path effectiveBase = baseDirectory;
    String base = firstNonBlank(props.get(BASE_DIR_PROPERTY), env.get(BASE_DIR_ENV));
    if (base != null) {
      effectiveBase = Path.of(base);
      notify(warn, "baseDir overridden to " + base);
    }
    Optional<String> effectiveRunName = runName;
    String run = firstNonBlank(props.get(RUN_NAME_PROPERTY), env.get(RUN_NAME_ENV));
    if (run != null) {
      effectiveRunName = Optional.of(run);
      notify(warn, "runName overridden to " + run);
    }
    return new RunLogConfig(effectiveBase, effectiveRunName, loggers);
  }

  private static void applyLoggerKey(Map<String, LoggerDraft> drafts, String key, String[] parts, String value) {
    String loggerName = Names.requireNonBlank("logger name", parts[0]);
    LoggerDraft draft = drafts.computeIfAbsent(loggerName, LoggerDraft::new);
    if (parts.length == 1) {
      return;
    }
    String section = parts[1];
    if (section.equals("baseDir") && parts.length == 2) {
      draft.baseDirectory = value.isEmpty() ? null : Path.of(value);
    } else if (section.equals("handlers") && parts.length == 3) {
      draft.handler(parts[2]);
    } else if (section.equals("handlers") && parts.length == 4) {
      draft.handler(parts[2]).set(key, parts[3], value);
    } else if (section.equals("join") && parts.length == 3) {
      draft.joins.put(Names.requireFileNameSegment("handler name", parts[2]),
          Names.requireNonBlank(key, value));
    } else {
      log.warn("Ignoring unknown RunLog configuration key {}", key);
    }
  }

  private static Map<String, String> systemProperties() {
    Map<String, String> snapshot = new LinkedHashMap<>();
    for (String name : System.getProperties().stringPropertyNames()) {
      snapshot.put(name, System.getProperty(name));
    }
    return snapshot;
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return null;
  }

  private static void notify(Consumer<String> warn, String message) {
    if (warn != null) {
      warn.accept(message);
    }
  }

  /**
   * Declared logger.
   *
   * @param name logger name
   * @param baseDirectory root overriding the configuration's base directory, if any
   * @param handlers handlers to add, in document order
   * @param joins handler name to source logger name, applied after every logger exists
   */
  public record LoggerSpec(
      String name, Optional<Path> baseDirectory, List<HandlerSpec> handlers, Map<String, String> joins) {
    public LoggerSpec {
      name = Names.requireNonBlank("name", name);
      Objects.requireNonNull(baseDirectory, "baseDirectory");
      handlers = List.copyOf(Objects.requireNonNull(handlers, "handlers"));
      joins = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(joins, "joins")));
    }
  }

  /**
   * Declared handler.
   *
   * @param name handler name
   * @param kind console or file
   * @param level minimum severity
   * @param format line format
   * @param target console stream; ignored for file handlers
   */
  public record HandlerSpec(String name, SinkKind kind, Severity level, LogFormat format, ConsoleTarget target) {
    public HandlerSpec {
      name = Names.requireFileNameSegment("name", name);
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(level, "level");
      Objects.requireNonNull(format, "format");
      Objects.requireNonNull(target, "target");
    }
  }

  private static final class LoggerDraft {
    private final String name;
    private final Map<String, HandlerDraft> handlers = new LinkedHashMap<>();
    private final Map<String, String> joins = new LinkedHashMap<>();
    private Path baseDirectory;

    LoggerDraft(String name) {
      this.name = name;
    }

    HandlerDraft handler(String handlerName) {
      return handlers.computeIfAbsent(Names.requireFileNameSegment("handler name", handlerName), HandlerDraft::new);
    }

    LoggerSpec build() {
      List<HandlerSpec> specs = new ArrayList<>(handlers.size());
      for (HandlerDraft draft : handlers.values()) {
        specs.add(draft.build());
      }
      return new LoggerSpec(name, Optional.ofNullable(baseDirectory), specs, joins);
    }
  }

  private static final class HandlerDraft {
    private final String name;
    private SinkKind kind;
    private Severity level = Severity.INFO;
    private LogFormat format = LogFormat.BASIC;
    private ConsoleTarget target;

    HandlerDraft(String name) {
      this.name = name;
    }

    void set(String key, String attribute, String value) {
      switch (attribute) {
        case "kind" -> kind = SinkKind.parse(value);
        case "level" -> level = Severity.parse(value);
        case "format" -> format = LogFormat.preset(value);
        case "target" -> target = ConsoleTarget.parse(value);
        default -> log.warn("Ignoring unknown RunLog configuration key {}", key);
      }
    }

    HandlerSpec build() {
      // A target without an explicit kind implies a console handler.
      SinkKind effectiveKind = kind != null ? kind : (target != null ? SinkKind.CONSOLE : SinkKind.FILE);
      return new HandlerSpec(name, effectiveKind, level, format, target != null ? target : ConsoleTarget.STDOUT);
    }
  }
}
