package ca.gc.cra.runlog.application;

import ca.gc.cra.runlog.application.port.ClockPort;
import ca.gc.cra.runlog.application.port.MetricsPort;
import ca.gc.cra.runlog.application.port.SinkFactory;
import ca.gc.cra.runlog.domain.RunId;
import ca.gc.cra.runlog.infrastructure.fs.LogDirectoryLayout;
import ca.gc.cra.runlog.infrastructure.logback.LogbackLoggerNames;
import ca.gc.cra.runlog.infrastructure.logback.LogbackSinkFactory;
import ca.gc.cra.runlog.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.runlog.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.runlog.validation.Names;
import ch.qos.logback.classic.LoggerContext;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Registry of named {@link RunLogger} instances sharing one run identifier.
 * <p><strong>Why:</strong> Guarantees one logger per name so every part of a program that asks for {@code "svc"}
 * writes through the same handlers, and namespaces file output per run.</p>
 * <p><strong>Role:</strong> Application-layer entry point; constructed once by the host and passed to callers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create loggers on first request and return the identical instance afterwards.</li>
 *   <li>Generate the run identifier once (first caller wins) and regenerate it on {@link #setRunName(String)}.</li>
 *   <li>Delete loggers, releasing their handlers, and reset everything for test teardown.</li>
 *   <li>Own the Logback {@link LoggerContext} all managed loggers and appenders live in.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A single {@link ReentrantLock} guards lookup, creation, deletion, and the run
 * identifier. Handler release after deletion happens outside that lock.</p>
 * <p><strong>Performance:</strong> Lookups are map reads under an uncontended lock; creation touches the filesystem
 * once to create the base directory.</p>
 * <p><strong>Observability:</strong> Logs lifecycle events at debug level through SLF4J and counts them through the
 * {@link MetricsPort}.</p>
 *
 * @implNote Managed loggers live in a private {@link LoggerContext}, isolated from the process-wide SLF4J context, so
 * separate registries never share backend state. Each logger is backed by a Logback logger with a private sequence
 * name; the registry name is only a map key, so names such as {@code root} or {@code a.b} carry no Logback meaning.
 * @since 0.1.0
 */
public final class LoggerRegistry implements AutoCloseable {
  /** Base directory used when none is supplied, resolved against the working directory. */
  public static final Path DEFAULT_BASE_DIRECTORY = Path.of("data", "logs");

  private static final Logger log = LoggerFactory.getLogger(LoggerRegistry.class);
  private static final AtomicInteger CONTEXT_SEQUENCE = new AtomicInteger();

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, RunLogger> instances = new LinkedHashMap<>();
  private final LoggerContext context;
  private final SinkFactory sinkFactory;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Path defaultBaseDirectory;

  private RunId runId;
  private int backendSequence;
  private boolean closed;

  /** Creates a registry writing under {@link #DEFAULT_BASE_DIRECTORY} with the system clock and no metrics. */
  public LoggerRegistry() {
    this(DEFAULT_BASE_DIRECTORY);
  }

  /**
   * Creates a registry writing under {@code baseDirectory} with the system clock and no metrics.
   *
   * @param baseDirectory default root for file handlers; must not be {@code null}
   */
  public LoggerRegistry(Path baseDirectory) {
    this(baseDirectory, new SystemClockAdapter(), new NoOpMetricsAdapter());
  }

  /**
   * Creates a registry with explicit collaborators.
   *
   * @param baseDirectory default root for file handlers; must not be {@code null}
   * @param clock time source for run identifiers and day directories; must not be {@code null}
   * @param metrics lifecycle metrics sink; must not be {@code null}
   */
  public LoggerRegistry(Path baseDirectory, ClockPort clock, MetricsPort metrics) {
    this.defaultBaseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.context = new LoggerContext();
    this.context.setName("runlog-" + CONTEXT_SEQUENCE.incrementAndGet());
    this.context.start();
    this.sinkFactory = new LogbackSinkFactory(context, clock.zone());
  }

  /**
   * Returns the logger named {@code name}, creating it under the default base directory on first request.
   *
   * @param name logger name; must not be blank
   * @return the single logger registered under {@code name}
   * @throws IllegalArgumentException if {@code name} is blank
   * @throws java.io.UncheckedIOException if the base directory cannot be created
   */
  public RunLogger getOrCreate(String name) {
    return getOrCreate(name, defaultBaseDirectory);
  }

  /**
   * Returns the logger named {@code name}, creating it under {@code baseDirectory} on first request.
   * <p>When the logger already exists it is returned unchanged; {@code baseDirectory} is ignored.</p>
   *
   * @param name logger name; must not be blank
   * @param baseDirectory root for this logger's file handlers; must not be {@code null}
   * @return the single logger registered under {@code name}
   * @throws IllegalArgumentException if {@code name} is blank
   * @throws java.io.UncheckedIOException if the base directory cannot be created
   */
  public RunLogger getOrCreate(String name, Path baseDirectory) {
    String key = Names.requireNonBlank("name", name);
    Objects.requireNonNull(baseDirectory, "baseDirectory");
    lock.lock();
    try {
      ensureOpen();
      RunLogger existing = instances.get(key);
      if (existing != null) {
        return existing;
      }
      ensureRunId();
      RunLogger created = new RunLogger(
          key,
          this,
          context.getLogger(LogbackLoggerNames.backendName(++backendSequence)),
          new LogDirectoryLayout(baseDirectory),
          sinkFactory,
          metrics);
      instances.put(key, created);
      metrics.increment(MetricsPort.LOGGER_CREATED);
      log.debug("Created logger {} under {}", key, created.baseDirectory());
      return created;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns an existing logger.
   *
   * @param name logger name
   * @return registered logger
   * @throws LoggerNotFoundException if no logger with that name exists
   */
  public RunLogger getExisting(String name) {
    return find(name).orElseThrow(() -> new LoggerNotFoundException(name));
  }

  /**
   * Looks up a logger without creating it.
   *
   * @param name logger name
   * @return registered logger, or empty
   */
  public Optional<RunLogger> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      return Optional.ofNullable(instances.get(name.trim()));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Regenerates the run identifier as {@code <yyyy-MM-dd_HHmmss>_<runName>}.
   * <p>File handlers added afterwards use the new identifier; open file handlers keep their paths.</p>
   *
   * @param runName name describing the run (configuration or parameters); must be usable in a file name
   * @return the new run identifier
   * @throws IllegalArgumentException if {@code runName} is blank or contains path separators
   */
  public RunId setRunName(String runName) {
    String sanitized = Names.requireFileNameSegment("runName", runName);
    lock.lock();
    try {
      runId = RunId.generate(clock.localNow(), sanitized);
      log.debug("Run identifier set to {}", runId);
      return runId;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the run identifier, generating it if no logger has been created yet.
   *
   * @return current run identifier
   */
  public RunId runId() {
    lock.lock();
    try {
      return ensureRunId();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lists registered logger names.
   *
   * @return snapshot of names in creation order
   */
  public List<String> listNames() {
    lock.lock();
    try {
      return List.copyOf(instances.keySet());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a logger and releases every handler it holds. No-op when absent.
   *
   * @param name logger name
   * @return {@code true} when a logger was removed
   */
  public boolean delete(String name) {
    if (name == null) {
      return false;
    }
    RunLogger removed;
    lock.lock();
    try {
      removed = instances.remove(name.trim());
    } finally {
      lock.unlock();
    }
    if (removed == null) {
      return false;
    }
    removed.releaseHandlers();
    metrics.increment(MetricsPort.LOGGER_DELETED);
    log.debug("Deleted logger {}", removed.name());
    return true;
  }

  /**
   * Deletes every logger and forgets the run identifier so the next logger generates a fresh one.
   */
  public void reset() {
    List<RunLogger> removed;
    lock.lock();
    try {
      removed = new ArrayList<>(instances.values());
      instances.clear();
      runId = null;
    } finally {
      lock.unlock();
    }
    for (RunLogger logger : removed) {
      logger.releaseHandlers();
      metrics.increment(MetricsPort.LOGGER_DELETED);
    }
    log.debug("Registry reset; released {} logger(s)", removed.size());
  }

  /**
   * Resets the registry and stops its Logback context. The registry cannot create loggers afterwards.
   */
  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
    } finally {
      lock.unlock();
    }
    reset();
    context.stop();
  }

  /**
   * Returns the directory loggers use when created without an explicit base directory.
   *
   * @return absolute default base directory
   */
  public Path defaultBaseDirectory() {
    return defaultBaseDirectory;
  }

  ClockPort clock() {
    return clock;
  }

  private RunId ensureRunId() {
    if (runId == null) {
      runId = RunId.generate(clock.localNow());
      log.debug("Generated run identifier {}", runId);
    }
    return runId;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("registry is closed");
    }
  }
}
