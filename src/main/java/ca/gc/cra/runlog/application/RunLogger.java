package ca.gc.cra.runlog.application;

import ca.gc.cra.runlog.application.port.MetricsPort;
import ca.gc.cra.runlog.application.port.SinkFactory;
import ca.gc.cra.runlog.domain.ConsoleTarget;
import ca.gc.cra.runlog.domain.LogFormat;
import ca.gc.cra.runlog.domain.RunId;
import ca.gc.cra.runlog.domain.Severity;
import ca.gc.cra.runlog.infrastructure.fs.LogDirectoryLayout;
import ca.gc.cra.runlog.infrastructure.logback.LogbackLoggerNames;
import ca.gc.cra.runlog.infrastructure.logback.LogbackSeverities;
import ca.gc.cra.runlog.validation.Names;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Marker;

/**
 * <strong>What:</strong> One named logger with a set of named handlers (sinks) and leveled logging calls.
 * <p><strong>Why:</strong> Lets a module attach console and file output with independent levels and formats, share
 * a handler with another logger, and detach it again by name.</p>
 * <p><strong>Role:</strong> Application-layer object created only by {@link LoggerRegistry#getOrCreate(String)}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep the handler-name to sink mapping and the matching Logback appender attachments in step.</li>
 *   <li>Place file handlers at {@code <base>/<yyyy-MM-dd>/<run_id>/<run_id>_<handler>.log}.</li>
 *   <li>Warn through itself, rather than fail, on duplicate or unknown handler names.</li>
 *   <li>Forward leveled messages; each sink filters by its own threshold.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A per-instance {@link ReentrantLock} guards the handler map. Warnings are emitted
 * after the lock is released. Emission itself relies on Logback's appender synchronization.</p>
 * <p><strong>Performance:</strong> Emission below the logger's own minimum returns before any record is built.</p>
 * <p><strong>Observability:</strong> Handler lifecycle is counted through the registry's {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class RunLogger {
  /** Verbose diagnostics. */
  public static final Severity DEBUG = Severity.DEBUG;
  /** Progress information. */
  public static final Severity INFO = Severity.INFO;
  /** Unexpected but recoverable condition. */
  public static final Severity WARNING = Severity.WARNING;
  /** Alias of {@link #WARNING}. */
  public static final Severity WARN = Severity.WARNING;
  /** Failed operation. */
  public static final Severity ERROR = Severity.ERROR;
  /** Unrecoverable condition. */
  public static final Severity CRITICAL = Severity.CRITICAL;

  /** Handler name used by {@link #addFileHandler()}. */
  public static final String DEFAULT_FILE_HANDLER = "main";

  private static final String FQCN = RunLogger.class.getName();

  private final String name;
  private final LoggerRegistry registry;
  private final Logger delegate;
  private final LogDirectoryLayout layout;
  private final SinkFactory sinkFactory;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Sink> handlers = new LinkedHashMap<>();

  private volatile Severity minimum = Severity.DEBUG;
  private volatile Path dateDirectory;
  private volatile Path runDirectory;

  RunLogger(
      String name,
      LoggerRegistry registry,
      Logger delegate,
      LogDirectoryLayout layout,
      SinkFactory sinkFactory,
      MetricsPort metrics) {
    this.name = name;
    this.registry = registry;
    this.delegate = delegate;
    this.layout = layout;
    this.sinkFactory = sinkFactory;
    this.metrics = metrics;
    this.delegate.setLevel(Level.DEBUG);
    this.delegate.setAdditive(false);
    this.layout.ensureBaseDirectory();
  }

  public String name() {
    return name;
  }

  /**
   * Returns the root of this logger's file handlers.
   *
   * @return absolute base directory
   */
  public Path baseDirectory() {
    return layout.baseDirectory();
  }

  /**
   * Returns the registry's current run identifier.
   *
   * @return run identifier
   */
  public RunId runId() {
    return registry.runId();
  }

  /**
   * Returns the day directory used by the most recent file handler.
   *
   * @return day directory, empty until a file handler has been added
   */
  public Optional<Path> dateDirectory() {
    return Optional.ofNullable(dateDirectory);
  }

  /**
   * Returns the run directory used by the most recent file handler.
   *
   * @return run directory, empty until a file handler has been added
   */
  public Optional<Path> runDirectory() {
    return Optional.ofNullable(runDirectory);
  }

  /**
   * Returns the logger's own minimum; records below it are dropped before any handler sees them.
   *
   * @return minimum severity, {@link Severity#DEBUG} unless changed
   */
  public Severity level() {
    return minimum;
  }

  /**
   * Changes the logger's own minimum.
   *
   * @param level new minimum; must not be {@code null}
   */
  public void setLevel(Severity level) {
    this.minimum = Objects.requireNonNull(level, "level");
  }

  /**
   * Reports whether a record at {@code severity} would be produced at all.
   *
   * @param severity record severity
   * @return {@code true} when at or above the logger's minimum
   */
  public boolean isEnabledFor(Severity severity) {
    return severity != null && severity.isAtLeast(minimum);
  }

  /**
   * Adds a console handler at {@link Severity#INFO} in {@link LogFormat#BASIC} on standard output.
   *
   * @param handlerName handler name, unique within this logger
   * @return {@code true} when attached, {@code false} when the name was already taken
   */
  public boolean addConsoleHandler(String handlerName) {
    return addConsoleHandler(handlerName, Severity.INFO, LogFormat.BASIC, ConsoleTarget.STDOUT);
  }

  /**
   * Adds a console handler in {@link LogFormat#BASIC} on standard output.
   *
   * @param handlerName handler name, unique within this logger
   * @param level minimum severity written
   * @return {@code true} when attached, {@code false} when the name was already taken
   */
  public boolean addConsoleHandler(String handlerName, Severity level) {
    return addConsoleHandler(handlerName, level, LogFormat.BASIC, ConsoleTarget.STDOUT);
  }

  /**
   * Adds a console handler on standard output.
   *
   * @param handlerName handler name, unique within this logger
   * @param level minimum severity written
   * @param format line format
   * @return {@code true} when attached, {@code false} when the name was already taken
   */
  public boolean addConsoleHandler(String handlerName, Severity level, LogFormat format) {
    return addConsoleHandler(handlerName, level, format, ConsoleTarget.STDOUT);
  }

  /**
   * Adds a console handler.
   * <p>When {@code handlerName} is already registered the existing handler is left untouched and a warning is
   * logged through this logger.</p>
   *
   * @param handlerName handler name, unique within this logger
   * @param level minimum severity written; must not be {@code null}
   * @param format line format; must not be {@code null}
   * @param target standard stream to write to; must not be {@code null}
   * @return {@code true} when attached, {@code false} when the name was already taken
   * @throws IllegalArgumentException if {@code handlerName} is blank
   */
  public boolean addConsoleHandler(String handlerName, Severity level, LogFormat format, ConsoleTarget target) {
    String handler = Names.requireNonBlank("handlerName", handlerName);
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(target, "target");
    boolean attached = false;
    lock.lock();
    try {
      if (!handlers.containsKey(handler)) {
        attach(handler, sinkFactory.console(handler, level, format, target));
        attached = true;
      }
    } finally {
      lock.unlock();
    }
    if (!attached) {
      warnDuplicate(handler);
    }
    return attached;
  }

  /**
   * Adds the {@value #DEFAULT_FILE_HANDLER} file handler at {@link Severity#INFO} in {@link LogFormat#BASIC}.
   *
   * @return path of the log file, empty when the name was already taken
   */
  public Optional<Path> addFileHandler() {
    return addFileHandler(DEFAULT_FILE_HANDLER, Severity.INFO, LogFormat.BASIC);
  }

  /**
   * Adds a file handler at {@link Severity#INFO} in {@link LogFormat#BASIC}.
   *
   * @param handlerName handler name, unique within this logger
   * @return path of the log file, empty when the name was already taken
   */
  public Optional<Path> addFileHandler(String handlerName) {
    return addFileHandler(handlerName, Severity.INFO, LogFormat.BASIC);
  }

  /**
   * Adds a file handler in {@link LogFormat#BASIC}.
   *
   * @param handlerName handler name, unique within this logger
   * @param level minimum severity written
   * @return path of the log file, empty when the name was already taken
   */
  public Optional<Path> addFileHandler(String handlerName, Severity level) {
    return addFileHandler(handlerName, level, LogFormat.BASIC);
  }

  /**
   * Adds a file handler writing UTF-8 in append mode to
   * {@code <base>/<yyyy-MM-dd>/<run_id>/<run_id>_<handlerName>.log}, creating the day and run directories if needed.
   * <p>When {@code handlerName} is already registered the existing handler is left untouched and a warning is
   * logged through this logger. Otherwise a debug message announcing the path is logged once the handler is
   * attached.</p>
   *
   * @param handlerName handler name, unique within this logger and usable in a file name
   * @param level minimum severity written; must not be {@code null}
   * @param format line format; must not be {@code null}
   * @return path of the log file, empty when the name was already taken
   * @throws IllegalArgumentException if {@code handlerName} is blank or contains path separators
   * @throws java.io.UncheckedIOException if the directories or the file cannot be created
   */
  public Optional<Path> addFileHandler(String handlerName, Severity level, LogFormat format) {
    String handler = Names.requireFileNameSegment("handlerName", handlerName);
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(format, "format");
    Path file = null;
    lock.lock();
    try {
      if (!handlers.containsKey(handler)) {
        RunId runId = registry.runId();
        LocalDate today = registry.clock().localNow().toLocalDate();
        Path runDir = layout.createRunDirectory(today, runId);
        file = layout.logFile(runDir, runId, handler);
        attach(handler, sinkFactory.file(handler, level, format, file));
        dateDirectory = layout.dateDirectory(today);
        runDirectory = runDir;
      }
    } finally {
      lock.unlock();
    }
    if (file == null) {
      warnDuplicate(handler);
      return Optional.empty();
    }
    debug("File handler " + handler + " added to logger " + name + " with path: " + file);
    return Optional.of(file);
  }

  /**
   * Attaches the handler {@code handlerName} of logger {@code otherLoggerName} to this logger under the same name.
   * The sink object is shared, so output of both loggers interleaves in one destination.
   * <p>When this logger already has a handler with that name it is left untouched and a warning is logged.</p>
   *
   * @param otherLoggerName registered logger holding the handler
   * @param handlerName handler to share
   * @return {@code true} when attached, {@code false} when the name was already taken here
   * @throws LoggerNotFoundException if {@code otherLoggerName} is not registered
   * @throws HandlerNotFoundException if that logger has no handler named {@code handlerName}, or the handler was
   *     closed before it could be attached
   */
  public boolean joinHandler(String otherLoggerName, String handlerName) {
    RunLogger source = registry.getExisting(otherLoggerName);
    Sink sink = source.handler(handlerName)
        .orElseThrow(() -> new HandlerNotFoundException(source.name(), handlerName));
    boolean duplicate = false;
    boolean attached = false;
    lock.lock();
    try {
      if (handlers.containsKey(sink.name())) {
        duplicate = true;
      } else {
        attached = attach(sink.name(), sink);
      }
    } finally {
      lock.unlock();
    }
    if (duplicate) {
      warnDuplicate(sink.name());
      return false;
    }
    if (!attached) {
      // Released by its last holder after the lookup above.
      throw new HandlerNotFoundException(source.name(), handlerName);
    }
    return true;
  }

  /**
   * Detaches and unregisters a handler. A shared sink stays open until its last logger releases it.
   *
   * @param handlerName handler to remove
   * @return {@code true} when removed, {@code false} (after logging a warning) when absent
   */
  public boolean removeHandler(String handlerName) {
    Sink removed;
    lock.lock();
    try {
      removed = handlerName == null ? null : handlers.remove(handlerName);
      if (removed != null) {
        detach(removed);
      }
    } finally {
      lock.unlock();
    }
    if (removed == null) {
      warnMissing("removeHandler", handlerName);
      return false;
    }
    return true;
  }

  /**
   * Changes the minimum severity of an attached handler. Loggers sharing the handler see the change too.
   *
   * @param handlerName handler to update
   * @param level new minimum; must not be {@code null}
   * @return {@code true} when updated, {@code false} (after logging a warning) when absent
   */
  public boolean setHandlerLevel(String handlerName, Severity level) {
    Objects.requireNonNull(level, "level");
    Sink sink;
    lock.lock();
    try {
      sink = handlerName == null ? null : handlers.get(handlerName);
      if (sink != null) {
        sink.setLevel(level);
      }
    } finally {
      lock.unlock();
    }
    if (sink == null) {
      warnMissing("setHandlerLevel", handlerName);
      return false;
    }
    return true;
  }

  /**
   * Lists handler names.
   *
   * @return snapshot of names in attachment order
   */
  public List<String> handlerNames() {
    lock.lock();
    try {
      return List.copyOf(handlers.keySet());
    } finally {
      lock.unlock();
    }
  }

  public boolean hasHandler(String handlerName) {
    return handler(handlerName).isPresent();
  }

  /**
   * Looks up an attached handler.
   *
   * @param handlerName handler name
   * @return sink, or empty
   */
  public Optional<Sink> handler(String handlerName) {
    if (handlerName == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      return Optional.ofNullable(handlers.get(handlerName));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the minimum severity of an attached handler.
   *
   * @param handlerName handler name
   * @return handler level, or empty when absent
   */
  public Optional<Severity> handlerLevel(String handlerName) {
    return handler(handlerName).map(Sink::level);
  }

  /**
   * Deletes today's day directory, with every run directory and log file in it, if it exists.
   *
   * @return {@code true} when a directory was deleted
   * @throws java.io.UncheckedIOException if deletion fails
   */
  public boolean clearTodaysLogs() {
    return layout.clearDate(registry.clock().localNow().toLocalDate());
  }

  /**
   * Deletes every file and directory directly under the base directory.
   *
   * @return number of top-level entries removed
   * @throws java.io.UncheckedIOException if deletion fails
   */
  public int clearAllLogs() {
    return layout.clearAll();
  }

  public void debug(String message) {
    emit(Severity.DEBUG, message, null);
  }

  public void info(String message) {
    emit(Severity.INFO, message, null);
  }

  /**
   * Logs at {@link Severity#WARNING}; alias of {@link #warning(String)}.
   *
   * @param message text to log
   */
  public void warn(String message) {
    emit(Severity.WARNING, message, null);
  }

  public void warning(String message) {
    emit(Severity.WARNING, message, null);
  }

  public void error(String message) {
    emit(Severity.ERROR, message, null);
  }

  /**
   * Logs at {@link Severity#ERROR} with a stack trace.
   *
   * @param message text to log
   * @param thrown failure rendered after the line; may be {@code null}
   */
  public void error(String message, Throwable thrown) {
    emit(Severity.ERROR, message, thrown);
  }

  public void critical(String message) {
    emit(Severity.CRITICAL, message, null);
  }

  /**
   * Logs at {@link Severity#CRITICAL} with a stack trace.
   *
   * @param message text to log
   * @param thrown failure rendered after the line; may be {@code null}
   */
  public void critical(String message, Throwable thrown) {
    emit(Severity.CRITICAL, message, thrown);
  }

  /**
   * Logs at an explicit severity.
   *
   * @param severity record severity; must not be {@code null}
   * @param message text to log
   */
  public void log(Severity severity, String message) {
    emit(Objects.requireNonNull(severity, "severity"), message, null);
  }

  Logger delegate() {
    return delegate;
  }

  /** Detaches every handler and clears the map; invoked when the registry deletes this logger. */
  void releaseHandlers() {
    lock.lock();
    try {
      for (Sink sink : new ArrayList<>(handlers.values())) {
        detach(sink);
      }
      handlers.clear();
    } finally {
      lock.unlock();
    }
  }

  private boolean attach(String handlerName, Sink sink) {
    if (!sink.attachTo(delegate)) {
      return false;
    }
    handlers.put(handlerName, sink);
    metrics.increment(MetricsPort.HANDLER_ATTACHED);
    return true;
  }

  private void detach(Sink sink) {
    boolean closed = sink.detachFrom(delegate);
    metrics.increment(MetricsPort.HANDLER_DETACHED);
    if (closed) {
      metrics.increment(MetricsPort.SINK_CLOSED);
    }
  }

  private void warnDuplicate(String handlerName) {
    metrics.increment(MetricsPort.HANDLER_DUPLICATE);
    warning("Handler with name " + handlerName + " already exists in logger " + name);
  }

  private void warnMissing(String operation, String handlerName) {
    metrics.increment(MetricsPort.HANDLER_MISSING);
    warning("RunLogger." + operation + "() -> Handler " + handlerName + " does not exist in logger " + name);
  }

  private void emit(Severity severity, String message, Throwable thrown) {
    if (!severity.isAtLeast(minimum)) {
      return;
    }
    LoggingEvent event = new LoggingEvent(FQCN, delegate, LogbackSeverities.level(severity), message, thrown, null);
    Marker marker = LogbackSeverities.markerFor(severity);
    if (marker != null) {
      event.addMarker(marker);
    }
    event.addKeyValuePair(LogbackLoggerNames.pair(name));
    delegate.callAppenders(event);
  }

  @Override
  public String toString() {
    return "RunLogger{" + name + ", handlers=" + handlerNames() + "}";
  }
}
