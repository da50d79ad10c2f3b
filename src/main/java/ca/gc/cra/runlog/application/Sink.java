package ca.gc.cra.runlog.application;

import ca.gc.cra.runlog.domain.ConsoleTarget;
import ca.gc.cra.runlog.domain.LogFormat;
import ca.gc.cra.runlog.domain.Severity;
import ca.gc.cra.runlog.domain.SinkKind;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A configured output destination (console stream or file) with its own threshold and format.
 * <p><strong>Why:</strong> Wraps a started Logback appender so loggers can attach, share, and release it by name.</p>
 * <p><strong>Role:</strong> Handler record held by one or more {@link RunLogger} handler maps.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the mutable severity threshold consulted by the appender's filter.</li>
 *   <li>Count the loggers it is attached to.</li>
 *   <li>Stop the appender (flushing and releasing the file) when the last attachment is released.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Attachment bookkeeping synchronizes on the sink; the threshold is volatile.</p>
 * <p><strong>Performance:</strong> No per-record work beyond the backend appender.</p>
 * <p><strong>Observability:</strong> {@link #toString()} names the sink, its kind, level, and target.</p>
 *
 * @since 0.1.0
 */
public final class Sink {
  private final String name;
  private final SinkKind kind;
  private final LogFormat format;
  private final ConsoleTarget consoleTarget;
  private final Path file;
  private final SeverityThreshold threshold;
  private final Appender<ILoggingEvent> appender;

  private int attachments;
  private boolean closed;

  /**
   * Creates a console sink around a started appender.
   *
   * @param name handler name; must not be {@code null}
   * @param format line format; must not be {@code null}
   * @param target console stream; must not be {@code null}
   * @param threshold threshold consulted by the appender filter; must not be {@code null}
   * @param appender started appender; must not be {@code null}
   * @return console sink with no attachments
   */
  public static Sink console(
      String name,
      LogFormat format,
      ConsoleTarget target,
      SeverityThreshold threshold,
      Appender<ILoggingEvent> appender) {
    return new Sink(name, SinkKind.CONSOLE, format, Objects.requireNonNull(target, "target"), null,
        threshold, appender);
  }

  /**
   * Creates a file sink around a started appender.
   *
   * @param name handler name; must not be {@code null}
   * @param format line format; must not be {@code null}
   * @param file file written by the appender; must not be {@code null}
   * @param threshold threshold consulted by the appender filter; must not be {@code null}
   * @param appender started appender; must not be {@code null}
   * @return file sink with no attachments
   */
  public static Sink file(
      String name,
      LogFormat format,
      Path file,
      SeverityThreshold threshold,
      Appender<ILoggingEvent> appender) {
    return new Sink(name, SinkKind.FILE, format, null, Objects.requireNonNull(file, "file"),
        threshold, appender);
  }

  private Sink(
      String name,
      SinkKind kind,
      LogFormat format,
      ConsoleTarget consoleTarget,
      Path file,
      SeverityThreshold threshold,
      Appender<ILoggingEvent> appender) {
    this.name = Objects.requireNonNull(name, "name");
    this.kind = kind;
    this.format = Objects.requireNonNull(format, "format");
    this.consoleTarget = consoleTarget;
    this.file = file;
    this.threshold = Objects.requireNonNull(threshold, "threshold");
    this.appender = Objects.requireNonNull(appender, "appender");
  }

  public String name() {
    return name;
  }

  public SinkKind kind() {
    return kind;
  }

  public LogFormat format() {
    return format;
  }

  /**
   * Returns the console stream of a console sink.
   *
   * @return target, empty for file sinks
   */
  public Optional<ConsoleTarget> consoleTarget() {
    return Optional.ofNullable(consoleTarget);
  }

  /**
   * Returns the file of a file sink.
   *
   * @return path, empty for console sinks
   */
  public Optional<Path> file() {
    return Optional.ofNullable(file);
  }

  public Severity level() {
    return threshold.get();
  }

  /**
   * Changes the minimum severity written by this sink for every logger sharing it.
   *
   * @param level new minimum; must not be {@code null}
   */
  public void setLevel(Severity level) {
    threshold.set(level);
  }

  /**
   * Returns the number of loggers currently holding this sink.
   *
   * @return attachment count
   */
  public synchronized int attachments() {
    return attachments;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /**
   * Adds the appender to {@code logger}.
   *
   * @return {@code false} when the sink is already closed and nothing was attached
   */
  synchronized boolean attachTo(Logger logger) {
    if (closed) {
      return false;
    }
    logger.addAppender(appender);
    attachments++;
    return true;
  }

  /**
   * Detaches the appender from {@code logger} and stops it when no logger holds it anymore.
   *
   * @return {@code true} when this call closed the sink
   */
  synchronized boolean detachFrom(Logger logger) {
    logger.detachAppender(appender);
    if (attachments > 0) {
      attachments--;
    }
    if (attachments == 0 && !closed) {
      close();
      return true;
    }
    return false;
  }

  /** Stops the appender regardless of remaining attachments. Idempotent. */
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    appender.stop();
  }

  @Override
  public String toString() {
    String target = file != null ? file.toString() : String.valueOf(consoleTarget);
    return "Sink{" + name + ", " + kind + ", level=" + threshold.get() + ", target=" + target + "}";
  }
}
