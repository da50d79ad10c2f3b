package ca.gc.cra.runlog.infrastructure.logback;

import ca.gc.cra.runlog.application.SeverityThreshold;
import ca.gc.cra.runlog.application.Sink;
import ca.gc.cra.runlog.application.port.SinkFactory;
import ca.gc.cra.runlog.domain.ConsoleTarget;
import ca.gc.cra.runlog.domain.LogFormat;
import ca.gc.cra.runlog.domain.Severity;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds console and file {@link Sink}s from Logback appenders.
 * <p><strong>Why:</strong> Centralizes the encoder, layout, and threshold filter wiring every sink needs.</p>
 * <p><strong>Role:</strong> Infrastructure implementation of {@link SinkFactory} bound to one {@link LoggerContext}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Render lines with a {@link FormatLayout} wrapped in a UTF-8 encoder.</li>
 *   <li>Guard each appender with a {@link SeverityThresholdFilter} sharing the sink's threshold.</li>
 *   <li>Open file targets in append mode and fail loudly when the file cannot be opened.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe for concurrent calls.</p>
 * <p><strong>Performance:</strong> Each file sink holds one open stream flushed after every record.</p>
 * <p><strong>Observability:</strong> Logs sink construction at debug level through SLF4J.</p>
 *
 * @implNote File sinks use a plain {@link OutputStreamAppender} over an append-mode stream instead of
 * {@code FileAppender}, so two loggers may each open the same path the way separate handlers would.
 * @since 0.1.0
 */
public final class LogbackSinkFactory implements SinkFactory {
  private static final Logger log = LoggerFactory.getLogger(LogbackSinkFactory.class);

  private final LoggerContext context;
  private final ZoneId zone;

  /**
   * Creates a factory for appenders living in {@code context}.
   *
   * @param context Logback context owning the appenders; must not be {@code null}
   * @param zone zone used to render timestamps; must not be {@code null}
   */
  public LogbackSinkFactory(LoggerContext context, ZoneId zone) {
    this.context = Objects.requireNonNull(context, "context");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public Sink console(String name, Severity level, LogFormat format, ConsoleTarget target) {
    Objects.requireNonNull(target, "target");
    SeverityThreshold threshold = new SeverityThreshold(level);
    ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
    appender.setContext(context);
    appender.setName(name);
    appender.setTarget(target.backendName());
    appender.setEncoder(encoder(format));
    appender.addFilter(filter(threshold));
    appender.start();
    if (!appender.isStarted()) {
      throw new IllegalStateException("console appender " + name + " failed to start");
    }
    log.debug("Built console sink {} ({}, level={}, format={})", name, target, level, format.name());
    return Sink.console(name, format, target, threshold, appender);
  }

  @Override
  public Sink file(String name, Severity level, LogFormat format, Path file) {
    Objects.requireNonNull(file, "file");
    SeverityThreshold threshold = new SeverityThreshold(level);
    OutputStreamAppender<ILoggingEvent> appender = new OutputStreamAppender<>();
    appender.setContext(context);
    appender.setName(name);
    appender.setEncoder(encoder(format));
    appender.setImmediateFlush(true);
    appender.setOutputStream(open(file));
    appender.addFilter(filter(threshold));
    appender.start();
    if (!appender.isStarted()) {
      appender.stop();
      throw new IllegalStateException("file appender " + name + " failed to start for " + file);
    }
    log.debug("Built file sink {} ({}, level={}, format={})", name, file, level, format.name());
    return Sink.file(name, format, file, threshold, appender);
  }

  private LayoutWrappingEncoder<ILoggingEvent> encoder(LogFormat format) {
    FormatLayout layout = new FormatLayout(Objects.requireNonNull(format, "format"), zone);
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setCharset(StandardCharsets.UTF_8);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }

  private SeverityThresholdFilter filter(SeverityThreshold threshold) {
    SeverityThresholdFilter filter = new SeverityThresholdFilter(threshold);
    filter.setContext(context);
    filter.start();
    return filter;
  }

  private static OutputStream open(Path file) {
    try {
      return Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND,
          StandardOpenOption.WRITE);
    } catch (IOException ex) {
      throw new UncheckedIOException("unable to open log file " + file, ex);
    }
  }
}
