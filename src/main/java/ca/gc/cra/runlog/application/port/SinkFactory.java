package ca.gc.cra.runlog.application.port;

import ca.gc.cra.runlog.application.Sink;
import ca.gc.cra.runlog.domain.ConsoleTarget;
import ca.gc.cra.runlog.domain.LogFormat;
import ca.gc.cra.runlog.domain.Severity;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port building started sinks for the logging backend.
 * <p><strong>Why:</strong> Keeps appender, encoder, and layout wiring out of the logger's handler bookkeeping.</p>
 * <p><strong>Role:</strong> Implemented by {@code LogbackSinkFactory}; consumed by {@code RunLogger}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent calls from different loggers.</p>
 *
 * @since 0.1.0
 */
public interface SinkFactory {
  /**
   * Builds a console sink.
   *
   * @param name handler name
   * @param level minimum severity written
   * @param format line format
   * @param target standard stream to write to
   * @return started sink with no attachments
   */
  Sink console(String name, Severity level, LogFormat format, ConsoleTarget target);

  /**
   * Builds a file sink writing UTF-8 in append mode.
   *
   * @param name handler name
   * @param level minimum severity written
   * @param format line format
   * @param file target file; its parent directory must exist
   * @return started sink with no attachments
   */
  Sink file(String name, Severity level, LogFormat format, Path file);
}
