package ca.gc.cra.runlog.domain;

import java.util.Objects;

/**
 * Backend-neutral view of a single record, holding the values a {@link LogFormat} can render.
 *
 * @param timestamp pre-formatted event time
 * @param loggerName emitting logger name
 * @param severity resolved severity
 * @param module simple name of the calling class, or {@code ?}
 * @param function calling method name, or {@code ?}
 * @param line calling source line, or a negative value when unknown
 * @param message formatted message text
 * @since 0.1.0
 */
public record LogLine(
    String timestamp,
    String loggerName,
    Severity severity,
    String module,
    String function,
    int line,
    String message) {

  public LogLine {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(severity, "severity");
    loggerName = loggerName == null ? "" : loggerName;
    module = module == null || module.isEmpty() ? "?" : module;
    function = function == null || function.isEmpty() ? "?" : function;
    message = message == null ? "" : message;
  }

  String valueOf(LogField field) {
    return switch (field) {
      case TIMESTAMP -> timestamp;
      case LOGGER_NAME -> loggerName;
      case LEVEL -> severity.label();
      case MODULE -> module;
      case FUNC_NAME -> function;
      case LINE_NO -> line < 0 ? "?" : Integer.toString(line);
      case MESSAGE -> message;
    };
  }
}
