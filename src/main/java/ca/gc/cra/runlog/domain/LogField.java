package ca.gc.cra.runlog.domain;

/**
 * Placeholders a {@link LogFormat} can place on a log line.
 *
 * @since 0.1.0
 */
public enum LogField {
  /** Event time, {@code yyyy-MM-dd HH:mm:ss,SSS}. */
  TIMESTAMP,
  /** Name of the emitting logger. */
  LOGGER_NAME,
  /** Severity label. */
  LEVEL,
  /** Simple name of the calling class. */
  MODULE,
  /** Name of the calling method. */
  FUNC_NAME,
  /** Source line of the call, {@code ?} when unknown. */
  LINE_NO,
  /** Formatted message text. */
  MESSAGE
}
