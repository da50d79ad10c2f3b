package ca.gc.cra.runlog.application;

/**
 * Thrown when a registry lookup requires a logger that was never created or has been deleted.
 *
 * @since 0.1.0
 */
public final class LoggerNotFoundException extends RunLogException {
  private final String loggerName;

  /**
   * Creates the exception for a missing logger.
   *
   * @param loggerName name that was looked up
   */
  public LoggerNotFoundException(String loggerName) {
    super("Logger instance with name '" + loggerName + "' does not exist");
    this.loggerName = loggerName;
  }

  public String loggerName() {
    return loggerName;
  }
}
