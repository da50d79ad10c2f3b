package ca.gc.cra.runlog.application;

/**
 * Thrown when {@link RunLogger#joinHandler(String, String)} names a handler the source logger does not hold.
 *
 * @since 0.1.0
 */
public final class HandlerNotFoundException extends RunLogException {
  private final String loggerName;
  private final String handlerName;

  /**
   * Creates the exception for a missing handler.
   *
   * @param loggerName logger that was searched
   * @param handlerName handler name that was looked up
   */
  public HandlerNotFoundException(String loggerName, String handlerName) {
    super("Handler '" + handlerName + "' does not exist in logger '" + loggerName + "'");
    this.loggerName = loggerName;
    this.handlerName = handlerName;
  }

  public String loggerName() {
    return loggerName;
  }

  public String handlerName() {
    return handlerName;
  }
}
