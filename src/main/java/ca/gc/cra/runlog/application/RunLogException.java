package ca.gc.cra.runlog.application;

/**
 * Base unchecked exception for RunLog lookup failures.
 *
 * @since 0.1.0
 */
public class RunLogException extends RuntimeException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public RunLogException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public RunLogException(String msg, Throwable cause) { super(msg, cause); }
}
