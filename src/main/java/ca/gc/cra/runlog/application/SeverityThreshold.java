package ca.gc.cra.runlog.application;

import ca.gc.cra.runlog.domain.Severity;
import java.util.Objects;

/**
 * Mutable minimum severity shared between a {@link Sink} and the backend filter guarding its appender.
 * <p>Reads and writes are volatile so a level change is visible to the next emitted record on any thread.</p>
 *
 * @since 0.1.0
 */
public final class SeverityThreshold {
  private volatile Severity minimum;

  /**
   * Creates a threshold.
   *
   * @param minimum initial minimum severity; must not be {@code null}
   */
  public SeverityThreshold(Severity minimum) {
    this.minimum = Objects.requireNonNull(minimum, "minimum");
  }

  /**
   * Returns the current minimum.
   *
   * @return minimum severity
   */
  public Severity get() {
    return minimum;
  }

  /**
   * Replaces the minimum.
   *
   * @param minimum new minimum severity; must not be {@code null}
   */
  public void set(Severity minimum) {
    this.minimum = Objects.requireNonNull(minimum, "minimum");
  }

  /**
   * Reports whether a record at {@code severity} passes.
   *
   * @param severity record severity
   * @return {@code true} when the record should be written
   */
  public boolean allows(Severity severity) {
    return severity != null && severity.isAtLeast(minimum);
  }
}
