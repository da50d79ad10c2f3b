package ca.gc.cra.runlog.application.port;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * <strong>What:</strong> Port supplying wall-clock time to run identifier generation and day directory naming.
 * <p><strong>Why:</strong> Lets tests pin the date and time so directory layouts are predictable.</p>
 * <p><strong>Role:</strong> Port consumed by the logger registry and directory layout.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.runlog.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Zone used to turn {@link #nowMillis()} into local dates and times.
   *
   * @return zone; defaults to the JVM default zone
   */
  default ZoneId zone() {
    return ZoneId.systemDefault();
  }

  /**
   * Returns the current local date-time in {@link #zone()}.
   *
   * @return local date-time
   */
  default LocalDateTime localNow() {
    return LocalDateTime.ofInstant(Instant.ofEpochMilli(nowMillis()), zone());
  }
}
