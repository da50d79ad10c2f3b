package ca.gc.cra.runlog.infrastructure.time;

import ca.gc.cra.runlog.application.port.ClockPort;
import java.time.ZoneId;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()} in a fixed zone.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final ZoneId zone;

  /** Creates a system clock adapter in the JVM default zone. */
  public SystemClockAdapter() {
    this(ZoneId.systemDefault());
  }

  /**
   * Creates a system clock adapter in {@code zone}.
   *
   * @param zone zone used for day directories and run identifiers
   */
  public SystemClockAdapter(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public ZoneId zone() {
    return zone;
  }
}
