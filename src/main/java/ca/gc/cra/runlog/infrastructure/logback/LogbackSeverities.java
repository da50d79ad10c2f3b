package ca.gc.cra.runlog.infrastructure.logback;

import ca.gc.cra.runlog.domain.Severity;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.spi.LocationAwareLogger;

/**
 * <strong>What:</strong> Maps RunLog severities onto Logback levels and back.
 * <p><strong>Why:</strong> Logback stops at {@code ERROR}; critical records travel at {@code ERROR} tagged with the
 * {@value #CRITICAL_MARKER_NAME} marker so sinks can still tell them apart.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LogbackSeverities {
  /** Marker name carried by critical records. */
  public static final String CRITICAL_MARKER_NAME = "CRITICAL";
  /** Marker carried by critical records. */
  public static final Marker CRITICAL_MARKER = MarkerFactory.getMarker(CRITICAL_MARKER_NAME);

  private LogbackSeverities() {
    // Utility
  }

  /**
   * Returns the SLF4J location-aware level integer used to emit a record.
   *
   * @param severity RunLog severity; must not be {@code null}
   * @return one of the {@link LocationAwareLogger} {@code *_INT} constants
   */
  public static int levelInt(Severity severity) {
    return switch (severity) {
      case DEBUG -> LocationAwareLogger.DEBUG_INT;
      case INFO -> LocationAwareLogger.INFO_INT;
      case WARNING -> LocationAwareLogger.WARN_INT;
      case ERROR, CRITICAL -> LocationAwareLogger.ERROR_INT;
    };
  }

  /**
   * Returns the Logback level a severity is emitted at.
   *
   * @param severity RunLog severity; must not be {@code null}
   * @return Logback level
   */
  public static Level level(Severity severity) {
    return Level.fromLocationAwareLoggerInteger(levelInt(severity));
  }

  /**
   * Returns the marker to attach when emitting a severity.
   *
   * @param severity RunLog severity
   * @return {@link #CRITICAL_MARKER} for critical records, otherwise {@code null}
   */
  public static Marker markerFor(Severity severity) {
    return severity == Severity.CRITICAL ? CRITICAL_MARKER : null;
  }

  /**
   * Resolves the severity of a Logback event from its level and markers.
   *
   * @param event logging event; must not be {@code null}
   * @return resolved severity; {@code TRACE} folds into {@link Severity#DEBUG}
   */
  public static Severity of(ILoggingEvent event) {
    Level level = event.getLevel();
    if (level.toInt() >= Level.ERROR_INT) {
      return isCritical(event.getMarkerList()) ? Severity.CRITICAL : Severity.ERROR;
    }
    if (level.toInt() >= Level.WARN_INT) {
      return Severity.WARNING;
    }
    if (level.toInt() >= Level.INFO_INT) {
      return Severity.INFO;
    }
    return Severity.DEBUG;
  }

  private static boolean isCritical(List<Marker> markers) {
    if (markers == null) {
      return false;
    }
    for (Marker marker : markers) {
      if (marker != null && (marker.getName().equals(CRITICAL_MARKER_NAME) || marker.contains(CRITICAL_MARKER_NAME))) {
        return true;
      }
    }
    return false;
  }
}
