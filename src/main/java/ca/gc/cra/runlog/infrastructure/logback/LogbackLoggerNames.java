package ca.gc.cra.runlog.infrastructure.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import org.slf4j.event.KeyValuePair;

/**
 * <strong>What:</strong> Separates RunLog logger names from the Logback logger names backing them.
 * <p><strong>Why:</strong> Logback treats {@code root} (any case) as its root logger and dots as hierarchy, so
 * user-chosen names cannot be used as backend names. Backend loggers get a private sequence name and each event
 * carries the RunLog name as the {@value #KEY} key/value pair.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LogbackLoggerNames {
  /** Key/value pair key carrying the RunLog logger name on every emitted event. */
  public static final String KEY = "runlog.logger";

  private static final String BACKEND_PREFIX = "runlog-";

  private LogbackLoggerNames() {
    // Utility
  }

  /**
   * Returns the Logback logger name for the {@code sequence}-th logger of a registry.
   *
   * @param sequence positive per-registry counter
   * @return dot-free name that never collides with the root logger
   */
  public static String backendName(int sequence) {
    return BACKEND_PREFIX + sequence;
  }

  /**
   * Returns the pair to attach to events emitted by the logger named {@code name}.
   *
   * @param name RunLog logger name
   * @return key/value pair under {@link #KEY}
   */
  public static KeyValuePair pair(String name) {
    return new KeyValuePair(KEY, name);
  }

  /**
   * Resolves the RunLog logger name of an event.
   *
   * @param event logging event; must not be {@code null}
   * @return value of the {@link #KEY} pair, or the Logback logger name for events emitted elsewhere
   */
  public static String of(ILoggingEvent event) {
    List<KeyValuePair> pairs = event.getKeyValuePairs();
    if (pairs != null) {
      for (KeyValuePair pair : pairs) {
        if (KEY.equals(pair.key) && pair.value != null) {
          return pair.value.toString();
        }
      }
    }
    return event.getLoggerName();
  }
}
