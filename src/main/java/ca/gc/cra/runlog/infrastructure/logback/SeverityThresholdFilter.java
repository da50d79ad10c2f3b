package ca.gc.cra.runlog.infrastructure.logback;

import ca.gc.cra.runlog.application.SeverityThreshold;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Objects;

/**
 * Appender filter denying records below a sink's {@link SeverityThreshold}.
 * <p>Reads the threshold on every decision, so level changes apply to the next record.</p>
 *
 * @since 0.1.0
 */
final class SeverityThresholdFilter extends Filter<ILoggingEvent> {
  private final SeverityThreshold threshold;

  SeverityThresholdFilter(SeverityThreshold threshold) {
    this.threshold = Objects.requireNonNull(threshold, "threshold");
  }

  @Override
  public FilterReply decide(ILoggingEvent event) {
    if (!isStarted()) {
      return FilterReply.NEUTRAL;
    }
    return threshold.allows(LogbackSeverities.of(event)) ? FilterReply.NEUTRAL : FilterReply.DENY;
  }
}
