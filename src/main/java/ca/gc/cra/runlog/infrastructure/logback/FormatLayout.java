package ca.gc.cra.runlog.infrastructure.logback;

import ca.gc.cra.runlog.domain.LogFormat;
import ca.gc.cra.runlog.domain.LogLine;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * <strong>What:</strong> Logback layout rendering events through a RunLog {@link LogFormat}.
 * <p><strong>Why:</strong> Keeps the line shape in the domain format rather than in pattern strings, and renders the
 * critical severity Logback itself cannot name.</p>
 * <p><strong>Role:</strong> Infrastructure adapter between Logback events and {@link LogLine}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; Logback serializes calls per appender.</p>
 * <p><strong>Performance:</strong> Caller data (a stack walk) is only resolved when the format shows a location
 * field.</p>
 *
 * @since 0.1.0
 */
final class FormatLayout extends LayoutBase<ILoggingEvent> {
  static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

  private final LogFormat format;
  private final DateTimeFormatter timestamp;

  FormatLayout(LogFormat format, ZoneId zone) {
    this.format = Objects.requireNonNull(format, "format");
    this.timestamp = TIMESTAMP.withZone(Objects.requireNonNull(zone, "zone"));
  }

  @Override
  public String doLayout(ILoggingEvent event) {
    String module = null;
    String function = null;
    int line = -1;
    if (format.needsCallerData()) {
      StackTraceElement[] callerData = event.getCallerData();
      if (callerData != null && callerData.length > 0) {
        StackTraceElement caller = callerData[0];
        module = simpleName(caller.getClassName());
        function = caller.getMethodName();
        line = caller.getLineNumber();
      }
    }
    LogLine logLine = new LogLine(
        timestamp.format(Instant.ofEpochMilli(event.getTimeStamp())),
        LogbackLoggerNames.of(event),
        LogbackSeverities.of(event),
        module,
        function,
        line,
        event.getFormattedMessage());

    StringBuilder sb = new StringBuilder(128);
    sb.append(format.render(logLine)).append(CoreConstants.LINE_SEPARATOR);
    IThrowableProxy thrown = event.getThrowableProxy();
    if (thrown != null) {
      sb.append(ThrowableProxyUtil.asString(thrown)).append(CoreConstants.LINE_SEPARATOR);
    }
    return sb.toString();
  }

  private static String simpleName(String className) {
    if (className == null) {
      return null;
    }
    int idx = className.lastIndexOf('.');
    return idx < 0 ? className : className.substring(idx + 1);
  }
}
