package ca.gc.cra.runlog.infrastructure.metrics;

import ca.gc.cra.runlog.application.port.MetricsPort;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards RunLog lifecycle counters to an OpenTelemetry {@link Meter}.
 * <p>Instruments are created lazily per key and cached. The SDK and exporter are owned by the host application;
 * this adapter only needs the API.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  /** Instrumentation scope used when the adapter obtains its own meter. */
  public static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.runlog";
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("runlog.metric.key");
  private static final String FALLBACK_METRIC_NAME = "runlog.metric";

  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();

  /** Creates an adapter on the globally registered OpenTelemetry instance (no-op when none is registered). */
  public OpenTelemetryMetricsAdapter() {
    this(GlobalOpenTelemetry.get());
  }

  /**
   * Creates an adapter on the supplied OpenTelemetry instance.
   *
   * @param openTelemetry configured OpenTelemetry; must not be {@code null}
   */
  public OpenTelemetryMetricsAdapter(OpenTelemetry openTelemetry) {
    this(Objects.requireNonNull(openTelemetry, "openTelemetry").getMeter(INSTRUMENTATION_SCOPE));
  }

  /**
   * Creates an adapter on an existing meter.
   *
   * @param meter meter to build instruments on; must not be {@code null}
   */
  public OpenTelemetryMetricsAdapter(Meter meter) {
    this.meter = Objects.requireNonNull(meter, "meter");
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  private CounterInstrument createCounter(String key) {
    String sanitized = sanitizeName(key);
    LongCounter counter = meter
        .counterBuilder(sanitized)
        .setUnit("1")
        .setDescription("RunLog counter for " + key)
        .build();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, sanitized);
    }
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
        result.append(c);
      } else {
        result.append('_');
      }
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}
}
