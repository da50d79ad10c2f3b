package ca.gc.cra.runlog.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.runlog.FixedClock;
import ca.gc.cra.runlog.application.LoggerRegistry;
import ca.gc.cra.runlog.application.RunLogger;
import ca.gc.cra.runlog.application.port.MetricsPort;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OpenTelemetryMetricsAdapterTest {
  @TempDir Path tempDir;

  private InMemoryMetricReader reader;
  private SdkMeterProvider meterProvider;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
    adapter = new OpenTelemetryMetricsAdapter(meterProvider.get(OpenTelemetryMetricsAdapter.INSTRUMENTATION_SCOPE));
  }

  @AfterEach
  void tearDown() {
    meterProvider.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment(MetricsPort.HANDLER_ATTACHED);
    adapter.increment(MetricsPort.HANDLER_ATTACHED);
    adapter.increment(MetricsPort.HANDLER_ATTACHED);

    MetricData counter = find(reader.collectAllMetrics(), MetricsPort.HANDLER_ATTACHED).orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals(MetricsPort.HANDLER_ATTACHED,
        point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
  }

  @Test
  void registryLifecycleIsCounted() {
    try (LoggerRegistry registry = new LoggerRegistry(tempDir, new FixedClock(), adapter)) {
      RunLogger logger = registry.getOrCreate("svc");
      logger.addFileHandler();
      logger.addFileHandler();
      logger.removeHandler("main");
    }

    Collection<MetricData> metrics = reader.collectAllMetrics();
    assertEquals(1L, sum(metrics, MetricsPort.LOGGER_CREATED));
    assertEquals(1L, sum(metrics, MetricsPort.HANDLER_ATTACHED));
    assertEquals(1L, sum(metrics, MetricsPort.HANDLER_DUPLICATE));
    assertEquals(1L, sum(metrics, MetricsPort.SINK_CLOSED));
    assertEquals(1L, sum(metrics, MetricsPort.LOGGER_DELETED));
  }

  @Test
  void sanitizeNameReplacesUnsupportedCharacters() {
    assertEquals("m9_bad_key", OpenTelemetryMetricsAdapter.sanitizeName("9 bad key"));
    assertEquals("runlog.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertTrue(OpenTelemetryMetricsAdapter.sanitizeName("Runlog.Sink").equals("runlog.sink"));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  private static long sum(Collection<MetricData> metrics, String name) {
    return find(metrics, name)
        .map(metric -> metric.getLongSumData().getPoints().iterator().next().getValue())
        .orElse(0L);
  }
}
