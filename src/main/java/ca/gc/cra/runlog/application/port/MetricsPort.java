package ca.gc.cra.runlog.application.port;

/**
 * <strong>What:</strong> Port abstracting RunLog lifecycle metrics.
 * <p><strong>Why:</strong> Lets the registry count logger and handler lifecycle events without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code runlog.handler.attached}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /** Logger created by the registry. */
  String LOGGER_CREATED = "runlog.logger.created";
  /** Logger removed from the registry. */
  String LOGGER_DELETED = "runlog.logger.deleted";
  /** Sink attached to a logger (add or join). */
  String HANDLER_ATTACHED = "runlog.handler.attached";
  /** Sink detached from a logger (remove or delete). */
  String HANDLER_DETACHED = "runlog.handler.detached";
  /** Add or join ignored because the handler name was taken. */
  String HANDLER_DUPLICATE = "runlog.handler.duplicate";
  /** Remove or set-level ignored because the handler name was unknown. */
  String HANDLER_MISSING = "runlog.handler.missing";
  /** Sink stopped after its last attachment was released. */
  String SINK_CLOSED = "runlog.sink.closed";

  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   */
  void increment(String key);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}
  };
}
