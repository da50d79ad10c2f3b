/**
 * Metrics adapters that bridge the RunLog metrics port to OpenTelemetry or no-op implementations.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and cache instruments per key.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code runlog.logger.*}, {@code runlog.handler.*}, and
 * {@code runlog.sink.*} counters.</p>
 */
package ca.gc.cra.runlog.infrastructure.metrics;
