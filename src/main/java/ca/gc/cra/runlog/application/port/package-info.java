/**
 * Ports decoupling RunLog bookkeeping from time, metrics, and backend wiring.
 * <p><strong>Role:</strong> Interfaces implemented under {@code ca.gc.cra.runlog.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.runlog.application.port.MetricsPort} defines the {@code runlog.*} names.</p>
 */
package ca.gc.cra.runlog.application.port;
