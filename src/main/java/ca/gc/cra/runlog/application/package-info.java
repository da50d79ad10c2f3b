/**
 * Logger registry, named loggers, and shareable sinks.
 * <p><strong>Role:</strong> Application layer; callers obtain {@link ca.gc.cra.runlog.application.RunLogger} instances
 * from a {@link ca.gc.cra.runlog.application.LoggerRegistry}.</p>
 * <p><strong>Concurrency:</strong> The registry and each logger guard their maps with their own lock; locks are taken
 * logger first, registry second.</p>
 * <p><strong>Performance:</strong> Emission goes straight to Logback; bookkeeping happens only on handler changes.</p>
 * <p><strong>Metrics:</strong> Lifecycle counters through {@link ca.gc.cra.runlog.application.port.MetricsPort}.</p>
 * <p><strong>Security:</strong> Handler and run names are validated before they reach the filesystem.</p>
 */
package ca.gc.cra.runlog.application;
