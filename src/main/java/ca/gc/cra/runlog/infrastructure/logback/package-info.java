/**
 * Logback adapters turning RunLog sinks into appenders, layouts, and filters.
 * <p><strong>Role:</strong> Adapter layer between the registry's handler bookkeeping and Logback Classic.</p>
 * <p><strong>Concurrency:</strong> Appenders serialize writes internally; adapters hold no mutable state of their own.</p>
 * <p><strong>Performance:</strong> Caller data is computed only for formats that show a location field.</p>
 * <p><strong>Metrics:</strong> None; lifecycle counters are recorded by the registry.</p>
 */
package ca.gc.cra.runlog.infrastructure.logback;
