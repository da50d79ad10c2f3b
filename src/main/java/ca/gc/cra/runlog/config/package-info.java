/**
 * YAML configuration and startup wiring for RunLog registries.
 * <p><strong>Role:</strong> Bootstrap layer turning declared loggers and handlers into live ones.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Names flowing into file paths are checked by {@code ca.gc.cra.runlog.validation}.</p>
 */
package ca.gc.cra.runlog.config;
