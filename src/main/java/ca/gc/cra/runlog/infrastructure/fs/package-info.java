/**
 * Filesystem adapters maintaining the per-day, per-run log directory tree.
 * <p><strong>Role:</strong> Adapter layer used by loggers for file handler paths and log pruning.</p>
 * <p><strong>Concurrency:</strong> Directory creation tolerates concurrent creators; deletion is not coordinated with
 * open file handlers.</p>
 * <p><strong>Security:</strong> Recursive deletion never follows symbolic links.</p>
 */
package ca.gc.cra.runlog.infrastructure.fs;
