/**
 * <strong>Purpose:</strong> Validation helpers for names that reach the logging backend and the filesystem.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Security:</strong> Rejects separators and control characters before they are used in paths.</p>
 */
package ca.gc.cra.runlog.validation;
