/**
 * Core domain vocabulary for RunLog: severities, line formats, run identifiers, and sink kinds.
 * <p><strong>Role:</strong> Domain layer types without backend dependencies.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.</p>
 * <p><strong>Performance:</strong> Rendering and parsing are single-pass string operations.</p>
 * <p><strong>Metrics:</strong> None emitted here.</p>
 * <p><strong>Security:</strong> Run names end up in file names; callers validate them before construction.</p>
 */
package ca.gc.cra.runlog.domain;
