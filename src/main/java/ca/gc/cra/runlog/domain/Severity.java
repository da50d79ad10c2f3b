package ca.gc.cra.runlog.domain;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered severity classification used by RunLog loggers and sinks.
 * <p><strong>Why:</strong> Gives callers one vocabulary for thresholds and emission regardless of the backend's own
 * level set (Logback has no critical level).</p>
 * <p><strong>Role:</strong> Domain enumeration referenced by loggers, sink thresholds, and format rendering.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 * <p><strong>Performance:</strong> Comparisons use ordinals; constant time.</p>
 * <p><strong>Observability:</strong> {@link #label()} is the text written to log lines.</p>
 *
 * @since 0.1.0
 */
public enum Severity {
  /** Verbose diagnostics. */
  DEBUG("DEBUG"),
  /** Progress information. */
  INFO("INFO"),
  /** Something unexpected that does not stop the current operation. */
  WARNING("WARNING"),
  /** An operation failed. */
  ERROR("ERROR"),
  /** The process cannot reasonably continue. */
  CRITICAL("CRITICAL");

  private final String label;

  Severity(String label) {
    this.label = label;
  }

  /**
   * Returns the upper-case name rendered into log lines.
   *
   * @return severity label such as {@code WARNING}
   */
  public String label() {
    return label;
  }

  /**
   * Reports whether this severity passes the supplied threshold.
   *
   * @param threshold minimum severity accepted; must not be {@code null}
   * @return {@code true} when this severity is equal to or more severe than {@code threshold}
   */
  public boolean isAtLeast(Severity threshold) {
    return ordinal() >= threshold.ordinal();
  }

  /**
   * Parses a severity name, accepting {@code warn} as an alias of {@link #WARNING}.
   *
   * @param raw case-insensitive name; must not be blank
   * @return parsed severity
   * @throws IllegalArgumentException if the name is blank or unknown
   */
  public static Severity parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("severity must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("WARN")) {
      return WARNING;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown severity: " + raw, ex);
    }
  }
}
