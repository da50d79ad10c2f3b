package ca.gc.cra.runlog.domain;

import java.util.Locale;

/**
 * Kinds of output a sink can write to.
 *
 * @since 0.1.0
 */
public enum SinkKind {
  /** Standard output or error stream. */
  CONSOLE,
  /** UTF-8 file opened in append mode under the run directory. */
  FILE;

  /**
   * Parses a kind name case-insensitively.
   *
   * @param raw {@code console} or {@code file}
   * @return parsed kind
   * @throws IllegalArgumentException if the name is blank or unknown
   */
  public static SinkKind parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("sink kind must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown sink kind: " + raw, ex);
    }
  }
}
