package ca.gc.cra.runlog.domain;

import java.util.Locale;

/**
 * Standard stream a console sink writes to.
 *
 * @since 0.1.0
 */
public enum ConsoleTarget {
  /** {@code System.out}. */
  STDOUT("System.out"),
  /** {@code System.err}. */
  STDERR("System.err");

  private final String backendName;

  ConsoleTarget(String backendName) {
    this.backendName = backendName;
  }

  /**
   * Returns the target name understood by Logback's console appender.
   *
   * @return {@code System.out} or {@code System.err}
   */
  public String backendName() {
    return backendName;
  }

  /**
   * Parses {@code stdout}/{@code stderr} (or the {@code System.out}/{@code System.err} spellings).
   *
   * @param raw target name; blank yields {@link #STDOUT}
   * @return parsed target
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ConsoleTarget parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return STDOUT;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "stdout", "out", "system.out" -> STDOUT;
      case "stderr", "err", "system.err" -> STDERR;
      default -> throw new IllegalArgumentException("unknown console target: " + raw);
    };
  }
}
