package ca.gc.cra.runlog.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for logger, handler, and run names.
 * <p><strong>Why:</strong> Handler and run names become directory and file name segments, so separators and control
 * characters must never reach the filesystem layer.</p>
 * <p><strong>Role:</strong> Support utilities invoked by the registry and loggers before any state changes.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Names {
  private static final String FORBIDDEN_SEGMENT_CHARS = "/\\:*?\"<>|";

  private Names() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value can be embedded in a single file or directory name.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate segment; must not be {@code null}
   * @return trimmed segment
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank, is {@code .} or {@code ..}, or contains a path separator
   *         or a character Windows forbids in file names
   */
  public static String requireFileNameSegment(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.equals(".") || trimmed.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative path marker"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (FORBIDDEN_SEGMENT_CHARS.indexOf(trimmed.charAt(i)) >= 0) {
        throw new IllegalArgumentException(
            message(name, "must not contain any of " + FORBIDDEN_SEGMENT_CHARS + ": " + trimmed));
      }
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
