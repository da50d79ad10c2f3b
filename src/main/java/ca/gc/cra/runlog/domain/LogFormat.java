package ca.gc.cra.runlog.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable line template built from ordered {@link LogField} placeholders and literal text.
 * <p><strong>Why:</strong> Lets each sink choose which record fields appear and in what order without exposing
 * backend pattern syntax to callers.</p>
 * <p><strong>Role:</strong> Domain value rendered by the Logback layout adapter.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Provide the named presets ({@link #BASIC}, {@link #LOGGER_NAME}, {@link #LOGGER_NAME_BRACKETS},
 *       {@link #FUNC_NAME}, {@link #MODULE_FUNC_NAME}).</li>
 *   <li>Allow custom compositions through {@link #builder()}.</li>
 *   <li>Render a {@link LogLine} into text (without the trailing line separator).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across sinks.</p>
 * <p><strong>Performance:</strong> Rendering is a single pass over the segment list.</p>
 * <p><strong>Observability:</strong> {@link #describe()} yields a readable template for diagnostics.</p>
 *
 * @since 0.1.0
 */
public final class LogFormat {
  /** {@code timestamp - LEVEL - message}. */
  public static final LogFormat BASIC = builder("basic")
      .field(LogField.TIMESTAMP).text(" - ")
      .field(LogField.LEVEL).text(" - ")
      .field(LogField.MESSAGE)
      .build();

  /** {@code timestamp - logger - LEVEL - message}. */
  public static final LogFormat LOGGER_NAME = builder("logger_name")
      .field(LogField.TIMESTAMP).text(" - ")
      .field(LogField.LOGGER_NAME).text(" - ")
      .field(LogField.LEVEL).text(" - ")
      .field(LogField.MESSAGE)
      .build();

  /** {@code timestamp - [logger][LEVEL]: message}. */
  public static final LogFormat LOGGER_NAME_BRACKETS = builder("logger_name_brackets")
      .field(LogField.TIMESTAMP).text(" - ")
      .bracketed(LogField.LOGGER_NAME)
      .bracketed(LogField.LEVEL).text(": ")
      .field(LogField.MESSAGE)
      .build();

  /** {@code timestamp [LEVEL][function]: message}. */
  public static final LogFormat FUNC_NAME = builder("func_name")
      .field(LogField.TIMESTAMP).text(" ")
      .bracketed(LogField.LEVEL)
      .bracketed(LogField.FUNC_NAME).text(": ")
      .field(LogField.MESSAGE)
      .build();

  /** {@code timestamp [LEVEL][module][function]: message}. */
  public static final LogFormat MODULE_FUNC_NAME = builder("module_func_name")
      .field(LogField.TIMESTAMP).text(" ")
      .bracketed(LogField.LEVEL)
      .bracketed(LogField.MODULE)
      .bracketed(LogField.FUNC_NAME).text(": ")
      .field(LogField.MESSAGE)
      .build();

  private static final List<LogFormat> PRESETS =
      List.of(BASIC, LOGGER_NAME, LOGGER_NAME_BRACKETS, FUNC_NAME, MODULE_FUNC_NAME);

  private final String name;
  private final List<Segment> segments;

  private LogFormat(String name, List<Segment> segments) {
    this.name = name;
    this.segments = List.copyOf(segments);
  }

  /**
   * Starts a custom format.
   *
   * @return empty builder named {@code custom}
   */
  public static Builder builder() {
    return new Builder("custom");
  }

  /**
   * Starts a named custom format.
   *
   * @param name label reported by {@link #name()}; must not be blank
   * @return empty builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Resolves a preset by name, case-insensitively; hyphens and underscores are interchangeable.
   *
   * @param raw preset name such as {@code basic} or {@code module-func-name}
   * @return matching preset
   * @throws IllegalArgumentException if no preset has that name
   */
  public static LogFormat preset(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("format name must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (LogFormat preset : PRESETS) {
      if (preset.name.equals(normalized)) {
        return preset;
      }
    }
    throw new IllegalArgumentException("unknown log format: " + raw);
  }

  /**
   * Returns the format label.
   *
   * @return preset name or the name given to the builder
   */
  public String name() {
    return name;
  }

  /**
   * Reports whether rendering needs the caller's class, method, or line.
   *
   * @return {@code true} when a location field is present
   */
  public boolean needsCallerData() {
    for (Segment segment : segments) {
      LogField field = segment.field();
      if (field == LogField.MODULE || field == LogField.FUNC_NAME || field == LogField.LINE_NO) {
        return true;
      }
    }
    return false;
  }

  /**
   * Renders a record.
   *
   * @param line record values; must not be {@code null}
   * @return rendered text without a line separator
   */
  public String render(LogLine line) {
    Objects.requireNonNull(line, "line");
    StringBuilder sb = new StringBuilder(64 + line.message().length());
    for (Segment segment : segments) {
      if (segment.field() == null) {
        sb.append(segment.literal());
      } else if (segment.bracketed()) {
        sb.append('[').append(line.valueOf(segment.field())).append(']');
      } else {
        sb.append(line.valueOf(segment.field()));
      }
    }
    return sb.toString();
  }

  /**
   * Describes the template with {@code %(field)} placeholders, e.g. {@code %(timestamp) - %(level) - %(message)}.
   *
   * @return readable template
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      if (segment.field() == null) {
        sb.append(segment.literal());
        continue;
      }
      String placeholder = "%(" + segment.field().name().toLowerCase(Locale.ROOT) + ")";
      sb.append(segment.bracketed() ? "[" + placeholder + "]" : placeholder);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LogFormat other)) {
      return false;
    }
    return name.equals(other.name) && segments.equals(other.segments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, segments);
  }

  @Override
  public String toString() {
    return name + "{" + describe() + "}";
  }

  private record Segment(LogField field, boolean bracketed, String literal) {}

  /** Accumulates segments for a {@link LogFormat}. */
  public static final class Builder {
    private final String name;
    private final List<Segment> segments = new ArrayList<>();

    private Builder(String name) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("format name must not be blank");
      }
      this.name = name.trim();
    }

    /**
     * Appends a plain placeholder.
     *
     * @param field placeholder; must not be {@code null}
     * @return this builder
     */
    public Builder field(LogField field) {
      segments.add(new Segment(Objects.requireNonNull(field, "field"), false, null));
      return this;
    }

    /**
     * Appends a placeholder wrapped in square brackets.
     *
     * @param field placeholder; must not be {@code null}
     * @return this builder
     */
    public Builder bracketed(LogField field) {
      segments.add(new Segment(Objects.requireNonNull(field, "field"), true, null));
      return this;
    }

    /**
     * Appends literal text.
     *
     * @param literal text copied verbatim; must not be {@code null}
     * @return this builder
     */
    public Builder text(String literal) {
      segments.add(new Segment(null, false, Objects.requireNonNull(literal, "literal")));
      return this;
    }

    /**
     * Builds the immutable format.
     *
     * @return format
     * @throws IllegalStateException if no segment was added
     */
    public LogFormat build() {
      if (segments.isEmpty()) {
        throw new IllegalStateException("format " + name + " has no segments");
      }
      return new LogFormat(name, segments);
    }
  }
}
