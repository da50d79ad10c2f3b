package ca.gc.cra.runlog.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Process-scoped identifier namespacing file output per execution.
 * <p><strong>Why:</strong> Keeps the logs of separate runs apart even when they share a day directory.</p>
 * <p><strong>Role:</strong> Domain value owned by the logger registry and embedded in directory and file names.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Performance:</strong> Formatting happens once per generation.</p>
 * <p><strong>Observability:</strong> {@link #value()} appears in every file handler path.</p>
 *
 * @param dateStamp generation date, {@code yyyy-MM-dd}
 * @param timeStamp generation time, {@code HHmmss}
 * @param runName optional caller-supplied run name
 * @since 0.1.0
 */
public record RunId(String dateStamp, String timeStamp, Optional<String> runName) {
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmss");

  public RunId {
    Objects.requireNonNull(dateStamp, "dateStamp");
    Objects.requireNonNull(timeStamp, "timeStamp");
    runName = runName == null ? Optional.empty() : runName;
  }

  /**
   * Generates an identifier without a run name.
   *
   * @param now local generation time; must not be {@code null}
   * @return identifier rendering as {@code yyyy-MM-dd_HHmmss}
   */
  public static RunId generate(LocalDateTime now) {
    return new RunId(dateStamp(now.toLocalDate()), now.format(TIME), Optional.empty());
  }

  /**
   * Generates an identifier carrying a run name.
   *
   * @param now local generation time; must not be {@code null}
   * @param runName run name appended after the datetime stamp; must not be {@code null}
   * @return identifier rendering as {@code yyyy-MM-dd_HHmmss_runName}
   */
  public static RunId generate(LocalDateTime now, String runName) {
    Objects.requireNonNull(runName, "runName");
    return new RunId(dateStamp(now.toLocalDate()), now.format(TIME), Optional.of(runName));
  }

  /**
   * Formats a date the way day directories are named.
   *
   * @param date date to format; must not be {@code null}
   * @return {@code yyyy-MM-dd}
   */
  public static String dateStamp(LocalDate date) {
    return date.format(DATE);
  }

  /**
   * Returns the datetime stamp without the run name.
   *
   * @return {@code yyyy-MM-dd_HHmmss}
   */
  public String datetimeStamp() {
    return dateStamp + '_' + timeStamp;
  }

  /**
   * Returns the full identifier.
   *
   * @return {@code yyyy-MM-dd_HHmmss} or {@code yyyy-MM-dd_HHmmss_runName}
   */
  public String value() {
    return runName.map(name -> datetimeStamp() + '_' + name).orElseGet(this::datetimeStamp);
  }

  @Override
  public String toString() {
    return value();
  }
}
