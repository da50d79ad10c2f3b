package ca.gc.cra.runlog.infrastructure.fs;

import ca.gc.cra.runlog.domain.RunId;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDate;
import java.util.Objects;

/**
 * <strong>What:</strong> Composes and maintains the {@code <base>/<yyyy-MM-dd>/<run_id>/} log tree.
 * <p><strong>Why:</strong> Groups file output per day and per run so operators can find and prune a run's logs.</p>
 * <p><strong>Role:</strong> Filesystem adapter used by loggers when adding file handlers or clearing logs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the base, day, and run directories, treating existing directories as success.</li>
 *   <li>Name handler files {@code <run_id>_<handler>.log}.</li>
 *   <li>Delete a day directory or every entry under the base directory.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable base path; concurrent creation of the same
 * directory is tolerated by {@link Files#createDirectories}.</p>
 * <p><strong>Performance:</strong> Directory creation is a handful of metadata calls; clearing walks the tree.</p>
 * <p><strong>Observability:</strong> Emits no logs; IO failures surface as {@link UncheckedIOException}s naming the
 * offending path.</p>
 *
 * @implNote Deletion does not follow symbolic links; a link inside the tree is removed, not its target.
 * @since 0.1.0
 */
public final class LogDirectoryLayout {
  private static final String LOG_SUFFIX = ".log";

  private final Path baseDirectory;

  /**
   * Creates a layout rooted at {@code baseDirectory}.
   *
   * @param baseDirectory root of the log tree; relative paths are resolved against the working directory
   */
  public LogDirectoryLayout(Path baseDirectory) {
    this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
  }

  public Path baseDirectory() {
    return baseDirectory;
  }

  /**
   * Creates the base directory if it does not exist.
   *
   * @return the base directory
   * @throws UncheckedIOException if the directory cannot be created
   */
  public Path ensureBaseDirectory() {
    return createDirectories(baseDirectory);
  }

  /**
   * Returns the day directory for {@code date} without creating it.
   *
   * @param date day; must not be {@code null}
   * @return {@code <base>/<yyyy-MM-dd>}
   */
  public Path dateDirectory(LocalDate date) {
    return baseDirectory.resolve(RunId.dateStamp(date));
  }

  /**
   * Returns the run directory without creating it.
   *
   * @param date day the file handler is added on
   * @param runId current run identifier
   * @return {@code <base>/<yyyy-MM-dd>/<run_id>}
   */
  public Path runDirectory(LocalDate date, RunId runId) {
    return dateDirectory(date).resolve(runId.value());
  }

  /**
   * Creates the day and run directories if absent.
   *
   * @param date day the file handler is added on
   * @param runId current run identifier
   * @return the run directory
   * @throws UncheckedIOException if a directory cannot be created
   */
  public Path createRunDirectory(LocalDate date, RunId runId) {
    createDirectories(dateDirectory(date));
    return createDirectories(runDirectory(date, runId));
  }

  /**
   * Names a handler's log file inside a run directory.
   *
   * @param runDirectory directory returned by {@link #createRunDirectory(LocalDate, RunId)}
   * @param runId current run identifier
   * @param handlerName handler name
   * @return {@code <runDirectory>/<run_id>_<handler>.log}
   */
  public Path logFile(Path runDirectory, RunId runId, String handlerName) {
    return runDirectory.resolve(runId.value() + '_' + handlerName + LOG_SUFFIX);
  }

  /**
   * Deletes the day directory for {@code date} and everything in it.
   *
   * @param date day to clear
   * @return {@code true} when a directory was deleted
   * @throws UncheckedIOException if deletion fails
   */
  public boolean clearDate(LocalDate date) {
    Path dateDirectory = dateDirectory(date);
    if (!Files.exists(dateDirectory, LinkOption.NOFOLLOW_LINKS)) {
      return false;
    }
    deleteRecursively(dateDirectory);
    return true;
  }

  /**
   * Deletes every file and directory directly under the base directory, keeping the base itself.
   *
   * @return number of top-level entries removed
   * @throws UncheckedIOException if listing or deletion fails
   */
  public int clearAll() {
    if (!Files.isDirectory(baseDirectory)) {
      return 0;
    }
    int removed = 0;
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(baseDirectory)) {
      for (Path entry : entries) {
        deleteRecursively(entry);
        removed++;
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("unable to list log directory " + baseDirectory, ex);
    }
    return removed;
  }

  private static Path createDirectories(Path dir) {
    try {
      return Files.createDirectories(dir);
    } catch (IOException ex) {
      throw new UncheckedIOException("unable to create log directory " + dir, ex);
    }
  }

  static void deleteRecursively(Path root) {
    try {
      if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
        Files.deleteIfExists(root);
        return;
      }
      Files.walkFileTree(root, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
          Files.deleteIfExists(file);
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
          if (exc instanceof NoSuchFileException) {
            return FileVisitResult.CONTINUE;
          }
          throw exc;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
          if (exc != null) {
            throw exc;
          }
          Files.deleteIfExists(dir);
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException ex) {
      throw new UncheckedIOException("unable to delete " + root, ex);
    }
  }
}
