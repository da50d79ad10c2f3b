package ca.gc.cra.runlog.infrastructure.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.runlog.domain.RunId;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogDirectoryLayoutTest {
  private static final LocalDate DAY = LocalDate.of(2024, 3, 15);
  private static final RunId RUN = RunId.generate(LocalDateTime.of(2024, 3, 15, 10, 20, 30), "nightly");

  @TempDir Path tempDir;

  @Test
  void createRunDirectoryBuildsDayAndRunLevels() {
    LogDirectoryLayout layout = new LogDirectoryLayout(tempDir.resolve("logs"));

    Path runDir = layout.createRunDirectory(DAY, RUN);

    assertEquals(tempDir.resolve("logs/2024-03-15/2024-03-15_102030_nightly"), runDir);
    assertTrue(Files.isDirectory(runDir));
    assertEquals(runDir.resolve("2024-03-15_102030_nightly_main.log"), layout.logFile(runDir, RUN, "main"));
  }

  @Test
  void createRunDirectoryToleratesExistingDirectories() {
    LogDirectoryLayout layout = new LogDirectoryLayout(tempDir);

    Path first = layout.createRunDirectory(DAY, RUN);
    Path second = layout.createRunDirectory(DAY, RUN);

    assertEquals(first, second);
  }

  @Test
  void relativeBaseIsResolvedAbsolute() {
    LogDirectoryLayout layout = new LogDirectoryLayout(Path.of("data", "..", "data", "logs"));

    assertTrue(layout.baseDirectory().isAbsolute());
    assertEquals(Path.of("data", "logs").toAbsolutePath().normalize(), layout.baseDirectory());
  }

  @Test
  void clearDateRemovesOnlyThatDay() throws IOException {
    LogDirectoryLayout layout = new LogDirectoryLayout(tempDir);
    Path runDir = layout.createRunDirectory(DAY, RUN);
    Files.writeString(layout.logFile(runDir, RUN, "main"), "line\n");
    Path otherDay = layout.createRunDirectory(DAY.minusDays(1), RUN);

    assertTrue(layout.clearDate(DAY));
    assertFalse(layout.clearDate(DAY));

    assertFalse(Files.exists(layout.dateDirectory(DAY)));
    assertTrue(Files.isDirectory(otherDay));
  }

  @Test
  void clearAllKeepsBaseDirectory() throws IOException {
    LogDirectoryLayout layout = new LogDirectoryLayout(tempDir.resolve("logs"));
    layout.createRunDirectory(DAY, RUN);
    layout.createRunDirectory(DAY.plusDays(1), RUN);
    Files.writeString(layout.baseDirectory().resolve("notes.txt"), "keep?");

    assertEquals(3, layout.clearAll());

    assertTrue(Files.isDirectory(layout.baseDirectory()));
    try (var entries = Files.list(layout.baseDirectory())) {
      assertEquals(0L, entries.count());
    }
  }

  @Test
  void clearAllOnMissingBaseReturnsZero() {
    LogDirectoryLayout layout = new LogDirectoryLayout(tempDir.resolve("absent"));

    assertEquals(0, layout.clearAll());
  }

  @Test
  void baseDirectoryBlockedByFileFails() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");
    LogDirectoryLayout layout = new LogDirectoryLayout(blocker.resolve("logs"));

    UncheckedIOException ex = assertThrows(UncheckedIOException.class, layout::ensureBaseDirectory);
    assertTrue(ex.getMessage().contains("logs"));
  }

  @Test
  void deleteRecursivelyRemovesNestedTree() throws IOException {
    Path root = Files.createDirectories(tempDir.resolve("a/b/c"));
    Files.writeString(root.resolve("f.log"), "x");

    LogDirectoryLayout.deleteRecursively(tempDir.resolve("a"));

    assertFalse(Files.exists(tempDir.resolve("a")));
  }
}
