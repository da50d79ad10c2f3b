package ca.gc.cra.runlog.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.runlog.FixedClock;
import ca.gc.cra.runlog.application.port.MetricsPort;
import ca.gc.cra.runlog.domain.ConsoleTarget;
import ca.gc.cra.runlog.domain.LogFormat;
import ca.gc.cra.runlog.domain.Severity;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunLoggerTest {
  private static final String LINE_PREFIX = "\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d{3}";

  @TempDir Path tempDir;

  private RecordingMetrics metrics;
  private LoggerRegistry registry;
  private Path base;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetrics();
    base = tempDir.resolve("logs");
    registry = new LoggerRegistry(base, new FixedClock(), metrics);
  }

  @AfterEach
  void tearDown() {
    registry.close();
  }

  @Test
  void fileHandlerPathFollowsDateAndRunLayout() {
    RunLogger logger = registry.getOrCreate("svc");

    Path file = logger.addFileHandler().orElseThrow();

    Path runDir = base.toAbsolutePath().normalize()
        .resolve(FixedClock.DEFAULT_DATE)
        .resolve(FixedClock.DEFAULT_RUN_ID);
    assertEquals(runDir.resolve(FixedClock.DEFAULT_RUN_ID + "_main.log"), file);
    assertTrue(Files.isRegularFile(file));
    assertEquals(Optional.of(runDir), logger.runDirectory());
    assertEquals(Optional.of(runDir.getParent()), logger.dateDirectory());
    assertEquals(Optional.of(Severity.INFO), logger.handlerLevel(RunLogger.DEFAULT_FILE_HANDLER));
    assertTrue(logger.hasHandler("main"));
    assertFalse(logger.hasHandler("other"));
  }

  @Test
  void directoriesAreAbsentUntilFirstFileHandler() {
    RunLogger logger = registry.getOrCreate("svc");
    logger.addConsoleHandler("console");

    assertEquals(Optional.empty(), logger.runDirectory());
    assertEquals(Optional.empty(), logger.dateDirectory());
    assertFalse(Files.exists(base.resolve(FixedClock.DEFAULT_DATE)));
  }

  @Test
  void debugAndInfoReachDebugLevelHandlerInOrder() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path file = logger.addFileHandler("main", Severity.DEBUG).orElseThrow();

    logger.debug("first");
    logger.info("second");

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).matches(LINE_PREFIX + " - DEBUG - File handler main added to logger svc with path: .*"),
        lines.get(0));
    assertTrue(lines.get(1).matches(LINE_PREFIX + " - DEBUG - first"), lines.get(1));
    assertTrue(lines.get(2).matches(LINE_PREFIX + " - INFO - second"), lines.get(2));
  }

  @Test
  void infoHandlerDropsDebugRecords() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path file = logger.addFileHandler().orElseThrow();

    logger.debug("hidden");
    logger.warn("shown");

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).endsWith(" - WARNING - shown"), lines.get(0));
  }

  @Test
  void duplicateHandlerIsIgnoredWithSingleWarning() {
    RunLogger logger = registry.getOrCreate("svc");
    ListAppender<ILoggingEvent> captured = capture(logger);
    try {
      assertTrue(logger.addConsoleHandler("console", Severity.INFO, LogFormat.BASIC, ConsoleTarget.STDERR));

      assertFalse(logger.addConsoleHandler("console", Severity.DEBUG, LogFormat.LOGGER_NAME));

      Sink sink = logger.handler("console").orElseThrow();
      assertEquals(Severity.INFO, sink.level());
      assertEquals(LogFormat.BASIC, sink.format());
      assertEquals(Optional.of(ConsoleTarget.STDERR), sink.consoleTarget());
    } finally {
      release(logger, captured);
    }

    List<ILoggingEvent> warnings = warnings(captured);
    assertEquals(1, warnings.size());
    assertEquals("Handler with name console already exists in logger svc", warnings.get(0).getFormattedMessage());
    assertEquals(1L, metrics.counter(MetricsPort.HANDLER_DUPLICATE));
  }

  @Test
  void duplicateFileHandlerReturnsEmptyAndKeepsOriginal() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path file = logger.addFileHandler("main", Severity.WARNING).orElseThrow();

    Optional<Path> again = logger.addFileHandler("main", Severity.DEBUG);

    assertEquals(Optional.empty(), again);
    assertEquals(Optional.of(Severity.WARNING), logger.handlerLevel("main"));
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).endsWith(" - WARNING - Handler with name main already exists in logger svc"));
  }

  @Test
  void fileHandlerNameMustBeFileNameSegment() {
    RunLogger logger = registry.getOrCreate("svc");

    assertThrows(IllegalArgumentException.class, () -> logger.addFileHandler("../main"));
    assertThrows(IllegalArgumentException.class, () -> logger.addFileHandler("a/b"));
    assertTrue(logger.handlerNames().isEmpty());
  }

  @Test
  void clearTodaysLogsThenAddRecreatesTree() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    logger.addFileHandler("main");
    logger.info("before clear");
    Path dateDir = logger.dateDirectory().orElseThrow();

    assertTrue(logger.clearTodaysLogs());
    assertFalse(Files.exists(dateDir));

    Path fresh = logger.addFileHandler("second").orElseThrow();
    assertTrue(Files.isDirectory(dateDir));
    assertTrue(Files.isRegularFile(fresh));
    assertEquals(0L, Files.size(fresh));
  }

  @Test
  void clearTodaysLogsWithoutTreeReturnsFalse() {
    RunLogger logger = registry.getOrCreate("svc");

    assertFalse(logger.clearTodaysLogs());
  }

  @Test
  void clearAllLogsEmptiesBaseDirectory() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    logger.addFileHandler("main");
    Files.writeString(logger.baseDirectory().resolve("stray.txt"), "x");

    assertEquals(2, logger.clearAllLogs());

    assertTrue(Files.isDirectory(logger.baseDirectory()));
    try (var entries = Files.list(logger.baseDirectory())) {
      assertEquals(0L, entries.count());
    }
  }

  @Test
  void joinedHandlerInterleavesLinesInEmissionOrder() throws IOException {
    RunLogger a = registry.getOrCreate("a");
    RunLogger b = registry.getOrCreate("b");
    Path file = a.addFileHandler("main").orElseThrow();

    assertTrue(b.joinHandler("a", "main"));
    a.info("a1");
    b.info("b1");
    a.info("a2");

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).endsWith(" - INFO - a1"));
    assertTrue(lines.get(1).endsWith(" - INFO - b1"));
    assertTrue(lines.get(2).endsWith(" - INFO - a2"));
    assertSame(a.handler("main").orElseThrow(), b.handler("main").orElseThrow());
    assertEquals(2, a.handler("main").orElseThrow().attachments());
  }

  @Test
  void joinHandlerFailsForUnknownLoggerOrHandler() {
    RunLogger a = registry.getOrCreate("a");
    RunLogger b = registry.getOrCreate("b");
    a.addConsoleHandler("console");

    assertThrows(LoggerNotFoundException.class, () -> b.joinHandler("missing", "console"));
    HandlerNotFoundException ex =
        assertThrows(HandlerNotFoundException.class, () -> b.joinHandler("a", "main"));
    assertEquals("a", ex.loggerName());
    assertEquals("main", ex.handlerName());
    assertTrue(b.handlerNames().isEmpty());
  }

  @Test
  void joinHandlerOnClosedSinkReportsMissingHandler() {
    RunLogger a = registry.getOrCreate("a");
    RunLogger b = registry.getOrCreate("b");
    a.addConsoleHandler("console");
    a.handler("console").orElseThrow().close();

    HandlerNotFoundException ex =
        assertThrows(HandlerNotFoundException.class, () -> b.joinHandler("a", "console"));
    assertEquals("a", ex.loggerName());
    assertEquals("console", ex.handlerName());
    assertTrue(b.handlerNames().isEmpty());
  }

  @Test
  void joinHandlerWithTakenNameWarnsAndKeepsOwnHandler() {
    RunLogger a = registry.getOrCreate("a");
    RunLogger b = registry.getOrCreate("b");
    a.addConsoleHandler("console", Severity.ERROR);
    b.addConsoleHandler("console", Severity.DEBUG);
    ListAppender<ILoggingEvent> captured = capture(b);
    try {
      assertFalse(b.joinHandler("a", "console"));
    } finally {
      release(b, captured);
    }

    assertEquals(Optional.of(Severity.DEBUG), b.handlerLevel("console"));
    assertEquals(1, warnings(captured).size());
  }

  @Test
  void sharedSinkClosesWhenLastLoggerRemovesIt() throws IOException {
    RunLogger a = registry.getOrCreate("a");
    RunLogger b = registry.getOrCreate("b");
    Path file = a.addFileHandler("main").orElseThrow();
    b.joinHandler("a", "main");
    Sink sink = a.handler("main").orElseThrow();

    assertTrue(a.removeHandler("main"));
    assertFalse(sink.isClosed());
    a.info("dropped");
    b.info("kept");

    assertTrue(b.removeHandler("main"));
    assertTrue(sink.isClosed());
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).endsWith(" - INFO - kept"));
    assertEquals(1L, metrics.counter(MetricsPort.SINK_CLOSED));
  }

  @Test
  void removeUnknownHandlerWarns() {
    RunLogger logger = registry.getOrCreate("svc");
    ListAppender<ILoggingEvent> captured = capture(logger);
    try {
      assertFalse(logger.removeHandler("ghost"));
    } finally {
      release(logger, captured);
    }

    List<ILoggingEvent> warnings = warnings(captured);
    assertEquals(1, warnings.size());
    assertEquals("RunLogger.removeHandler() -> Handler ghost does not exist in logger svc",
        warnings.get(0).getFormattedMessage());
    assertEquals(1L, metrics.counter(MetricsPort.HANDLER_MISSING));
  }

  @Test
  void setHandlerLevelFiltersOnlyThatHandler() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path main = logger.addFileHandler("main", Severity.DEBUG).orElseThrow();
    Path all = logger.addFileHandler("all", Severity.DEBUG).orElseThrow();

    assertTrue(logger.setHandlerLevel("main", Severity.ERROR));
    logger.debug("quiet");
    logger.error("loud");

    List<String> mainLines = Files.readAllLines(main, StandardCharsets.UTF_8);
    List<String> allLines = Files.readAllLines(all, StandardCharsets.UTF_8);
    assertTrue(mainLines.get(mainLines.size() - 1).endsWith(" - ERROR - loud"));
    assertFalse(mainLines.stream().anyMatch(line -> line.endsWith(" - DEBUG - quiet")));
    assertEquals(List.of(" - DEBUG - quiet", " - ERROR - loud"),
        allLines.subList(allLines.size() - 2, allLines.size()).stream()
            .map(line -> line.substring(line.indexOf(" - ")))
            .toList());
  }

  @Test
  void setHandlerLevelOnUnknownHandlerWarns() {
    RunLogger logger = registry.getOrCreate("svc");
    ListAppender<ILoggingEvent> captured = capture(logger);
    try {
      assertFalse(logger.setHandlerLevel("ghost", Severity.ERROR));
    } finally {
      release(logger, captured);
    }

    assertEquals("RunLogger.setHandlerLevel() -> Handler ghost does not exist in logger svc",
        warnings(captured).get(0).getFormattedMessage());
  }

  @Test
  void loggerMinimumGatesBeforeHandlers() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path file = logger.addFileHandler("main", Severity.DEBUG).orElseThrow();
    logger.setLevel(Severity.ERROR);

    logger.info("dropped");
    logger.critical("kept");

    assertFalse(logger.isEnabledFor(Severity.WARNING));
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertTrue(lines.get(lines.size() - 1).endsWith(" - CRITICAL - kept"));
    assertFalse(lines.stream().anyMatch(line -> line.endsWith("dropped")));
  }

  @Test
  void criticalAndErrorAreDistinguishedByHandlers() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path file = logger.addFileHandler("main", Severity.CRITICAL, LogFormat.LOGGER_NAME).orElseThrow();

    logger.error("plain error");
    logger.log(RunLogger.CRITICAL, "fatal");

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).matches(LINE_PREFIX + " - svc - CRITICAL - fatal"), lines.get(0));
  }

  @Test
  void errorWithThrowableWritesStackTrace() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path file = logger.addFileHandler().orElseThrow();

    logger.error("failed", new IllegalStateException("bad state"));

    String content = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(content.contains(" - ERROR - failed"));
    assertTrue(content.contains("java.lang.IllegalStateException: bad state"));
  }

  @Test
  void locationFormatsNameCallingMethod() throws IOException {
    RunLogger logger = registry.getOrCreate("svc");
    Path file = logger.addFileHandler("where", Severity.INFO, LogFormat.MODULE_FUNC_NAME).orElseThrow();

    logger.info("here");

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertTrue(lines.get(0).endsWith(" [INFO][RunLoggerTest][locationFormatsNameCallingMethod]: here"),
        lines.get(0));
  }

  @Test
  void loggerNamedRootWritesUnderItsOwnName() throws IOException {
    RunLogger lower = registry.getOrCreate("root");
    RunLogger upper = registry.getOrCreate("ROOT");
    Path lowerFile = lower.addFileHandler("lower", Severity.DEBUG, LogFormat.LOGGER_NAME).orElseThrow();
    Path upperFile = upper.addFileHandler("upper", Severity.INFO, LogFormat.LOGGER_NAME).orElseThrow();

    lower.info("hello");
    upper.info("shout");

    List<String> lowerLines = Files.readAllLines(lowerFile, StandardCharsets.UTF_8);
    assertEquals(2, lowerLines.size());
    assertTrue(lowerLines.get(0).contains(" - root - DEBUG - File handler lower added to logger root"),
        lowerLines.get(0));
    assertTrue(lowerLines.get(1).matches(LINE_PREFIX + " - root - INFO - hello"), lowerLines.get(1));
    List<String> upperLines = Files.readAllLines(upperFile, StandardCharsets.UTF_8);
    assertEquals(1, upperLines.size());
    assertTrue(upperLines.get(0).matches(LINE_PREFIX + " - ROOT - INFO - shout"), upperLines.get(0));
  }

  @Test
  void dottedNameIsNotALogbackHierarchy() throws IOException {
    RunLogger parent = registry.getOrCreate("app");
    RunLogger child = registry.getOrCreate("app.db");
    Path parentFile = parent.addFileHandler("parent", Severity.INFO, LogFormat.LOGGER_NAME).orElseThrow();

    child.info("child only");
    parent.info("parent only");

    List<String> lines = Files.readAllLines(parentFile, StandardCharsets.UTF_8);
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).endsWith(" - app - INFO - parent only"), lines.get(0));
  }

  @Test
  void delegateIsDebugLevelAndNotAdditive() {
    RunLogger logger = registry.getOrCreate("svc");

    assertEquals(Level.DEBUG, logger.delegate().getLevel());
    assertFalse(logger.delegate().isAdditive());
  }

  @Test
  void severityConstantsAliasWarning() {
    assertSame(RunLogger.WARNING, RunLogger.WARN);
    assertSame(Severity.CRITICAL, RunLogger.CRITICAL);
  }

  private static ListAppender<ILoggingEvent> capture(RunLogger logger) {
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.delegate().addAppender(appender);
    return appender;
  }

  private static void release(RunLogger logger, ListAppender<ILoggingEvent> appender) {
    logger.delegate().detachAppender(appender);
    appender.stop();
  }

  private static List<ILoggingEvent> warnings(ListAppender<ILoggingEvent> appender) {
    return appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .toList();
  }
}
