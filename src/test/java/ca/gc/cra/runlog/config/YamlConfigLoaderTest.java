package ca.gc.cra.runlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadFlattensNestedMapsInDocumentOrder() throws IOException {
    Path yaml = tempDir.resolve("runlog.yaml");
    Files.writeString(yaml, """
        baseDir: /var/log/app
        loggers:
          svc:
            handlers:
              main:
                level: debug
              console:
                target: stderr
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals("/var/log/app", map.get("baseDir"));
    assertEquals("debug", map.get("loggers.svc.handlers.main.level"));
    assertEquals(List.of(
        "baseDir",
        "loggers.svc.handlers.main.level",
        "loggers.svc.handlers.console.target"), List.copyOf(map.keySet()));
  }

  @Test
  void nullValuesBecomeEmptyStrings() throws IOException {
    Path yaml = tempDir.resolve("bare.yaml");
    Files.writeString(yaml, """
        loggers:
          svc:
        """);

    assertEquals(Map.of("loggers.svc", ""), YamlConfigLoader.load(yaml).orElseThrow());
  }

  @Test
  void loadWithProfileOverlaysCommonSection() throws IOException {
    Path yaml = tempDir.resolve("profiles.yaml");
    Files.writeString(yaml, """
        common:
          baseDir: data/logs
          runName: shared
        Test:
          runName: ci
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "test").orElseThrow();

    assertEquals("data/logs", map.get("baseDir"));
    assertEquals("ci", map.get("runName"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"));

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertTrue(YamlConfigLoader.load(yaml).orElseThrow().isEmpty());
  }

  @Test
  void sequencesAreRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        loggers:
          - svc
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - baseDir: data
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }

  @Test
  void malformedYamlNamesPath() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "baseDir: [unterminated\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
    assertTrue(ex.getMessage().contains("broken.yaml"));
  }
}
