package ca.gc.cra.geolayer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndRenderSections() throws IOException {
    Path yaml = tempDir.resolve("geolayer.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          verbose: true
        render:
          boundaries: /data/zips.geojson
          buildTtlMillis: 45000
        other:
          boundaries: ignored
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "render");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("true", map.get("verbose"));
    assertEquals("/data/zips.geojson", map.get("boundaries"));
    assertEquals("45000", map.get("buildTtlMillis"));
    assertEquals(4, map.size());
  }

  @Test
  void renderSectionOverridesCommonAndNestedKeysFlatten() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          hostId: shared
        Render:
          hostId: dashboard
          cache:
            ttl: 10
          rules:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "render").orElseThrow();
    assertEquals("dashboard", map.get("hostId"));
    assertEquals("10", map.get("cache.ttl"));
    assertEquals("", map.get("rules"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "render").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "render").orElseThrow());
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = Files.writeString(tempDir.resolve("list.yaml"), """
        - render:
            boundaries: a
        """);
    Path array = Files.writeString(tempDir.resolve("array.yaml"), """
        render:
          boundaries: [a, b]
        """);
    Path scalar = Files.writeString(tempDir.resolve("scalar.yaml"), "render: yes\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "render: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "render"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(array, "render"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "render"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "render"));
  }
}
