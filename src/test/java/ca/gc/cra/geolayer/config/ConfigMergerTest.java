package ca.gc.cra.geolayer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("render");
    Map<String, String> yaml = Map.of("boundaries", "/yaml/zips.geojson", "records", "/yaml/out.json",
        "hostId", "yaml-host");
    Map<String, String> cli = Map.of("hostId", "cli-host", "buildWorkers", "4");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "render", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("cli-host", merged.get("hostId"));
    assertEquals("4", merged.get("buildWorkers"));
    assertEquals("/yaml/zips.geojson", merged.get("boundaries"));
    assertEquals("30000", merged.get("buildTtlMillis"));
    assertEquals(List.of("CLI overrides YAML for key: hostId"), warnings);
  }

  @Test
  void renderRequiresBoundariesAndRecords() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("render");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "render", Optional.empty(), Map.of("records", "out.json"), defaults, msg -> {}));
    assertEquals("boundaries is required", ex.getMessage());

    ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "render", Optional.empty(), Map.of("boundaries", "zips.geojson", "records", " "), defaults, msg -> {}));
    assertTrue(ex.getMessage().startsWith("records"));
  }
}
