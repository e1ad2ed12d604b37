package ca.gc.cra.geolayer.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "boundaries=./zips.geojson", " records = out.json ", "otelResourceAttributes=team=geo"});

    assertEquals(List.of("boundaries", "records", "otelResourceAttributes"), List.copyOf(map.keySet()));
    assertEquals("./zips.geojson", map.get("boundaries"));
    assertEquals("out.json", map.get("records"));
    assertEquals("team=geo", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"boundaries"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"records="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"rules=a\0b"}));
  }

  @Test
  void nullOrBlankInputYieldsEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {" ", null}).isEmpty());
  }
}
