package ca.gc.cra.geolayer.infrastructure.host;

import static ca.gc.cra.geolayer.testutil.Fixtures.layer;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geolayer.domain.layer.MapLayer;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryMapHostTest {

  @Test
  void keepsLayersInInsertionOrder() {
    InMemoryMapHost host = new InMemoryMapHost("map");
    MapLayer first = layer("analysis-layer-1");
    MapLayer second = layer("analysis-layer-2");

    host.addLayer(first);
    host.addLayer(second);

    assertEquals(List.of(first, second), host.layers());
    assertTrue(host.removeLayer(first));
    assertFalse(host.removeLayer(first));
    assertEquals(List.of(second), host.layers());
  }

  @Test
  void rejectsDuplicateLayerIds() {
    InMemoryMapHost host = new InMemoryMapHost("map");
    host.addLayer(layer("analysis-layer-1"));

    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> host.addLayer(layer("analysis-layer-1")));
    assertEquals("layer analysis-layer-1 is already attached to map", ex.getMessage());
    assertEquals(1, host.layers().size());
  }
}
