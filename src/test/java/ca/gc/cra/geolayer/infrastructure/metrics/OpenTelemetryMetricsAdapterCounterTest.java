package ca.gc.cra.geolayer.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void cacheCountersCarryTheirKeyAndServiceResource() {
    adapter.increment("cache.build.started");
    adapter.increment("cache.build.started");
    adapter.increment("cache.hit");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    Optional<MetricData> maybeCounter = metrics.stream()
        .filter(metric -> metric.getName().equals("cache.build.started"))
        .findFirst();
    assertTrue(maybeCounter.isPresent(), "cache.build.started should be exported");

    MetricData counter = maybeCounter.orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("cache.build.started", point.getAttributes().get(AttributeKey.stringKey("geolayer.metric.key")));

    assertEquals("geolayer", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "service.instance.id should be set");
  }

  @Test
  void sanitizesInstrumentNames() {
    assertEquals("cache.forcereplace", OpenTelemetryMetricsAdapter.sanitizeName("cache.forceReplace"));
    assertEquals("m9.lives", OpenTelemetryMetricsAdapter.sanitizeName("9.lives"));
    assertEquals("join_rate_", OpenTelemetryMetricsAdapter.sanitizeName(" join rate% "));
    assertEquals("geolayer.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
