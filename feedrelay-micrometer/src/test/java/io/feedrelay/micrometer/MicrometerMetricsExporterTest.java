package io.feedrelay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void fetchCounters() {
    exporter.incrementFetchSuccess();
    exporter.incrementFetchSuccess();
    exporter.incrementFetchFailure();
    assertEquals(2.0, counter("feedrelay.fetch.success").count());
    assertEquals(1.0, counter("feedrelay.fetch.failure").count());
  }

  @Test
  void deliveryCounters() {
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliveryFailure();
    assertEquals(3.0, counter("feedrelay.delivery.success").count());
    assertEquals(1.0, counter("feedrelay.delivery.failure").count());
  }

  @Test
  void incrementFeedQuarantined() {
    exporter.incrementFeedQuarantined();
    assertEquals(1.0, counter("feedrelay.feed.quarantined").count());
  }

  @Test
  void admissionCounters() {
    exporter.incrementAdmissionAccepted();
    exporter.incrementAdmissionDeclined();
    exporter.incrementAdmissionDeclined();
    assertEquals(1.0, counter("feedrelay.admission.accepted").count());
    assertEquals(2.0, counter("feedrelay.admission.declined").count());
  }

  @Test
  void incrementPassDeadlineExceeded() {
    exporter.incrementPassDeadlineExceeded();
    assertEquals(1.0, counter("feedrelay.pass.deadline.exceeded").count());
  }

  @Test
  void recordPassDurationMs() {
    exporter.recordPassDurationMs(120L);
    exporter.recordPassDurationMs(80L);

    DistributionSummary summary = registry.find("feedrelay.pass.duration.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(200.0, summary.totalAmount());
    assertEquals(120.0, summary.max());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "news.feedrelay");
    custom.incrementDeliverySuccess();
    custom.recordPassDurationMs(5L);

    assertEquals(1.0, counter("news.feedrelay.delivery.success").count());
    assertNotNull(registry.find("news.feedrelay.pass.duration.ms").summary());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementFetchSuccess();
    exporter.close();

    assertNull(registry.find("feedrelay.fetch.success").counter());
    assertNull(registry.find("feedrelay.pass.duration.ms").summary());
    assertDoesNotThrow(() -> exporter.incrementFetchSuccess());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "feedrelay."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
