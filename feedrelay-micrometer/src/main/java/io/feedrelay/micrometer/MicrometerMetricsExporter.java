package io.feedrelay.micrometer;

import io.feedrelay.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a distribution summary with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code feedrelay.fetch.success} - feeds fetched with a freshness timestamp</li>
 *   <li>{@code feedrelay.fetch.failure} - fetches that failed or had no timestamp</li>
 *   <li>{@code feedrelay.delivery.success} - items handed to the notifier</li>
 *   <li>{@code feedrelay.delivery.failure} - items the notifier rejected</li>
 *   <li>{@code feedrelay.feed.quarantined} - feeds dropped after repeated failures</li>
 *   <li>{@code feedrelay.admission.accepted} - subscriptions created</li>
 *   <li>{@code feedrelay.admission.declined} - admissions refused by a quota</li>
 *   <li>{@code feedrelay.pass.deadline.exceeded} - update passes that ran out of time</li>
 * </ul>
 *
 * <h3>Summaries</h3>
 * <ul>
 *   <li>{@code feedrelay.pass.duration.ms} - update pass duration</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter fetchSuccess;
  private final Counter fetchFailure;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter feedQuarantined;
  private final Counter admissionAccepted;
  private final Counter admissionDeclined;
  private final Counter passDeadlineExceeded;
  private final DistributionSummary passDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "feedrelay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "feedrelay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "news.feedrelay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.fetchSuccess = counter(namePrefix + ".fetch.success", "Feeds fetched with a freshness timestamp");
    this.fetchFailure = counter(namePrefix + ".fetch.failure", "Feed fetches that failed");
    this.deliverySuccess = counter(namePrefix + ".delivery.success", "Items delivered");
    this.deliveryFailure = counter(namePrefix + ".delivery.failure", "Items the notifier rejected");
    this.feedQuarantined = counter(namePrefix + ".feed.quarantined", "Feeds dropped after repeated failures");
    this.admissionAccepted = counter(namePrefix + ".admission.accepted", "Subscriptions created");
    this.admissionDeclined = counter(namePrefix + ".admission.declined", "Admissions refused by a quota");
    this.passDeadlineExceeded = counter(namePrefix + ".pass.deadline.exceeded", "Update passes that ran out of time");
    this.passDuration = DistributionSummary.builder(namePrefix + ".pass.duration.ms")
        .description("Update pass duration")
        .baseUnit("milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementFetchSuccess() {
    if (closed) return;
    fetchSuccess.increment();
  }

  @Override
  public void incrementFetchFailure() {
    if (closed) return;
    fetchFailure.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementFeedQuarantined() {
    if (closed) return;
    feedQuarantined.increment();
  }

  @Override
  public void incrementAdmissionAccepted() {
    if (closed) return;
    admissionAccepted.increment();
  }

  @Override
  public void incrementAdmissionDeclined() {
    if (closed) return;
    admissionDeclined.increment();
  }

  @Override
  public void incrementPassDeadlineExceeded() {
    if (closed) return;
    passDeadlineExceeded.increment();
  }

  @Override
  public void recordPassDurationMs(long durationMs) {
    if (closed) return;
    passDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link io.feedrelay.FeedRelay} is closed) to prevent stale meters.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(fetchSuccess, fetchFailure, deliverySuccess, deliveryFailure,
        feedQuarantined, admissionAccepted, admissionDeclined, passDeadlineExceeded, passDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
