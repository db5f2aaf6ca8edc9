package io.feedrelay.spi;

/**
 * Observability hook for exporting relay counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of feeds fetched with a usable freshness timestamp.
   */
  void incrementFetchSuccess();

  /**
   * Increments the count of fetches that failed or returned no freshness timestamp.
   */
  void incrementFetchFailure();

  /**
   * Increments the count of items handed to the notifier.
   */
  void incrementDeliverySuccess();

  /**
   * Increments the count of items the notifier rejected.
   */
  void incrementDeliveryFailure();

  /**
   * Increments the count of feeds dropped by quarantine.
   */
  void incrementFeedQuarantined();

  /**
   * Increments the count of subscriptions created.
   */
  default void incrementAdmissionAccepted() {
  }

  /**
   * Increments the count of admissions declined by a quota limit.
   */
  default void incrementAdmissionDeclined() {
  }

  /**
   * Increments the count of update passes that ran out of time.
   */
  void incrementPassDeadlineExceeded();

  /**
   * Records how long an update pass took.
   *
   * @param durationMs pass duration in milliseconds (always non-negative)
   */
  void recordPassDurationMs(long durationMs);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementFetchSuccess() {
    }

    @Override
    public void incrementFetchFailure() {
    }

    @Override
    public void incrementDeliverySuccess() {
    }

    @Override
    public void incrementDeliveryFailure() {
    }

    @Override
    public void incrementFeedQuarantined() {
    }

    @Override
    public void incrementPassDeadlineExceeded() {
    }

    @Override
    public void recordPassDurationMs(long durationMs) {
    }
  }
}
