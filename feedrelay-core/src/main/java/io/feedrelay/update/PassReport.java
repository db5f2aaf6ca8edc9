package io.feedrelay.update;

import java.time.Duration;

/**
 * Summary of one update pass.
 *
 * @param outcome        how the pass ended
 * @param feedsProcessed feeds whose processing finished (successfully or with a recorded failure)
 * @param itemsDelivered items handed to the notifier and recorded as progress
 * @param fetchFailures  feeds that failed to fetch or had no freshness timestamp
 * @param duration       wall time of the pass
 * @param error          the error that aborted the pass, or {@code null}
 */
public record PassReport(
    Outcome outcome,
    int feedsProcessed,
    int itemsDelivered,
    int fetchFailures,
    Duration duration,
    Exception error
) {

  public enum Outcome {
    /** Every feed was processed before the deadline. */
    COMPLETED,
    /** The pass deadline elapsed; remaining work was left for the next tick. */
    DEADLINE_EXCEEDED,
    /** Shutdown was requested while the pass was running. */
    CANCELLED,
    /** The feed list could not be read; nothing was processed. */
    FAILED
  }
}
