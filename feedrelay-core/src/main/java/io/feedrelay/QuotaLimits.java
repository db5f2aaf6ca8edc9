package io.feedrelay;

import java.util.Optional;

/**
 * Admission limits. A limit of {@code 0} means unlimited.
 *
 * @param maxFeedsPerDestination maximum subscriptions per destination
 * @param maxTotalFeedsByOwner   maximum distinct feeds an owner may create
 * @param maxActiveFeedsByOwner  maximum subscriptions an owner may hold
 */
public record QuotaLimits(int maxFeedsPerDestination, int maxTotalFeedsByOwner, int maxActiveFeedsByOwner) {

  /** No limits at all. */
  public static final QuotaLimits UNLIMITED = new QuotaLimits(0, 0, 0);

  public QuotaLimits {
    if (maxFeedsPerDestination < 0 || maxTotalFeedsByOwner < 0 || maxActiveFeedsByOwner < 0) {
      throw new IllegalArgumentException("quota limits must be >= 0");
    }
  }

  /**
   * Evaluates all limits against one usage snapshot.
   *
   * @param usage counts read in the admission transaction
   * @return the highest-priority violated limit, or empty if admission may proceed
   */
  public Optional<QuotaViolation> check(QuotaUsage usage) {
    if (reached(maxFeedsPerDestination, usage.destinationSubscriptions())) {
      return Optional.of(QuotaViolation.DESTINATION_LIMIT);
    }
    if (reached(maxTotalFeedsByOwner, usage.ownerFeeds())) {
      return Optional.of(QuotaViolation.OWNER_TOTAL_LIMIT);
    }
    if (reached(maxActiveFeedsByOwner, usage.ownerSubscriptions())) {
      return Optional.of(QuotaViolation.OWNER_ACTIVE_LIMIT);
    }
    return Optional.empty();
  }

  private static boolean reached(int limit, int count) {
    return limit != 0 && count >= limit;
  }
}
