package io.feedrelay;

/**
 * Admission constraints, declared in reporting priority order: when several limits
 * are reached at once the lowest ordinal is reported.
 */
public enum QuotaViolation {
  /** The destination already holds the maximum number of subscriptions. */
  DESTINATION_LIMIT,
  /** The owner already created the maximum number of distinct feeds. */
  OWNER_TOTAL_LIMIT,
  /** The owner already holds the maximum number of active subscriptions. */
  OWNER_ACTIVE_LIMIT
}
