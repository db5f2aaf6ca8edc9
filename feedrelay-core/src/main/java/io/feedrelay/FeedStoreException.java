package io.feedrelay;

/**
 * Unchecked exception wrapping storage errors thrown by
 * {@link io.feedrelay.spi.SubscriptionStore} implementations.
 *
 * <p>Store errors are transient: callers fail the current operation (or skip the current
 * feed during an update pass) and retry on the next request or tick.
 */
public final class FeedStoreException extends RuntimeException {
  public FeedStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
