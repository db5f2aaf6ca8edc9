package io.feedrelay;

/**
 * Thrown by {@link io.feedrelay.spi.FeedSource#fetch} when a feed cannot be downloaded
 * or parsed. Counted towards quarantine by the update pass.
 */
public class FeedFetchException extends Exception {
  public FeedFetchException(String message) {
    super(message);
  }

  public FeedFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
