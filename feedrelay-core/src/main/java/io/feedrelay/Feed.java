package io.feedrelay;

/**
 * A feed row as stored by a {@link io.feedrelay.spi.SubscriptionStore}.
 *
 * <p>{@code url} is the address the feed is fetched from; identity is the
 * {@linkplain FeedUrls#normalize normalized} form of it. {@code title} may be
 * {@code null} when the store query does not project it.
 */
public record Feed(long id, String url, String title) {

  /**
   * Returns the title if known, otherwise the URL.
   */
  public String displayName() {
    return title == null || title.isBlank() ? url : title;
  }
}
