package io.feedrelay;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed feed document returned by a {@link io.feedrelay.spi.FeedSource}.
 *
 * @param title     feed title (may be {@code null})
 * @param updatedAt feed-level update time, or {@code null} if the document has none
 * @param items     document items in source order
 */
public record FeedDocument(String title, Instant updatedAt, List<FeedItem> items) {

  public FeedDocument {
    items = List.copyOf(Objects.requireNonNull(items, "items"));
  }

  /**
   * Returns the point in time this document last changed.
   *
   * <p>The feed-level update time wins; without it, the newest item publish time is used.
   * Empty when neither exists, which callers treat the same as a failed fetch.
   */
  public Optional<Instant> freshness() {
    if (updatedAt != null) {
      return Optional.of(updatedAt);
    }
    return items.stream()
        .map(FeedItem::publishedAt)
        .filter(Objects::nonNull)
        .max(Instant::compareTo);
  }
}
