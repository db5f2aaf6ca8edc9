package io.feedrelay;

import java.time.Instant;

/**
 * A single entry of a fetched {@link FeedDocument}.
 *
 * @param title       item title (may be empty)
 * @param description item summary (may be empty)
 * @param link        item link (may be empty)
 * @param publishedAt publish time, or {@code null} when the document carries none
 */
public record FeedItem(String title, String description, String link, Instant publishedAt) {

  public FeedItem {
    title = title == null ? "" : title;
    description = description == null ? "" : description;
    link = link == null ? "" : link;
  }
}
