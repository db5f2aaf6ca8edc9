package io.feedrelay.update;

import io.feedrelay.Feed;
import io.feedrelay.FeedItem;

/**
 * Renders one feed item as message text.
 */
@FunctionalInterface
public interface ItemFormatter {

  /**
   * Title, description and link separated by blank lines.
   */
  ItemFormatter DEFAULT = (feed, item) ->
      item.title() + "\n" + item.description() + "\n\nLink: " + item.link();

  String format(Feed feed, FeedItem item);
}
