package io.feedrelay.update;

import io.feedrelay.Feed;
import io.feedrelay.FeedDocument;
import io.feedrelay.FeedFetchException;
import io.feedrelay.FeedItem;
import io.feedrelay.FeedStoreException;
import io.feedrelay.Subscriber;
import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.cursor.RecordCursor;
import io.feedrelay.cursor.StreamingConnection;
import io.feedrelay.quarantine.QuarantinePolicy;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.FeedSource;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.spi.Notifier;
import io.feedrelay.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One run of the update engine across all feeds.
 *
 * <p>Feeds are processed sequentially. For each feed the document is fetched, its
 * freshness timestamp determined, and only subscribers whose progress marker is behind
 * it are read. Each subscriber receives its new items oldest first, one message per
 * item, and its marker is advanced to the item's publish time after each delivery.
 * The pass deadline is checked after every fetch failure and every delivery.
 *
 * <p>Instances are single-use and not thread-safe; {@link FeedUpdater} creates one per tick.
 */
final class UpdatePass {
  private static final Logger logger = Logger.getLogger(UpdatePass.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore store;
  private final FeedSource feedSource;
  private final Notifier notifier;
  private final QuarantinePolicy quarantine;
  private final ItemFormatter formatter;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final CancellationToken token;

  private int feedsProcessed;
  private int itemsDelivered;
  private int fetchFailures;

  UpdatePass(ConnectionProvider connectionProvider, SubscriptionStore store, FeedSource feedSource,
      Notifier notifier, QuarantinePolicy quarantine, ItemFormatter formatter, MetricsExporter metrics,
      Clock clock, CancellationToken token) {
    this.connectionProvider = connectionProvider;
    this.store = store;
    this.feedSource = feedSource;
    this.notifier = notifier;
    this.quarantine = quarantine;
    this.formatter = formatter;
    this.metrics = metrics;
    this.clock = clock;
    this.token = token;
  }

  PassReport run() {
    Instant started = clock.instant();
    try (StreamingConnection sc = StreamingConnection.open(connectionProvider);
         RecordCursor<Feed> feeds = store.streamFeeds(sc.connection(), token)) {
      while (feeds.hasNext()) {
        if (!processFeed(feeds.next())) {
          return report(stoppedOutcome(), started, null);
        }
      }
    } catch (SQLException | FeedStoreException e) {
      logger.log(Level.SEVERE, "Update pass aborted: cannot list feeds", e);
      return report(PassReport.Outcome.FAILED, started, e);
    }
    if (token.isCancelled()) {
      // the feed cursor stops early once the token fires
      return report(stoppedOutcome(), started, null);
    }
    return report(PassReport.Outcome.COMPLETED, started, null);
  }

  /**
   * Returns {@code false} if the pass must stop.
   */
  private boolean processFeed(Feed feed) {
    logger.log(Level.FINE, "Loading feed {0}", feed.url());
    FeedDocument document;
    try {
      document = feedSource.fetch(feed.url(), token.remaining().orElse(Duration.ZERO));
    } catch (FeedFetchException | RuntimeException e) {
      if (token.isCancelled()) {
        logger.log(Level.FINE, "Fetch of " + feed.url() + " interrupted by pass deadline", e);
        return false;
      }
      fetchFailed(feed, String.valueOf(e.getMessage()));
      return true;
    }

    Optional<Instant> freshness = document.freshness();
    if (freshness.isEmpty()) {
      fetchFailed(feed, "no timestamp");
      return !token.isCancelled();
    }
    metrics.incrementFetchSuccess();

    try (StreamingConnection sc = StreamingConnection.open(connectionProvider);
         RecordCursor<Subscriber> subscribers =
             store.streamSubscribers(sc.connection(), feed.id(), truncate(freshness.get()), token)) {
      while (subscribers.hasNext()) {
        if (!deliver(feed, document, subscribers.next())) {
          return false;
        }
      }
    } catch (SQLException | FeedStoreException e) {
      logger.log(Level.WARNING, "Skipping feed " + feed.url() + ": cannot read subscribers", e);
    }
    feedsProcessed++;
    return !token.isCancelled();
  }

  /**
   * Delivers the subscriber's new items in publish order. Returns {@code false} if the
   * pass must stop.
   */
  private boolean deliver(Feed feed, FeedDocument document, Subscriber subscriber) {
    List<FeedItem> newItems = newItems(document, subscriber.lastUpdate());
    logger.log(Level.FINE, "Destination {0}: {1} item(s) of {2} published after {3}",
        new Object[] {subscriber.destinationId(), newItems.size(), feed.url(), subscriber.lastUpdate()});

    for (FeedItem item : newItems) {
      try {
        notifier.send(subscriber.destinationId(), formatter.format(feed, item));
      } catch (Exception e) {
        metrics.incrementDeliveryFailure();
        logger.log(Level.WARNING, "Delivery to destination " + subscriber.destinationId()
            + " failed; remaining items of " + feed.url() + " wait for the next pass", e);
        return !token.isCancelled();
      }
      metrics.incrementDeliverySuccess();
      itemsDelivered++;

      if (!advance(feed, subscriber.destinationId(), truncate(item.publishedAt()))) {
        return !token.isCancelled();
      }
      if (token.isCancelled()) {
        return false;
      }
    }
    return true;
  }

  private boolean advance(Feed feed, long destinationId, Instant publishedAt) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (store.advanceSubscription(conn, destinationId, feed.id(), publishedAt) == 0) {
        logger.log(Level.INFO, "Subscription of destination {0} to {1} is gone; stopping its delivery",
            new Object[] {destinationId, feed.url()});
        return false;
      }
      return true;
    } catch (SQLException | FeedStoreException e) {
      logger.log(Level.WARNING, "Failed to advance destination " + destinationId + " on " + feed.url(), e);
      return false;
    }
  }

  private void fetchFailed(Feed feed, String reason) {
    fetchFailures++;
    feedsProcessed++;
    metrics.incrementFetchFailure();
    try {
      quarantine.recordFailure(feed, reason);
    } catch (FeedStoreException e) {
      logger.log(Level.WARNING, "Failed to record fetch failure of " + feed.url(), e);
    }
  }

  static List<FeedItem> newItems(FeedDocument document, Instant lastUpdate) {
    List<FeedItem> items = new ArrayList<>();
    for (FeedItem item : document.items()) {
      if (item.publishedAt() != null && truncate(item.publishedAt()).isAfter(lastUpdate)) {
        items.add(item);
      }
    }
    items.sort(Comparator.comparing(FeedItem::publishedAt));
    return items;
  }

  private PassReport.Outcome stoppedOutcome() {
    return token.isDeadlineExceeded() ? PassReport.Outcome.DEADLINE_EXCEEDED : PassReport.Outcome.CANCELLED;
  }

  private PassReport report(PassReport.Outcome outcome, Instant started, Exception error) {
    Duration duration = Duration.between(started, clock.instant());
    if (duration.isNegative()) {
      duration = Duration.ZERO;
    }
    return new PassReport(outcome, feedsProcessed, itemsDelivered, fetchFailures, duration, error);
  }

  private static Instant truncate(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS);
  }
}
