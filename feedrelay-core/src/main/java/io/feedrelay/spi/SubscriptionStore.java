package io.feedrelay.spi;

import io.feedrelay.Feed;
import io.feedrelay.QuotaUsage;
import io.feedrelay.Subscriber;
import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.cursor.RecordCursor;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for feeds, subscriptions, fetch failures and the request log.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Failures surface as {@link io.feedrelay.FeedStoreException}.
 * Implementations live in the {@code feedrelay-jdbc} module.
 *
 * <p>Cursors returned by the {@code stream*} methods keep a statement open on the given
 * connection; the connection must stay open until the cursor is closed.
 *
 * @see io.feedrelay.jdbc.store.AbstractJdbcSubscriptionStore
 */
public interface SubscriptionStore {

  // ---- admission ----

  /**
   * Makes sure the lock rows used by {@link #lockAdmission} exist for the owner, the
   * destination and the feed URL. Must run outside the admission transaction
   * (auto-commit), since a concurrent creator may win the insert.
   */
  void ensureAdmissionScopes(Connection conn, long ownerId, long destinationId, String url);

  /**
   * Takes row locks on the owner's, the destination's and then the feed URL's admission
   * row, serializing concurrent admissions that share any of them. Admissions of the same
   * unseen URL thus create the feed once; later ones find it. Must run inside a transaction.
   */
  void lockAdmission(Connection conn, long ownerId, long destinationId, String url);

  /**
   * Reads all three quota counts in one round trip, so they observe one snapshot.
   */
  QuotaUsage quotaUsage(Connection conn, long ownerId, long destinationId);

  /**
   * Looks a feed up by URL; the URL is normalized before comparison.
   *
   * @return the feed, or empty if no feed has this identity
   */
  Optional<Feed> findFeedByUrl(Connection conn, String url);

  /**
   * Inserts a feed and returns its generated id.
   *
   * @param url       URL used for fetching
   * @param title     title discovered at subscription time (may be {@code null})
   * @param ownerId   owner recorded as the feed's creator
   * @param createdAt creation time
   */
  long insertFeed(Connection conn, String url, String title, long ownerId, Instant createdAt);

  /**
   * Returns {@code true} if the destination already has a subscription to the feed.
   */
  boolean isSubscribed(Connection conn, long destinationId, long feedId);

  /**
   * Inserts a subscription row. Its position in the destination's list is after all
   * existing subscriptions and never changes.
   */
  void insertSubscription(Connection conn, long destinationId, long feedId, long ownerId, Instant lastUpdate);

  // ---- destination views ----

  /**
   * Resolves a 1-based ordinal position within the destination's subscription list.
   *
   * @return the feed at that position, or empty if out of range
   */
  Optional<Feed> feedAtPosition(Connection conn, long destinationId, int position);

  /**
   * Deletes one subscription.
   *
   * @return the number of rows deleted (0 or 1)
   */
  int deleteSubscription(Connection conn, long destinationId, long feedId);

  /**
   * Streams the destination's feeds in subscription order (the order ordinals refer to).
   */
  RecordCursor<Feed> streamSubscriptions(Connection conn, long destinationId, CancellationToken token);

  // ---- update engine ----

  /**
   * Streams every feed.
   */
  RecordCursor<Feed> streamFeeds(Connection conn, CancellationToken token);

  /**
   * Streams the subscribers of a feed whose progress marker is strictly before {@code notAfter}.
   */
  RecordCursor<Subscriber> streamSubscribers(Connection conn, long feedId, Instant notAfter,
      CancellationToken token);

  /**
   * Moves a subscription's progress marker forward to {@code lastUpdate}. The marker never
   * moves backwards.
   *
   * @return 1 if the row was updated, 0 if it no longer exists or is already past {@code lastUpdate}
   */
  int advanceSubscription(Connection conn, long destinationId, long feedId, Instant lastUpdate);

  // ---- quarantine ----

  /**
   * Lists every destination subscribed to the feed, regardless of progress.
   */
  List<Long> destinationsOf(Connection conn, long feedId);

  /**
   * Appends a fetch failure record.
   */
  void recordFetchFailure(Connection conn, long feedId, Instant at);

  /**
   * Counts fetch failures recorded for the feed at or after {@code since}.
   */
  int countFetchFailures(Connection conn, long feedId, Instant since);

  /**
   * Deletes a feed together with its subscriptions and failure records.
   *
   * @return the number of feed rows deleted (0 or 1)
   */
  int deleteFeed(Connection conn, long feedId);

  // ---- request log ----

  /**
   * Appends a command request to the request log.
   */
  void recordRequest(Connection conn, long ownerId, Instant at, String name, String text);

  /**
   * Counts the owner's requests at or after {@code since}.
   */
  int countRequests(Connection conn, long ownerId, Instant since);
}
