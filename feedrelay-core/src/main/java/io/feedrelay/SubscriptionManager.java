package io.feedrelay;

import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.cursor.RecordCursor;
import io.feedrelay.cursor.StreamingConnection;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.FeedSource;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous subscription operations invoked by command handling: admission, removal
 * by ordinal position, and listing.
 *
 * <p>Admission runs in one transaction: the owner's and destination's admission rows are
 * locked, all three quota counts are read in a single query, then the feed is looked up
 * or inserted and the subscription inserted. Concurrent admissions sharing an owner or a
 * destination are serialized by the locks, so they cannot jointly exceed a limit.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class SubscriptionManager {
  private static final Logger logger = Logger.getLogger(SubscriptionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore store;
  private final FeedSource feedSource;
  private final QuotaLimits limits;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration fetchTimeout;

  private SubscriptionManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.feedSource = builder.feedSource;
    this.limits = builder.limits != null ? builder.limits : QuotaLimits.UNLIMITED;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.fetchTimeout.isNegative() || builder.fetchTimeout.isZero()) {
      throw new IllegalArgumentException("fetchTimeout must be positive");
    }
    this.fetchTimeout = builder.fetchTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public QuotaLimits limits() {
    return limits;
  }

  /**
   * Subscribes a destination to a feed URL, discovering the title of a previously unseen
   * feed through the {@link FeedSource}.
   *
   * @throws FeedStoreException   on storage failure
   * @throws IllegalStateException if the feed is unknown and no feed source is configured
   */
  public AdmissionResult subscribe(long ownerId, long destinationId, String url) {
    Objects.requireNonNull(url, "url");
    String title;
    Optional<Feed> known = findFeed(url);
    if (known.isPresent()) {
      title = known.get().title();
    } else {
      if (feedSource == null) {
        throw new IllegalStateException("No FeedSource configured to discover feed titles");
      }
      try {
        title = feedSource.fetch(url.trim(), fetchTimeout).title();
      } catch (FeedFetchException e) {
        logger.log(Level.FINE, "Fetch failed while subscribing to " + url, e);
        return AdmissionResult.fetchFailed(url, e.getMessage());
      }
    }
    return addSubscription(ownerId, destinationId, url, title);
  }

  /**
   * Adds a feed to a destination in one transaction, enforcing the quota limits.
   *
   * <p>Quotas are evaluated before anything else; when several limits are reached the
   * {@linkplain QuotaViolation highest-priority} one is reported. Any failure rolls the
   * whole transaction back.
   *
   * @param ownerId       the requesting owner
   * @param destinationId the destination receiving items
   * @param url           the feed URL
   * @param title         the title to record if the feed is created
   * @return the admission outcome
   * @throws FeedStoreException on storage failure
   */
  public AdmissionResult addSubscription(long ownerId, long destinationId, String url, String title) {
    String feedUrl = Objects.requireNonNull(url, "url").trim();
    FeedUrls.normalize(feedUrl);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      store.ensureAdmissionScopes(conn, ownerId, destinationId, feedUrl);

      conn.setAutoCommit(false);
      conn.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
      try {
        AdmissionResult result = admit(conn, ownerId, destinationId, feedUrl, title);
        if (result instanceof AdmissionResult.Admitted) {
          conn.commit();
          metrics.incrementAdmissionAccepted();
        } else {
          conn.rollback();
          if (result instanceof AdmissionResult.Declined) {
            metrics.incrementAdmissionDeclined();
          }
        }
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to add subscription for destination " + destinationId, e);
    }
  }

  private AdmissionResult admit(Connection conn, long ownerId, long destinationId, String url, String title) {
    store.lockAdmission(conn, ownerId, destinationId, url);

    QuotaUsage usage = store.quotaUsage(conn, ownerId, destinationId);
    Optional<QuotaViolation> violation = limits.check(usage);
    if (violation.isPresent()) {
      logger.log(Level.INFO, "Admission declined: owner={0} destination={1} reason={2}",
          new Object[] {ownerId, destinationId, violation.get()});
      return AdmissionResult.declined(violation.get());
    }

    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    Optional<Feed> existing = store.findFeedByUrl(conn, url);
    Feed feed;
    if (existing.isPresent()) {
      feed = existing.get();
      if (store.isSubscribed(conn, destinationId, feed.id())) {
        return AdmissionResult.alreadySubscribed(feed);
      }
    } else {
      long id = store.insertFeed(conn, url, title, ownerId, now);
      feed = new Feed(id, url, title);
    }

    store.insertSubscription(conn, destinationId, feed.id(), ownerId, now);
    return AdmissionResult.admitted(feed);
  }

  /**
   * Removes the subscription at a 1-based position of the destination's list.
   *
   * @return the removed feed, or empty if the position is out of range
   * @throws FeedStoreException on storage failure
   */
  public Optional<Feed> unsubscribe(long destinationId, int position) {
    if (position < 1) {
      return Optional.empty();
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        Optional<Feed> feed = store.feedAtPosition(conn, destinationId, position);
        if (feed.isEmpty() || store.deleteSubscription(conn, destinationId, feed.get().id()) == 0) {
          conn.rollback();
          return Optional.empty();
        }
        conn.commit();
        return feed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to remove subscription " + position
          + " of destination " + destinationId, e);
    }
  }

  /**
   * Streams the destination's feeds in the order ordinal positions refer to.
   * The returned cursor owns a connection; close it.
   *
   * @throws FeedStoreException on storage failure
   */
  public RecordCursor<Feed> listSubscriptions(long destinationId, CancellationToken token) {
    StreamingConnection sc = null;
    try {
      sc = StreamingConnection.open(connectionProvider);
      return RecordCursor.closing(store.streamSubscriptions(sc.connection(), destinationId, token), sc);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(sc, e);
      if (e instanceof RuntimeException re) {
        throw re;
      }
      throw new FeedStoreException("Failed to list subscriptions of destination " + destinationId, e);
    }
  }

  /**
   * Looks a feed up by URL (normalized).
   *
   * @throws FeedStoreException on storage failure
   */
  public Optional<Feed> findFeed(String url) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.findFeedByUrl(conn, url);
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to look up feed " + url, e);
    }
  }

  private static void closeQuietly(StreamingConnection sc, Exception primary) {
    if (sc == null) {
      return;
    }
    try {
      sc.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  /**
   * Builder for {@link SubscriptionManager}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore store;
    private FeedSource feedSource;
    private QuotaLimits limits;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration fetchTimeout = Duration.ofSeconds(30);

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder store(SubscriptionStore store) {
      this.store = store;
      return this;
    }

    /**
     * Source used to discover titles of unknown feeds in {@link #subscribe}.
     */
    public Builder feedSource(FeedSource feedSource) {
      this.feedSource = feedSource;
      return this;
    }

    /**
     * Optional. Defaults to {@link QuotaLimits#UNLIMITED}.
     */
    public Builder limits(QuotaLimits limits) {
      this.limits = limits;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Time budget for title discovery fetches. Defaults to 30 seconds.
     */
    public Builder fetchTimeout(Duration fetchTimeout) {
      this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
      return this;
    }

    public SubscriptionManager build() {
      return new SubscriptionManager(this);
    }
  }
}
