package io.feedrelay.quarantine;

import io.feedrelay.Feed;
import io.feedrelay.FeedStoreException;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.spi.Notifier;
import io.feedrelay.spi.SubscriptionStore;
import io.feedrelay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes feeds that keep failing to load.
 *
 * <p>Every failure is appended to the store's failure log. When the number of failures
 * inside the rolling {@code failureWindow} reaches {@code failureThreshold}, the feed is
 * dropped: its subscribers are enumerated and the feed deleted (subscriptions included)
 * in one transaction, then each former subscriber is sent a removal notice on a
 * background thread. Notice failures are logged and never undo the drop.
 *
 * <p>Create instances via {@link #builder()}. Defaults: 12 hour window, threshold 9.
 */
public final class QuarantinePolicy implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QuarantinePolicy.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore store;
  private final Notifier notifier;
  private final Duration failureWindow;
  private final int failureThreshold;
  private final Function<Feed, String> removalNotice;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ExecutorService noticeExecutor;

  private QuarantinePolicy(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.notifier = Objects.requireNonNull(builder.notifier, "notifier");
    if (builder.failureWindow.isNegative() || builder.failureWindow.isZero()) {
      throw new IllegalArgumentException("failureWindow must be positive");
    }
    if (builder.failureThreshold < 0) {
      throw new IllegalArgumentException("failureThreshold must be >= 0");
    }
    this.failureWindow = builder.failureWindow;
    this.failureThreshold = builder.failureThreshold;
    this.removalNotice = builder.removalNotice != null ? builder.removalNotice : QuarantinePolicy::defaultNotice;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.noticeExecutor = builder.noticeExecutor != null
        ? builder.noticeExecutor
        : Executors.newSingleThreadExecutor(new DaemonThreadFactory("feedrelay-quarantine-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Decides whether a feed with {@code recentFailures} failures inside the window is dropped.
   * A threshold of {@code 0} disables quarantine.
   */
  public static boolean shouldQuarantine(int recentFailures, int failureThreshold) {
    return failureThreshold > 0 && recentFailures >= failureThreshold;
  }

  /**
   * Records one fetch failure and drops the feed if the threshold is reached.
   *
   * @param feed   the failing feed
   * @param reason short description for the log
   * @return {@code true} if the feed was dropped
   * @throws FeedStoreException on storage failure
   */
  public boolean recordFailure(Feed feed, String reason) {
    Objects.requireNonNull(feed, "feed");
    Instant now = clock.instant();
    int recent;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      store.recordFetchFailure(conn, feed.id(), now);
      recent = store.countFetchFailures(conn, feed.id(), now.minus(failureWindow));
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to record fetch failure for feed " + feed.id(), e);
    }

    logger.log(Level.WARNING, "Feed {0} failed ({1}); {2} failure(s) in the last {3}",
        new Object[] {feed.url(), reason, recent, failureWindow});
    if (!shouldQuarantine(recent, failureThreshold)) {
      return false;
    }
    return drop(feed);
  }

  private boolean drop(Feed feed) {
    List<Long> destinations;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        destinations = store.destinationsOf(conn, feed.id());
        if (store.deleteFeed(conn, feed.id()) == 0) {
          conn.rollback();
          return false;
        }
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to drop feed " + feed.id(), e);
    }

    metrics.incrementFeedQuarantined();
    logger.log(Level.WARNING, "Feed {0} removed after repeated failures; notifying {1} destination(s)",
        new Object[] {feed.url(), destinations.size()});

    String text = removalNotice.apply(feed);
    for (Long destinationId : destinations) {
      try {
        noticeExecutor.execute(() -> sendNotice(destinationId, text));
      } catch (RejectedExecutionException e) {
        logger.log(Level.WARNING, "Removal notice for destination " + destinationId + " not scheduled", e);
      }
    }
    return true;
  }

  private void sendNotice(long destinationId, String text) {
    try {
      notifier.send(destinationId, text);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to send removal notice to destination " + destinationId, e);
    }
  }

  private static String defaultNotice(Feed feed) {
    return "The feed \"" + feed.displayName() + "\" was removed from this chat because it failed to load repeatedly.";
  }

  /**
   * Stops accepting notices and waits briefly for queued ones to be sent.
   */
  @Override
  public void close() {
    noticeExecutor.shutdown();
    try {
      if (!noticeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        noticeExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      noticeExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for {@link QuarantinePolicy}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore store;
    private Notifier notifier;
    private Duration failureWindow = Duration.ofHours(12);
    private int failureThreshold = 9;
    private Function<Feed, String> removalNotice;
    private MetricsExporter metrics;
    private Clock clock;
    private ExecutorService noticeExecutor;

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
     * Receives removal notices. <b>Required.</b>
     */
    public Builder notifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /**
     * Rolling window failures are counted in. Defaults to 12 hours.
     */
    public Builder failureWindow(Duration failureWindow) {
      this.failureWindow = Objects.requireNonNull(failureWindow, "failureWindow");
      return this;
    }

    /**
     * Failures inside the window that trigger a drop. Defaults to 9; {@code 0} disables quarantine.
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Text sent to former subscribers of a dropped feed.
     */
    public Builder removalNotice(Function<Feed, String> removalNotice) {
      this.removalNotice = removalNotice;
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
     * Executor removal notices are sent on. Defaults to a single daemon thread, which
     * {@link QuarantinePolicy#close()} shuts down.
     */
    public Builder noticeExecutor(ExecutorService noticeExecutor) {
      this.noticeExecutor = noticeExecutor;
      return this;
    }

    public QuarantinePolicy build() {
      return new QuarantinePolicy(this);
    }
  }
}
