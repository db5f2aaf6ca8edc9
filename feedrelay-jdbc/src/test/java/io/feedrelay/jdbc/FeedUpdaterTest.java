package io.feedrelay.jdbc;

import io.feedrelay.FeedDocument;
import io.feedrelay.FeedItem;
import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.jdbc.store.H2SubscriptionStore;
import io.feedrelay.quarantine.QuarantinePolicy;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.spi.Notifier;
import io.feedrelay.update.FeedUpdater;
import io.feedrelay.update.PassReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FeedUpdaterTest {
  private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
  private static final Instant T1 = T0.plusSeconds(600);
  private static final Instant T2 = T0.plusSeconds(1200);
  private static final Instant T3 = T0.plusSeconds(1800);

  private DataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private final H2SubscriptionStore store = new H2SubscriptionStore();
  private MutableClock clock;
  private StubFeedSource feedSource;
  private RecordingNotifier notifier;
  private RecordingMetrics metrics;
  private QuarantinePolicy quarantine;
  private FeedUpdater updater;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2("updater");
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    clock = new MutableClock(T3.plusSeconds(3600));
    feedSource = new StubFeedSource();
    notifier = new RecordingNotifier();
    metrics = new RecordingMetrics();
    quarantine = quarantine(notifier);
    updater = updater(connectionProvider, notifier, Duration.ofMinutes(1), null);
  }

  @AfterEach
  void teardown() {
    updater.close();
    quarantine.close();
  }

  private QuarantinePolicy quarantine(Notifier notices) {
    return QuarantinePolicy.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .notifier(notices)
        .metrics(metrics)
        .clock(clock)
        .build();
  }

  private FeedUpdater updater(ConnectionProvider provider, Notifier target, Duration passTimeout,
      CancellationToken shutdown) {
    return FeedUpdater.builder()
        .connectionProvider(provider)
        .store(store)
        .feedSource(feedSource)
        .notifier(target)
        .quarantine(quarantine)
        .formatter((feed, item) -> item.title())
        .metrics(metrics)
        .clock(clock)
        .interval(Duration.ofMillis(50))
        .passTimeout(passTimeout)
        .shutdown(shutdown)
        .build();
  }

  private long feed(String url) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return store.insertFeed(conn, url, url, 1L, T0);
    }
  }

  private void subscribe(long destinationId, long feedId, Instant lastUpdate) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.insertSubscription(conn, destinationId, feedId, 1L, lastUpdate);
    }
  }

  private Instant marker(long destinationId, long feedId) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.queryOne(conn,
              "SELECT last_update FROM subscriptions WHERE destination_id=? AND feed_id=?",
              rs -> rs.getTimestamp(1).toInstant(), destinationId, feedId)
          .orElseThrow();
    }
  }

  private static FeedDocument document(Instant updatedAt, FeedItem... items) {
    return new FeedDocument("Feed", updatedAt, List.of(items));
  }

  private static FeedItem item(String title, Instant publishedAt) {
    return new FeedItem(title, "", "https://example.org/" + title, publishedAt);
  }

  @Test
  void deliversNewItemsOldestFirstAndAdvancesMarker() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null,
        item("third", T3), item("first", T1), item("second", T2)));

    PassReport report = updater.runOnce();

    assertEquals(PassReport.Outcome.COMPLETED, report.outcome());
    assertEquals(3, report.itemsDelivered());
    assertEquals(1, report.feedsProcessed());
    assertEquals(List.of("first", "second", "third"), notifier.textsFor(100L));
    assertEquals(T3, marker(100L, feedId));
    assertEquals(3, metrics.deliverySuccess.get());
    assertEquals(1, metrics.fetchSuccess.get());
  }

  @Test
  void rerunWithoutNewItemsDeliversNothing() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(T2, item("first", T1), item("second", T2)));

    updater.runOnce();
    PassReport second = updater.runOnce();

    assertEquals(PassReport.Outcome.COMPLETED, second.outcome());
    assertEquals(0, second.itemsDelivered());
    assertEquals(List.of("first", "second"), notifier.textsFor(100L));
  }

  @Test
  void laterPassDeliversOnlyItemsPublishedSince() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null, item("first", T1)));
    updater.runOnce();

    feedSource.serve("https://a.example/rss", document(null,
        item("first", T1), item("second", T2), item("third", T3)));
    updater.runOnce();

    assertEquals(List.of("first", "second", "third"), notifier.textsFor(100L));
    assertEquals(T3, marker(100L, feedId));
  }

  @Test
  void subscribersAreReadOnlyWhenBehindFreshness() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T2);
    subscribe(200L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(T2, item("first", T1), item("second", T2)));

    updater.runOnce();

    assertTrue(notifier.textsFor(100L).isEmpty());
    assertEquals(List.of("first", "second"), notifier.textsFor(200L));
    assertEquals(T2, marker(100L, feedId));
  }

  @Test
  void itemsWithoutPublishTimeAreNotDelivered() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(T3, item("undated", null), item("dated", T2)));

    updater.runOnce();

    assertEquals(List.of("dated"), notifier.textsFor(100L));
  }

  @Test
  void failedSendStopsThatSubscriberUntilNextPass() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    subscribe(200L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null,
        item("first", T1), item("second", T2), item("third", T3)));
    notifier.failFor(100L);

    PassReport report = updater.runOnce();

    assertEquals(PassReport.Outcome.COMPLETED, report.outcome());
    assertTrue(notifier.textsFor(100L).isEmpty());
    assertEquals(List.of("first", "second", "third"), notifier.textsFor(200L));
    assertEquals(T0, marker(100L, feedId));
    assertEquals(1, metrics.deliveryFailure.get());

    notifier.recover(100L);
    updater.runOnce();

    assertEquals(List.of("first", "second", "third"), notifier.textsFor(100L));
    assertEquals(List.of("first", "second", "third"), notifier.textsFor(200L));
  }

  @Test
  void failureMidwayKeepsProgressOfDeliveredItems() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null,
        item("first", T1), item("second", T2), item("third", T3)));
    List<String> delivered = new CopyOnWriteArrayList<>();
    Notifier flaky = (destinationId, text) -> {
      if (text.equals("third")) {
        throw new IllegalStateException("rate limited");
      }
      delivered.add(text);
    };
    try (FeedUpdater flakyUpdater = updater(connectionProvider, flaky, Duration.ofMinutes(1), null)) {
      flakyUpdater.runOnce();
    }

    assertEquals(List.of("first", "second"), delivered);
    assertEquals(T2, marker(100L, feedId));
  }

  @Test
  void subscriptionRemovedDuringPassStopsDelivery() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null,
        item("first", T1), item("second", T2), item("third", T3)));
    List<String> delivered = new CopyOnWriteArrayList<>();
    Notifier unsubscribing = (destinationId, text) -> {
      delivered.add(text);
      try (Connection conn = dataSource.getConnection()) {
        store.deleteSubscription(conn, destinationId, feedId);
      }
    };
    try (FeedUpdater removing = updater(connectionProvider, unsubscribing, Duration.ofMinutes(1), null)) {
      PassReport report = removing.runOnce();
      assertEquals(PassReport.Outcome.COMPLETED, report.outcome());
    }

    assertEquals(List.of("first"), delivered);
    assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM subscriptions"));
  }

  @Test
  void deadlineLeavesRemainingFeedsForNextPass() throws Exception {
    long a = feed("https://a.example/rss");
    long b = feed("https://b.example/rss");
    long c = feed("https://c.example/rss");
    subscribe(100L, a, T0);
    subscribe(200L, b, T0);
    subscribe(300L, c, T0);
    for (String url : List.of("https://a.example/rss", "https://b.example/rss", "https://c.example/rss")) {
      feedSource.serve(url, document(null, item("first", T1)));
    }
    feedSource.costs(clock, Duration.ofMinutes(1));
    FeedUpdater slow = updater(connectionProvider, notifier, Duration.ofSeconds(90), null);

    PassReport report = slow.runOnce();

    assertEquals(PassReport.Outcome.DEADLINE_EXCEEDED, report.outcome());
    assertEquals(List.of("https://a.example/rss", "https://b.example/rss"), feedSource.fetched);
    assertEquals(List.of("first"), notifier.textsFor(100L));
    assertTrue(notifier.textsFor(200L).isEmpty());
    assertTrue(notifier.textsFor(300L).isEmpty());
    assertEquals(1, metrics.passDeadlineExceeded.get());
    assertEquals(T0, marker(200L, b));

    feedSource.costs(clock, Duration.ZERO);
    PassReport next = slow.runOnce();
    slow.close();

    assertEquals(PassReport.Outcome.COMPLETED, next.outcome());
    assertEquals(List.of("first"), notifier.textsFor(100L));
    assertEquals(List.of("first"), notifier.textsFor(200L));
    assertEquals(List.of("first"), notifier.textsFor(300L));
  }

  @Test
  void shutdownStopsInFlightPass() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null,
        item("first", T1), item("second", T2), item("third", T3)));
    CancellationToken shutdown = CancellationToken.create();
    List<String> delivered = new CopyOnWriteArrayList<>();
    Notifier cancelling = (destinationId, text) -> {
      delivered.add(text);
      shutdown.cancel();
    };

    PassReport report;
    try (FeedUpdater stopping = updater(connectionProvider, cancelling, Duration.ofMinutes(1), shutdown)) {
      report = stopping.runOnce();
      assertEquals(PassReport.Outcome.CANCELLED, stopping.runOnce().outcome());
    }

    assertEquals(PassReport.Outcome.CANCELLED, report.outcome());
    assertEquals(List.of("first"), delivered);
    assertEquals(T1, marker(100L, feedId));
  }

  @Test
  void fetchFailureIsRecordedAndOtherFeedsContinue() throws Exception {
    long broken = feed("https://broken.example/rss");
    long ok = feed("https://ok.example/rss");
    subscribe(100L, broken, T0);
    subscribe(100L, ok, T0);
    feedSource.fail("https://broken.example/rss", "502 Bad Gateway");
    feedSource.serve("https://ok.example/rss", document(null, item("fine", T1)));

    PassReport report = updater.runOnce();

    assertEquals(PassReport.Outcome.COMPLETED, report.outcome());
    assertEquals(1, report.fetchFailures());
    assertEquals(2, report.feedsProcessed());
    assertEquals(List.of("fine"), notifier.textsFor(100L));
    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM feed_errors WHERE feed_id=" + broken));
    assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM feed_errors WHERE feed_id=" + ok));
    assertEquals(1, metrics.fetchFailure.get());
  }

  @Test
  void documentWithoutAnyTimestampCountsAsFailure() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null, item("undated", null)));

    PassReport report = updater.runOnce();

    assertEquals(1, report.fetchFailures());
    assertTrue(notifier.sent.isEmpty());
    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM feed_errors"));
  }

  @Test
  void repeatedFailuresQuarantineTheFeed() throws Exception {
    long feedId = feed("https://broken.example/rss");
    subscribe(100L, feedId, T0);
    subscribe(200L, feedId, T0);
    feedSource.fail("https://broken.example/rss", "404 Not Found");

    for (int pass = 1; pass <= 8; pass++) {
      updater.runOnce();
      clock.advance(Duration.ofHours(1));
    }
    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM feeds"));

    updater.runOnce();
    quarantine.close();

    assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM feeds"));
    assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM subscriptions"));
    assertEquals(1, notifier.textsFor(100L).size());
    assertEquals(1, notifier.textsFor(200L).size());
    assertTrue(notifier.textsFor(100L).get(0).contains("https://broken.example/rss"));
    assertEquals(1, metrics.feedQuarantined.get());
  }

  @Test
  void unreadableFeedListFailsThePass() {
    ConnectionProvider down = () -> {
      throw new SQLException("database is down");
    };
    try (FeedUpdater failing = updater(down, notifier, Duration.ofMinutes(1), null)) {
      PassReport report = failing.runOnce();

      assertEquals(PassReport.Outcome.FAILED, report.outcome());
      assertInstanceOf(SQLException.class, report.error());
    }
  }

  @Test
  void closedUpdaterDoesNotRun() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null, item("first", T1)));

    updater.close();

    assertEquals(PassReport.Outcome.CANCELLED, updater.runOnce().outcome());
    assertTrue(feedSource.fetched.isEmpty());
    assertThrows(IllegalStateException.class, updater::start);
  }

  @Test
  void scheduledPassesDeliverInBackground() throws Exception {
    long feedId = feed("https://a.example/rss");
    subscribe(100L, feedId, T0);
    feedSource.serve("https://a.example/rss", document(null, item("first", T1)));

    updater.start();
    updater.start();
    long deadline = System.currentTimeMillis() + 5_000;
    while (notifier.sent.isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    updater.close();

    assertEquals(List.of("first"), notifier.textsFor(100L));
    assertTrue(feedSource.fetched.size() >= 1);
  }

  @Test
  void builderValidatesSettings() {
    assertThrows(NullPointerException.class, () -> FeedUpdater.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> updater(connectionProvider, notifier, Duration.ZERO, null));
  }

  static final class RecordingMetrics implements MetricsExporter {
    final AtomicInteger fetchSuccess = new AtomicInteger();
    final AtomicInteger fetchFailure = new AtomicInteger();
    final AtomicInteger deliverySuccess = new AtomicInteger();
    final AtomicInteger deliveryFailure = new AtomicInteger();
    final AtomicInteger feedQuarantined = new AtomicInteger();
    final AtomicInteger passDeadlineExceeded = new AtomicInteger();
    final List<Long> passDurations = new CopyOnWriteArrayList<>();

    @Override
    public void incrementFetchSuccess() {
      fetchSuccess.incrementAndGet();
    }

    @Override
    public void incrementFetchFailure() {
      fetchFailure.incrementAndGet();
    }

    @Override
    public void incrementDeliverySuccess() {
      deliverySuccess.incrementAndGet();
    }

    @Override
    public void incrementDeliveryFailure() {
      deliveryFailure.incrementAndGet();
    }

    @Override
    public void incrementFeedQuarantined() {
      feedQuarantined.incrementAndGet();
    }

    @Override
    public void incrementPassDeadlineExceeded() {
      passDeadlineExceeded.incrementAndGet();
    }

    @Override
    public void recordPassDurationMs(long durationMs) {
      passDurations.add(durationMs);
    }
  }
}
