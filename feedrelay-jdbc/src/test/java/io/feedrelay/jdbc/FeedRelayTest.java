package io.feedrelay.jdbc;

import io.feedrelay.FeedDocument;
import io.feedrelay.FeedItem;
import io.feedrelay.FeedRelay;
import io.feedrelay.QuotaLimits;
import io.feedrelay.command.Command;
import io.feedrelay.jdbc.store.JdbcSubscriptionStores;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.update.PassReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class FeedRelayTest {
  private DataSource dataSource;
  private MutableClock clock;
  private StubFeedSource feedSource;
  private RecordingNotifier notifier;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2("relay");
    clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    feedSource = new StubFeedSource();
    notifier = new RecordingNotifier();
  }

  private FeedRelay.Builder relay() {
    return FeedRelay.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .store(JdbcSubscriptionStores.detect(dataSource))
        .feedSource(feedSource)
        .notifier(notifier)
        .clock(clock);
  }

  @Test
  void subscribeThenDeliverNewItems() {
    feedSource.serve("https://news.example/rss", new FeedDocument("News", null, List.of()));
    try (FeedRelay relay = relay().limits(new QuotaLimits(10, 50, 20)).build()) {
      Command add = Command.parse(7L, "carol", 500L, "/addfeed https://news.example/rss").orElseThrow();
      assertEquals("Added feed \"News\".", relay.commands().handle(add));

      Instant published = clock.instant().plusSeconds(60);
      feedSource.serve("https://news.example/rss", new FeedDocument("News", null,
          List.of(new FeedItem("Launch", "We shipped", "https://news.example/launch", published))));
      clock.advance(Duration.ofMinutes(5));

      PassReport report = relay.updater().runOnce();

      assertEquals(PassReport.Outcome.COMPLETED, report.outcome());
      assertEquals(List.of("Launch\nWe shipped\n\nLink: https://news.example/launch"), notifier.textsFor(500L));
    }
  }

  @Test
  void listingAfterCloseReportsShutdown() {
    feedSource.serve("https://news.example/rss", new FeedDocument("News", null, List.of()));
    FeedRelay relay = relay().build();
    relay.subscriptions().subscribe(7L, 500L, "https://news.example/rss");
    Command feeds = Command.parse(7L, "carol", 500L, "/feeds").orElseThrow();
    assertEquals("1. News (https://news.example/rss)", relay.commands().handle(feeds));

    relay.close();

    assertEquals("Shutting down, please try again later.", relay.commands().handle(feeds));
  }

  @Test
  void itemsPublishedBeforeSubscribingAreNotDelivered() {
    Instant old = clock.instant().minusSeconds(3600);
    feedSource.serve("https://news.example/rss", new FeedDocument("News", null,
        List.of(new FeedItem("Old news", "", "", old))));
    try (FeedRelay relay = relay().build()) {
      relay.subscriptions().subscribe(7L, 500L, "https://news.example/rss");

      relay.updater().runOnce();

      assertTrue(notifier.sent.isEmpty());
    }
  }

  @Test
  void closeStopsUpdaterAndClosesMetrics() {
    AtomicBoolean metricsClosed = new AtomicBoolean();
    class ClosingMetrics implements MetricsExporter, AutoCloseable {
      @Override
      public void incrementFetchSuccess() {
      }

      @Override
      public void incrementFetchFailure() {
      }

      @Override
      public void incrementDeliverySuccess() {
      }

      @Override
      public void incrementDeliveryFailure() {
      }

      @Override
      public void incrementFeedQuarantined() {
      }

      @Override
      public void incrementPassDeadlineExceeded() {
      }

      @Override
      public void recordPassDurationMs(long durationMs) {
      }

      @Override
      public void close() {
        metricsClosed.set(true);
      }
    }

    FeedRelay relay = relay().metrics(new ClosingMetrics()).interval(Duration.ofHours(1)).build();
    relay.start();
    relay.close();

    assertTrue(metricsClosed.get());
    assertEquals(PassReport.Outcome.CANCELLED, relay.updater().runOnce().outcome());
  }

  @Test
  void requiredCollaboratorsAreChecked() {
    assertThrows(NullPointerException.class, () -> FeedRelay.builder().build());
    assertThrows(NullPointerException.class, () -> relay().notifier(null).build());
  }
}
