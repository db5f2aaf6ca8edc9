package io.feedrelay.update;

import io.feedrelay.Feed;
import io.feedrelay.FeedDocument;
import io.feedrelay.FeedItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdatePassTest {

  private static final Instant T1 = Instant.parse("2024-03-01T10:00:00Z");
  private static final Instant T2 = T1.plusSeconds(60);
  private static final Instant T3 = T2.plusSeconds(60);

  @Test
  void newItemsAreSortedOldestFirst() {
    FeedDocument doc = new FeedDocument("feed", null, List.of(item("c", T3), item("a", T1), item("b", T2)));
    List<FeedItem> items = UpdatePass.newItems(doc, T1.minusSeconds(1));
    assertEquals(List.of("a", "b", "c"), items.stream().map(FeedItem::title).toList());
  }

  @Test
  void onlyItemsStrictlyAfterMarker() {
    FeedDocument doc = new FeedDocument("feed", null, List.of(item("a", T1), item("b", T2), item("c", T3)));
    assertEquals(List.of("c"), UpdatePass.newItems(doc, T2).stream().map(FeedItem::title).toList());
    assertTrue(UpdatePass.newItems(doc, T3).isEmpty());
  }

  @Test
  void itemsWithoutPublishTimeSkipped() {
    FeedDocument doc = new FeedDocument("feed", T3, List.of(item("undated", null), item("b", T2)));
    assertEquals(List.of("b"), UpdatePass.newItems(doc, T1).stream().map(FeedItem::title).toList());
  }

  @Test
  void subMillisecondDifferenceIsNotNew() {
    FeedDocument doc = new FeedDocument("feed", null, List.of(item("a", T1.plusNanos(500_000))));
    assertTrue(UpdatePass.newItems(doc, T1).isEmpty());
  }

  @Test
  void defaultFormatter() {
    FeedItem item = new FeedItem("Title", "Body", "https://example.org/1", T1);
    assertEquals("Title\nBody\n\nLink: https://example.org/1",
        ItemFormatter.DEFAULT.format(new Feed(1, "https://example.org/rss", "Example"), item));
  }

  private static FeedItem item(String title, Instant publishedAt) {
    return new FeedItem(title, "", "https://example.org/" + title, publishedAt);
  }
}
