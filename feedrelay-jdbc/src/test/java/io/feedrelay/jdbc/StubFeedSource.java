package io.feedrelay.jdbc;

import io.feedrelay.FeedDocument;
import io.feedrelay.FeedFetchException;
import io.feedrelay.spi.FeedSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Feed source serving canned documents per URL. Unknown URLs fail to load.
 */
final class StubFeedSource implements FeedSource {
  private final Map<String, FeedDocument> documents = new ConcurrentHashMap<>();
  private final Map<String, String> failures = new ConcurrentHashMap<>();
  final List<String> fetched = new CopyOnWriteArrayList<>();
  private MutableClock clock;
  private Duration fetchCost = Duration.ZERO;

  StubFeedSource serve(String url, FeedDocument document) {
    failures.remove(url);
    documents.put(url, document);
    return this;
  }

  StubFeedSource fail(String url, String reason) {
    documents.remove(url);
    failures.put(url, reason);
    return this;
  }

  /**
   * Every fetch moves {@code clock} forward by {@code cost}.
   */
  StubFeedSource costs(MutableClock clock, Duration cost) {
    this.clock = clock;
    this.fetchCost = cost;
    return this;
  }

  @Override
  public FeedDocument fetch(String url, Duration timeout) throws FeedFetchException {
    fetched.add(url);
    if (clock != null) {
      clock.advance(fetchCost);
    }
    FeedDocument doc = documents.get(url);
    if (doc != null) {
      return doc;
    }
    throw new FeedFetchException(failures.getOrDefault(url, "404 Not Found"));
  }
}
