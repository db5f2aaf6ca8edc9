package io.feedrelay.spi;

import io.feedrelay.FeedDocument;
import io.feedrelay.FeedFetchException;

import java.time.Duration;

/**
 * Downloads and parses a feed document. Feed-format parsing lives entirely behind
 * this interface.
 */
@FunctionalInterface
public interface FeedSource {

  /**
   * Fetches the current document for {@code url}.
   *
   * @param url     the feed URL as stored
   * @param timeout time budget for the call; implementations should give up once it elapses
   * @return the parsed document
   * @throws FeedFetchException if the feed cannot be downloaded or parsed
   */
  FeedDocument fetch(String url, Duration timeout) throws FeedFetchException;
}
