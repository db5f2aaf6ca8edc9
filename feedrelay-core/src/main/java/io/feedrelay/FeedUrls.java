package io.feedrelay;

import java.util.Locale;
import java.util.Objects;

/**
 * URL helpers for feed identity.
 */
public final class FeedUrls {

  private FeedUrls() {
  }

  /**
   * Normalizes a feed URL into its identity key.
   *
   * <p>The scheme is dropped so {@code http} and {@code https} addresses of the same
   * resource map to one feed; the host is lower-cased and a single trailing slash removed.
   *
   * @param url the URL as entered
   * @return the identity key
   * @throws IllegalArgumentException if the URL is blank
   */
  public static String normalize(String url) {
    Objects.requireNonNull(url, "url");
    String s = url.trim();
    if (s.isEmpty()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    String lower = s.toLowerCase(Locale.ROOT);
    if (lower.startsWith("https://")) {
      s = s.substring("https://".length());
    } else if (lower.startsWith("http://")) {
      s = s.substring("http://".length());
    }
    int slash = s.indexOf('/');
    String host = slash < 0 ? s : s.substring(0, slash);
    String rest = slash < 0 ? "" : s.substring(slash);
    String key = host.toLowerCase(Locale.ROOT) + rest;
    if (key.length() > 1 && key.endsWith("/")) {
      key = key.substring(0, key.length() - 1);
    }
    return key;
  }
}
