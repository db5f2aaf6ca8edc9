package io.feedrelay;

import java.util.Objects;

/**
 * Outcome of adding a feed to a destination via {@link SubscriptionManager}.
 *
 * <ul>
 *   <li>{@link Admitted}: the subscription was created.</li>
 *   <li>{@link AlreadySubscribed}: the destination already receives this feed; nothing changed.</li>
 *   <li>{@link Declined}: a quota limit was reached; nothing changed.</li>
 *   <li>{@link FetchFailed}: the feed was unknown and could not be fetched to discover its title.</li>
 * </ul>
 *
 * <p>Storage failures are not results; they surface as {@link FeedStoreException}.
 */
public sealed interface AdmissionResult
    permits AdmissionResult.Admitted, AdmissionResult.AlreadySubscribed,
    AdmissionResult.Declined, AdmissionResult.FetchFailed {

  static Admitted admitted(Feed feed) {
    return new Admitted(feed);
  }

  static AlreadySubscribed alreadySubscribed(Feed feed) {
    return new AlreadySubscribed(feed);
  }

  static Declined declined(QuotaViolation violation) {
    return new Declined(violation);
  }

  static FetchFailed fetchFailed(String url, String reason) {
    return new FetchFailed(url, reason);
  }

  /**
   * Subscription created.
   *
   * @param feed the subscribed feed, existing or newly created
   */
  record Admitted(Feed feed) implements AdmissionResult {
    public Admitted {
      Objects.requireNonNull(feed, "feed");
    }
  }

  /**
   * The destination is already subscribed to the feed.
   */
  record AlreadySubscribed(Feed feed) implements AdmissionResult {
    public AlreadySubscribed {
      Objects.requireNonNull(feed, "feed");
    }
  }

  /**
   * Admission refused by a quota limit.
   */
  record Declined(QuotaViolation violation) implements AdmissionResult {
    public Declined {
      Objects.requireNonNull(violation, "violation");
    }
  }

  /**
   * The feed could not be fetched while discovering its title.
   */
  record FetchFailed(String url, String reason) implements AdmissionResult {
  }
}
