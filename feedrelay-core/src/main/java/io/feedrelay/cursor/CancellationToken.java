package io.feedrelay.cursor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Cancellation signal shared by the update pass, store cursors and collaborator calls.
 *
 * <p>A token is cancelled when {@link #cancel()} was called on it or on any ancestor,
 * or when its own or an ancestor's deadline has passed. Child tokens are created with
 * {@link #withTimeout} or {@link #withDeadline}; cancelling a child never affects its parent.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationToken {
  private final CancellationToken parent;
  private final Instant deadline;
  private final Clock clock;
  private volatile boolean cancelled;

  private CancellationToken(CancellationToken parent, Instant deadline, Clock clock) {
    this.parent = parent;
    this.deadline = deadline;
    this.clock = clock;
  }

  /**
   * Creates a root token with no deadline.
   */
  public static CancellationToken create() {
    return new CancellationToken(null, null, Clock.systemUTC());
  }

  /**
   * Returns a child token that additionally expires {@code timeout} from now.
   */
  public CancellationToken withTimeout(Duration timeout, Clock clock) {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(clock, "clock");
    return withDeadline(clock.instant().plus(timeout), clock);
  }

  /**
   * Returns a child token that additionally expires at {@code deadline}.
   */
  public CancellationToken withDeadline(Instant deadline, Clock clock) {
    return new CancellationToken(this,
        Objects.requireNonNull(deadline, "deadline"),
        Objects.requireNonNull(clock, "clock"));
  }

  public void cancel() {
    cancelled = true;
  }

  /**
   * Returns {@code true} once this token was cancelled explicitly or its deadline passed.
   */
  public boolean isCancelled() {
    if (cancelled || isDeadlineExceeded()) {
      return true;
    }
    return parent != null && parent.isCancelled();
  }

  /**
   * Returns {@code true} if this token or an ancestor has an expired deadline.
   */
  public boolean isDeadlineExceeded() {
    if (deadline != null && !clock.instant().isBefore(deadline)) {
      return true;
    }
    return parent != null && parent.isDeadlineExceeded();
  }

  /**
   * Time left until the nearest deadline in the chain, never negative.
   *
   * @return remaining time, or empty if no deadline applies
   */
  public Optional<Duration> remaining() {
    Optional<Duration> own = deadline == null
        ? Optional.empty()
        : Optional.of(nonNegative(Duration.between(clock.instant(), deadline)));
    Optional<Duration> inherited = parent == null ? Optional.empty() : parent.remaining();
    if (own.isEmpty()) {
      return inherited;
    }
    if (inherited.isEmpty()) {
      return own;
    }
    return own.get().compareTo(inherited.get()) <= 0 ? own : inherited;
  }

  private static Duration nonNegative(Duration d) {
    return d.isNegative() ? Duration.ZERO : d;
  }
}
