package io.feedrelay.update;

import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.quarantine.QuarantinePolicy;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.FeedSource;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.spi.Notifier;
import io.feedrelay.spi.SubscriptionStore;
import io.feedrelay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic driver of update passes.
 *
 * <p>Passes run on one dedicated thread at a fixed rate, so two passes never overlap; a
 * pass that overruns the interval is followed directly by the next one. Each pass is
 * bounded by {@code passTimeout} independently of the interval. {@link #close()} cancels
 * the shutdown token, which stops an in-flight pass at its next cancellation check.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class FeedUpdater implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FeedUpdater.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore store;
  private final FeedSource feedSource;
  private final Notifier notifier;
  private final QuarantinePolicy quarantine;
  private final ItemFormatter formatter;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration interval;
  private final Duration passTimeout;
  private final Duration initialDelay;
  private final CancellationToken shutdown;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> updateTask;
  private volatile boolean closed;

  private FeedUpdater(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.feedSource = Objects.requireNonNull(builder.feedSource, "feedSource");
    this.notifier = Objects.requireNonNull(builder.notifier, "notifier");
    this.quarantine = Objects.requireNonNull(builder.quarantine, "quarantine");

    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (builder.passTimeout.isNegative() || builder.passTimeout.isZero()) {
      throw new IllegalArgumentException("passTimeout must be positive");
    }
    if (builder.initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    this.interval = builder.interval;
    this.passTimeout = builder.passTimeout;
    this.initialDelay = builder.initialDelay;
    this.formatter = builder.formatter != null ? builder.formatter : ItemFormatter.DEFAULT;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.shutdown = builder.shutdown != null ? builder.shutdown : CancellationToken.create();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled update loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("FeedUpdater has been closed");
    }
    if (updateTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("feedrelay-updater-"));
    updateTask = scheduler.scheduleAtFixedRate(this::tick,
        initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void tick() {
    try {
      runOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Update pass failed unexpectedly", t);
    }
  }

  /**
   * Executes a single pass on the calling thread. Called by the scheduler, but may also
   * be invoked directly.
   *
   * @return the pass outcome; {@link PassReport.Outcome#CANCELLED} if already closed
   */
  public PassReport runOnce() {
    if (closed || shutdown.isCancelled()) {
      return new PassReport(PassReport.Outcome.CANCELLED, 0, 0, 0, Duration.ZERO, null);
    }
    CancellationToken token = shutdown.withTimeout(passTimeout, clock);
    logger.log(Level.FINE, "Update pass starting, timeout {0}", passTimeout);
    PassReport report = new UpdatePass(connectionProvider, store, feedSource, notifier, quarantine,
        formatter, metrics, clock, token).run();

    metrics.recordPassDurationMs(report.duration().toMillis());
    switch (report.outcome()) {
      case COMPLETED -> logger.log(Level.INFO, "Update pass completed: {0} feed(s), {1} item(s) delivered, {2} fetch failure(s) in {3} ms",
          new Object[] {report.feedsProcessed(), report.itemsDelivered(), report.fetchFailures(), report.duration().toMillis()});
      case DEADLINE_EXCEEDED -> {
        metrics.incrementPassDeadlineExceeded();
        logger.log(Level.WARNING, "Update pass exceeded its {0} deadline after {1} feed(s); remaining feeds wait for the next tick",
            new Object[] {passTimeout, report.feedsProcessed()});
      }
      case CANCELLED -> logger.log(Level.INFO, "Update pass cancelled by shutdown");
      case FAILED -> logger.log(Level.WARNING, "Update pass failed; retrying on the next tick");
    }
    return report;
  }

  /**
   * Cancels the schedule, signals the running pass to stop and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    shutdown.cancel();
    if (updateTask != null) {
      updateTask.cancel(false);
      updateTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link FeedUpdater}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore store;
    private FeedSource feedSource;
    private Notifier notifier;
    private QuarantinePolicy quarantine;
    private ItemFormatter formatter;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration interval = Duration.ofHours(1);
    private Duration passTimeout = Duration.ofMinutes(1);
    private Duration initialDelay = Duration.ZERO;
    private CancellationToken shutdown;

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
     * Fetches and parses feed documents. <b>Required.</b>
     */
    public Builder feedSource(FeedSource feedSource) {
      this.feedSource = feedSource;
      return this;
    }

    /**
     * Delivers item messages. <b>Required.</b>
     */
    public Builder notifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /**
     * Receives fetch failures. <b>Required.</b>
     */
    public Builder quarantine(QuarantinePolicy quarantine) {
      this.quarantine = quarantine;
      return this;
    }

    /**
     * Optional. Defaults to {@link ItemFormatter#DEFAULT}.
     */
    public Builder formatter(ItemFormatter formatter) {
      this.formatter = formatter;
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
     * Period between pass starts. Defaults to 1 hour.
     */
    public Builder interval(Duration interval) {
      this.interval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    /**
     * Upper bound on one pass. Defaults to 1 minute.
     */
    public Builder passTimeout(Duration passTimeout) {
      this.passTimeout = Objects.requireNonNull(passTimeout, "passTimeout");
      return this;
    }

    /**
     * Delay before the first pass after {@link FeedUpdater#start()}. Defaults to zero.
     */
    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
      return this;
    }

    /**
     * Parent token whose cancellation stops passes. Defaults to a private token
     * cancelled by {@link FeedUpdater#close()}.
     */
    public Builder shutdown(CancellationToken shutdown) {
      this.shutdown = shutdown;
      return this;
    }

    public FeedUpdater build() {
      return new FeedUpdater(this);
    }
  }
}
