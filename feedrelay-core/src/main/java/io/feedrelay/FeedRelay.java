package io.feedrelay;

import io.feedrelay.command.FeedCommands;
import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.quarantine.QuarantinePolicy;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.FeedSource;
import io.feedrelay.spi.MetricsExporter;
import io.feedrelay.spi.Notifier;
import io.feedrelay.spi.SubscriptionStore;
import io.feedrelay.update.FeedUpdater;
import io.feedrelay.update.ItemFormatter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Composite entry point that wires a {@link SubscriptionManager}, {@link QuarantinePolicy},
 * {@link FeedUpdater} and {@link FeedCommands} around one store, feed source and notifier.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (FeedRelay relay = FeedRelay.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .store(JdbcSubscriptionStores.detect(dataSource))
 *     .feedSource(feedSource)
 *     .notifier(notifier)
 *     .limits(new QuotaLimits(10, 200, 20))
 *     .build()) {
 *   relay.start();
 *   notifier.send(chatId, relay.commands().handle(command));
 * }
 * }</pre>
 *
 * <p>{@link #close()} cancels the shared shutdown token, stops the updater and then waits
 * for pending removal notices.
 */
public final class FeedRelay implements AutoCloseable {

  private final CancellationToken shutdown;
  private final SubscriptionManager subscriptions;
  private final QuarantinePolicy quarantine;
  private final FeedUpdater updater;
  private final FeedCommands commands;
  private final MetricsExporter metrics;

  private FeedRelay(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.store, "store");
    Objects.requireNonNull(builder.feedSource, "feedSource");
    Objects.requireNonNull(builder.notifier, "notifier");
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.shutdown = CancellationToken.create();

    this.subscriptions = SubscriptionManager.builder()
        .connectionProvider(builder.connectionProvider)
        .store(builder.store)
        .feedSource(builder.feedSource)
        .limits(builder.limits)
        .metrics(metrics)
        .clock(clock)
        .build();
    QuarantinePolicy.Builder quarantineBuilder = QuarantinePolicy.builder()
        .connectionProvider(builder.connectionProvider)
        .store(builder.store)
        .notifier(builder.notifier)
        .failureWindow(builder.failureWindow)
        .failureThreshold(builder.failureThreshold)
        .metrics(metrics)
        .clock(clock);
    if (builder.removalNotice != null) {
      quarantineBuilder.removalNotice(builder.removalNotice);
    }
    this.quarantine = quarantineBuilder.build();
    this.updater = FeedUpdater.builder()
        .connectionProvider(builder.connectionProvider)
        .store(builder.store)
        .feedSource(builder.feedSource)
        .notifier(builder.notifier)
        .quarantine(quarantine)
        .formatter(builder.formatter)
        .metrics(metrics)
        .clock(clock)
        .interval(builder.interval)
        .passTimeout(builder.passTimeout)
        .initialDelay(builder.initialDelay)
        .shutdown(shutdown)
        .build();
    this.commands = FeedCommands.builder()
        .subscriptions(subscriptions)
        .connectionProvider(builder.connectionProvider)
        .store(builder.store)
        .allowedOwners(builder.allowedOwners)
        .requestWindow(builder.requestWindow)
        .maxRequestsPerWindow(builder.maxRequestsPerWindow)
        .clock(clock)
        .shutdown(shutdown)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic update loop.
   */
  public void start() {
    updater.start();
  }

  public SubscriptionManager subscriptions() {
    return subscriptions;
  }

  public FeedCommands commands() {
    return commands;
  }

  public FeedUpdater updater() {
    return updater;
  }

  public QuarantinePolicy quarantine() {
    return quarantine;
  }

  /**
   * Shuts down components in order: shutdown token, updater, quarantine notices, metrics.
   */
  @Override
  public void close() {
    shutdown.cancel();
    RuntimeException first = null;
    try {
      updater.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      quarantine.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link FeedRelay}. Defaults match the individual component builders.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore store;
    private FeedSource feedSource;
    private Notifier notifier;
    private QuotaLimits limits;
    private MetricsExporter metrics;
    private Clock clock;
    private ItemFormatter formatter;
    private Function<Feed, String> removalNotice;
    private Duration interval = Duration.ofHours(1);
    private Duration passTimeout = Duration.ofMinutes(1);
    private Duration initialDelay = Duration.ZERO;
    private Duration failureWindow = Duration.ofHours(12);
    private int failureThreshold = 9;
    private Set<String> allowedOwners = Set.of();
    private Duration requestWindow = Duration.ofMinutes(1);
    private int maxRequestsPerWindow;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder store(SubscriptionStore store) {
      this.store = store;
      return this;
    }

    /** <b>Required.</b> */
    public Builder feedSource(FeedSource feedSource) {
      this.feedSource = feedSource;
      return this;
    }

    /** <b>Required.</b> */
    public Builder notifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    public Builder limits(QuotaLimits limits) {
      this.limits = limits;
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

    public Builder formatter(ItemFormatter formatter) {
      this.formatter = formatter;
      return this;
    }

    public Builder removalNotice(Function<Feed, String> removalNotice) {
      this.removalNotice = removalNotice;
      return this;
    }

    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public Builder passTimeout(Duration passTimeout) {
      this.passTimeout = passTimeout;
      return this;
    }

    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    public Builder failureWindow(Duration failureWindow) {
      this.failureWindow = failureWindow;
      return this;
    }

    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    public Builder allowedOwners(Set<String> allowedOwners) {
      this.allowedOwners = allowedOwners;
      return this;
    }

    public Builder requestWindow(Duration requestWindow) {
      this.requestWindow = requestWindow;
      return this;
    }

    public Builder maxRequestsPerWindow(int maxRequestsPerWindow) {
      this.maxRequestsPerWindow = maxRequestsPerWindow;
      return this;
    }

    public FeedRelay build() {
      return new FeedRelay(this);
    }
  }
}
