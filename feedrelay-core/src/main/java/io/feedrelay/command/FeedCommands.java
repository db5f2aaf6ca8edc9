package io.feedrelay.command;

import io.feedrelay.AdmissionResult;
import io.feedrelay.Feed;
import io.feedrelay.FeedStoreException;
import io.feedrelay.QuotaLimits;
import io.feedrelay.SubscriptionManager;
import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.cursor.RecordCursor;
import io.feedrelay.spi.ConnectionProvider;
import io.feedrelay.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns chat commands into subscription operations and reply text.
 *
 * <p>Supported commands: {@code /help}, {@code /addfeed <url>}, {@code /feeds} and
 * {@code /removefeed <n>}; anything else is answered with a pointer to {@code /help}.
 * Adding feeds can be restricted to an allow-list of owner names; an empty list allows
 * everyone. Every command is appended to the request log, and owners exceeding
 * {@code maxRequestsPerWindow} within {@code requestWindow} are refused until older
 * requests age out.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class FeedCommands {
  private static final Logger logger = Logger.getLogger(FeedCommands.class.getName());

  static final String HELP = String.join("\n",
      "/addfeed <url> - subscribe this chat to a feed",
      "/feeds - list the feeds of this chat",
      "/removefeed <n> - remove the n-th feed of /feeds",
      "/help - show this message");
  static final String BACKEND_ERROR = "Backend error, please try again later.";
  static final String THROTTLED = "Too many requests, please try again later.";
  static final String UNKNOWN = "I don't know that command. Send /help for the list.";
  static final String SHUTTING_DOWN = "Shutting down, please try again later.";

  private final SubscriptionManager subscriptions;
  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore store;
  private final Set<String> allowedOwners;
  private final Duration requestWindow;
  private final int maxRequestsPerWindow;
  private final Clock clock;
  private final CancellationToken shutdown;

  private FeedCommands(Builder builder) {
    this.subscriptions = Objects.requireNonNull(builder.subscriptions, "subscriptions");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    if (builder.requestWindow.isNegative() || builder.requestWindow.isZero()) {
      throw new IllegalArgumentException("requestWindow must be positive");
    }
    if (builder.maxRequestsPerWindow < 0) {
      throw new IllegalArgumentException("maxRequestsPerWindow must be >= 0");
    }
    this.allowedOwners = builder.allowedOwners.stream()
        .map(FeedCommands::canonicalName)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
    this.requestWindow = builder.requestWindow;
    this.maxRequestsPerWindow = builder.maxRequestsPerWindow;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.shutdown = builder.shutdown != null ? builder.shutdown : CancellationToken.create();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Handles one command.
   *
   * @return the reply text
   */
  public String handle(Command command) {
    Objects.requireNonNull(command, "command");
    try {
      if (throttled(command)) {
        logger.log(Level.INFO, "Throttled owner {0} ({1})", new Object[] {command.ownerId(), command.ownerName()});
        return THROTTLED;
      }
      return switch (command.name()) {
        case "help", "start" -> HELP;
        case "addfeed" -> addFeed(command);
        case "feeds" -> listFeeds(command);
        case "removefeed" -> removeFeed(command);
        default -> {
          logger.log(Level.FINE, "Unknown command /{0} from owner {1}",
              new Object[] {command.name(), command.ownerId()});
          yield UNKNOWN;
        }
      };
    } catch (FeedStoreException e) {
      logger.log(Level.SEVERE, "Command /" + command.name() + " failed for destination " + command.destinationId(), e);
      return BACKEND_ERROR;
    }
  }

  /**
   * Returns {@code true} if the owner may add feeds.
   */
  public boolean isAllowed(String ownerName) {
    return allowedOwners.isEmpty() || allowedOwners.contains(canonicalName(ownerName));
  }

  private boolean throttled(Command command) {
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      store.recordRequest(conn, command.ownerId(), now, command.name(), command.arguments());
      if (maxRequestsPerWindow == 0) {
        return false;
      }
      return store.countRequests(conn, command.ownerId(), now.minus(requestWindow)) > maxRequestsPerWindow;
    } catch (SQLException e) {
      throw new FeedStoreException("Failed to log request of owner " + command.ownerId(), e);
    }
  }

  private String addFeed(Command command) {
    if (!isAllowed(command.ownerName())) {
      return "You are not allowed to add feeds.";
    }
    String url = command.arguments();
    if (url.isEmpty() || url.chars().anyMatch(Character::isWhitespace)) {
      return "Usage: /addfeed <url>";
    }
    AdmissionResult result;
    try {
      result = subscriptions.subscribe(command.ownerId(), command.destinationId(), url);
    } catch (IllegalArgumentException e) {
      return "Usage: /addfeed <url>";
    }
    QuotaLimits limits = subscriptions.limits();
    if (result instanceof AdmissionResult.Admitted admitted) {
      return "Added feed \"" + admitted.feed().displayName() + "\".";
    } else if (result instanceof AdmissionResult.AlreadySubscribed already) {
      return "This chat is already subscribed to \"" + already.feed().displayName() + "\".";
    } else if (result instanceof AdmissionResult.Declined declined) {
      return switch (declined.violation()) {
        case DESTINATION_LIMIT -> "This chat already has the maximum of "
            + limits.maxFeedsPerDestination() + " feeds.";
        case OWNER_TOTAL_LIMIT -> "You have already added the maximum of "
            + limits.maxTotalFeedsByOwner() + " feeds.";
        case OWNER_ACTIVE_LIMIT -> "You already have the maximum of "
            + limits.maxActiveFeedsByOwner() + " active subscriptions.";
      };
    } else {
      AdmissionResult.FetchFailed failed = (AdmissionResult.FetchFailed) result;
      return "Could not load the feed: " + failed.reason();
    }
  }

  private String listFeeds(Command command) {
    StringBuilder reply = new StringBuilder();
    int position = 0;
    try (RecordCursor<Feed> feeds = subscriptions.listSubscriptions(command.destinationId(), shutdown)) {
      while (feeds.hasNext()) {
        Feed feed = feeds.next();
        reply.append(++position).append(". ").append(feed.displayName());
        if (!feed.displayName().equals(feed.url())) {
          reply.append(" (").append(feed.url()).append(')');
        }
        reply.append('\n');
      }
    }
    if (shutdown.isCancelled()) {
      return SHUTTING_DOWN;
    }
    if (position == 0) {
      return "This chat has no feeds. Add one with /addfeed <url>.";
    }
    return reply.toString().trim();
  }

  private String removeFeed(Command command) {
    int position;
    try {
      position = Integer.parseInt(command.arguments());
    } catch (NumberFormatException e) {
      return "Usage: /removefeed <n>, where n is the number shown by /feeds";
    }
    return subscriptions.unsubscribe(command.destinationId(), position)
        .map(feed -> "Removed feed \"" + feed.displayName() + "\".")
        .orElse("There is no feed number " + position + " in this chat.");
  }

  private static String canonicalName(String name) {
    if (name == null) {
      return "";
    }
    String n = name.trim();
    if (n.startsWith("@")) {
      n = n.substring(1);
    }
    return n.toLowerCase(Locale.ROOT);
  }

  /**
   * Builder for {@link FeedCommands}.
   */
  public static final class Builder {
    private SubscriptionManager subscriptions;
    private ConnectionProvider connectionProvider;
    private SubscriptionStore store;
    private Set<String> allowedOwners = Set.of();
    private Duration requestWindow = Duration.ofMinutes(1);
    private int maxRequestsPerWindow;
    private Clock clock;
    private CancellationToken shutdown;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder subscriptions(SubscriptionManager subscriptions) {
      this.subscriptions = subscriptions;
      return this;
    }

    /**
     * Connections for the request log. <b>Required.</b>
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
     * Owner names allowed to add feeds. Empty (the default) allows everyone.
     */
    public Builder allowedOwners(Set<String> allowedOwners) {
      this.allowedOwners = Set.copyOf(Objects.requireNonNull(allowedOwners, "allowedOwners"));
      return this;
    }

    public Builder requestWindow(Duration requestWindow) {
      this.requestWindow = Objects.requireNonNull(requestWindow, "requestWindow");
      return this;
    }

    /**
     * Requests allowed per owner within the window. Defaults to {@code 0} (unlimited).
     */
    public Builder maxRequestsPerWindow(int maxRequestsPerWindow) {
      this.maxRequestsPerWindow = maxRequestsPerWindow;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Token that ends open listings when the owning relay shuts down. Defaults to one
     * that is never cancelled.
     */
    public Builder shutdown(CancellationToken shutdown) {
      this.shutdown = shutdown;
      return this;
    }

    public FeedCommands build() {
      return new FeedCommands(this);
    }
  }
}
