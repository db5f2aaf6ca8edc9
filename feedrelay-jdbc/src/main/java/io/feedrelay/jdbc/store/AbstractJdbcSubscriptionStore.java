package io.feedrelay.jdbc.store;

import io.feedrelay.Feed;
import io.feedrelay.FeedStoreException;
import io.feedrelay.FeedUrls;
import io.feedrelay.QuotaUsage;
import io.feedrelay.Subscriber;
import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.cursor.RecordCursor;
import io.feedrelay.jdbc.JdbcTemplate;
import io.feedrelay.jdbc.ResultSetCursor;
import io.feedrelay.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC subscription store with standard SQL implementations.
 *
 * <p>Tables ({@code schema/<name>.sql} on the classpath holds the DDL per database):
 * <ul>
 *   <li>{@code feeds} - fetch URL, unique normalized {@code url_key}, title, creating owner</li>
 *   <li>{@code subscriptions} - one row per (destination, feed); the auto-increment
 *       {@code seq} column fixes the ordinal order and is never renumbered</li>
 *   <li>{@code feed_errors} - append-only fetch failure log</li>
 *   <li>{@code requests} - append-only command request log</li>
 *   <li>{@code admission_locks} - one row per owner, per destination and per feed URL
 *       key, locked to serialize admissions</li>
 * </ul>
 *
 * <p>Subclasses supply the idempotent insert used for admission lock rows and may tune
 * statements used for streaming. Register custom implementations via
 * {@code META-INF/services/io.feedrelay.jdbc.store.AbstractJdbcSubscriptionStore}.
 *
 * <p>Instances are stateless and thread-safe.
 *
 * @see JdbcSubscriptionStores
 */
public abstract class AbstractJdbcSubscriptionStore implements SubscriptionStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcSubscriptionStore.class.getName());

  protected static final String OWNER_SCOPE = "owner";
  protected static final String DESTINATION_SCOPE = "destination";
  protected static final String FEED_SCOPE = "feed";
  private static final int MAX_TITLE_LENGTH = 1024;
  private static final int MAX_BODY_LENGTH = 4096;

  protected static final JdbcTemplate.RowMapper<Feed> FEED_ROW_MAPPER = rs -> new Feed(
      rs.getLong("id"),
      rs.getString("url"),
      rs.getString("title"));

  protected static final JdbcTemplate.RowMapper<Subscriber> SUBSCRIBER_ROW_MAPPER = rs -> new Subscriber(
      rs.getLong("destination_id"),
      rs.getTimestamp("last_update").toInstant());

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Insert of one {@code (scope, scope_id)} row into {@code admission_locks} that does
   * nothing if the row exists.
   */
  protected abstract String insertScopeIfAbsentSql();

  /**
   * Hook to configure statements backing a {@link RecordCursor}. Defaults to a fetch size of 100.
   */
  protected void configureStreaming(PreparedStatement ps) throws SQLException {
    ps.setFetchSize(100);
  }

  // ---- admission ----

  @Override
  public void ensureAdmissionScopes(Connection conn, long ownerId, long destinationId, String url) {
    insertScope(conn, OWNER_SCOPE, ownerId);
    insertScope(conn, DESTINATION_SCOPE, destinationId);
    insertScope(conn, FEED_SCOPE, feedScopeId(url));
  }

  private void insertScope(Connection conn, String scope, long scopeId) {
    try (PreparedStatement ps = conn.prepareStatement(insertScopeIfAbsentSql())) {
      ps.setString(1, scope);
      ps.setLong(2, scopeId);
      ps.executeUpdate();
    } catch (SQLException e) {
      String state = e.getSQLState();
      if (state != null && state.startsWith("23")) {
        // created concurrently
        logger.log(Level.FINE, "Admission row {0}/{1} already present", new Object[] {scope, scopeId});
        return;
      }
      throw new FeedStoreException("Failed to create admission row " + scope + "/" + scopeId, e);
    }
  }

  @Override
  public void lockAdmission(Connection conn, long ownerId, long destinationId, String url) {
    // Always owner, destination, feed, so concurrent admissions lock in the same order
    if (!lockScope(conn, OWNER_SCOPE, ownerId)
        || !lockScope(conn, DESTINATION_SCOPE, destinationId)
        || !lockScope(conn, FEED_SCOPE, feedScopeId(url))) {
      throw new FeedStoreException("Admission rows missing for owner " + ownerId
          + " / destination " + destinationId + " / feed " + url, null);
    }
  }

  private static boolean lockScope(Connection conn, String scope, long scopeId) {
    String sql = "SELECT scope_id FROM admission_locks WHERE scope=? AND scope_id=? FOR UPDATE";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1), scope, scopeId).isPresent();
  }

  /**
   * Lock row id of a feed URL. URLs whose keys collide share a row, which only serializes
   * their admissions further.
   */
  static long feedScopeId(String url) {
    return FeedUrls.normalize(url).hashCode();
  }

  @Override
  public QuotaUsage quotaUsage(Connection conn, long ownerId, long destinationId) {
    String sql = "SELECT " +
        "(SELECT COUNT(*) FROM subscriptions WHERE destination_id=?), " +
        "(SELECT COUNT(*) FROM feeds WHERE owner_id=?), " +
        "(SELECT COUNT(*) FROM subscriptions WHERE owner_id=?)";
    return JdbcTemplate.queryOne(conn, sql,
            rs -> new QuotaUsage(rs.getInt(1), rs.getInt(2), rs.getInt(3)),
            destinationId, ownerId, ownerId)
        .orElseThrow(() -> new FeedStoreException("Quota query returned no row", null));
  }

  @Override
  public Optional<Feed> findFeedByUrl(Connection conn, String url) {
    String sql = "SELECT id, url, title FROM feeds WHERE url_key=?";
    return JdbcTemplate.queryOne(conn, sql, FEED_ROW_MAPPER, FeedUrls.normalize(url));
  }

  @Override
  public long insertFeed(Connection conn, String url, String title, long ownerId, Instant createdAt) {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(createdAt, "createdAt");
    String sql = "INSERT INTO feeds (url, url_key, title, owner_id, created_at) VALUES (?,?,?,?,?)";
    return JdbcTemplate.insertReturningKey(conn, sql,
        url.trim(), FeedUrls.normalize(url), truncate(title, MAX_TITLE_LENGTH), ownerId,
        Timestamp.from(createdAt.truncatedTo(ChronoUnit.MILLIS)));
  }

  @Override
  public boolean isSubscribed(Connection conn, long destinationId, long feedId) {
    String sql = "SELECT COUNT(*) FROM subscriptions WHERE destination_id=? AND feed_id=?";
    return JdbcTemplate.count(conn, sql, destinationId, feedId) > 0;
  }

  @Override
  public void insertSubscription(Connection conn, long destinationId, long feedId, long ownerId,
      Instant lastUpdate) {
    String sql = "INSERT INTO subscriptions (destination_id, feed_id, owner_id, last_update) VALUES (?,?,?,?)";
    JdbcTemplate.update(conn, sql, destinationId, feedId, ownerId, Timestamp.from(lastUpdate));
  }

  // ---- destination views ----

  @Override
  public Optional<Feed> feedAtPosition(Connection conn, long destinationId, int position) {
    if (position < 1) {
      return Optional.empty();
    }
    String sql = "SELECT f.id, f.url, f.title FROM subscriptions s JOIN feeds f ON f.id = s.feed_id " +
        "WHERE s.destination_id=? ORDER BY s.seq LIMIT 1 OFFSET ?";
    return JdbcTemplate.queryOne(conn, sql, FEED_ROW_MAPPER, destinationId, position - 1);
  }

  @Override
  public int deleteSubscription(Connection conn, long destinationId, long feedId) {
    return JdbcTemplate.update(conn,
        "DELETE FROM subscriptions WHERE destination_id=? AND feed_id=?", destinationId, feedId);
  }

  @Override
  public RecordCursor<Feed> streamSubscriptions(Connection conn, long destinationId, CancellationToken token) {
    String sql = "SELECT f.id, f.url, f.title FROM subscriptions s JOIN feeds f ON f.id = s.feed_id " +
        "WHERE s.destination_id=? ORDER BY s.seq";
    return stream(conn, sql, FEED_ROW_MAPPER, token, destinationId);
  }

  // ---- update engine ----

  @Override
  public RecordCursor<Feed> streamFeeds(Connection conn, CancellationToken token) {
    return stream(conn, "SELECT id, url, title FROM feeds ORDER BY id", FEED_ROW_MAPPER, token);
  }

  @Override
  public RecordCursor<Subscriber> streamSubscribers(Connection conn, long feedId, Instant notAfter,
      CancellationToken token) {
    String sql = "SELECT destination_id, last_update FROM subscriptions " +
        "WHERE feed_id=? AND last_update < ? ORDER BY seq";
    return stream(conn, sql, SUBSCRIBER_ROW_MAPPER, token, feedId, Timestamp.from(notAfter));
  }

  @Override
  public int advanceSubscription(Connection conn, long destinationId, long feedId, Instant lastUpdate) {
    String sql = "UPDATE subscriptions SET last_update=? " +
        "WHERE destination_id=? AND feed_id=? AND last_update <= ?";
    Timestamp ts = Timestamp.from(lastUpdate);
    return JdbcTemplate.update(conn, sql, ts, destinationId, feedId, ts);
  }

  // ---- quarantine ----

  @Override
  public List<Long> destinationsOf(Connection conn, long feedId) {
    return JdbcTemplate.query(conn, "SELECT destination_id FROM subscriptions WHERE feed_id=? ORDER BY seq",
        rs -> rs.getLong(1), feedId);
  }

  @Override
  public void recordFetchFailure(Connection conn, long feedId, Instant at) {
    JdbcTemplate.update(conn, "INSERT INTO feed_errors (feed_id, occurred_at) VALUES (?,?)",
        feedId, Timestamp.from(at.truncatedTo(ChronoUnit.MILLIS)));
  }

  @Override
  public int countFetchFailures(Connection conn, long feedId, Instant since) {
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM feed_errors WHERE feed_id=? AND occurred_at >= ?",
        feedId, Timestamp.from(since));
  }

  @Override
  public int deleteFeed(Connection conn, long feedId) {
    JdbcTemplate.update(conn, "DELETE FROM subscriptions WHERE feed_id=?", feedId);
    JdbcTemplate.update(conn, "DELETE FROM feed_errors WHERE feed_id=?", feedId);
    return JdbcTemplate.update(conn, "DELETE FROM feeds WHERE id=?", feedId);
  }

  // ---- request log ----

  @Override
  public void recordRequest(Connection conn, long ownerId, Instant at, String name, String text) {
    JdbcTemplate.update(conn, "INSERT INTO requests (owner_id, requested_at, name, body) VALUES (?,?,?,?)",
        ownerId, Timestamp.from(at.truncatedTo(ChronoUnit.MILLIS)), name, truncate(text, MAX_BODY_LENGTH));
  }

  @Override
  public int countRequests(Connection conn, long ownerId, Instant since) {
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM requests WHERE owner_id=? AND requested_at >= ?",
        ownerId, Timestamp.from(since));
  }

  /**
   * Opens a forward-only statement whose lifetime is handed to the returned cursor.
   */
  protected <T> RecordCursor<T> stream(Connection conn, String sql, JdbcTemplate.RowMapper<T> mapper,
      CancellationToken token, Object... params) {
    Objects.requireNonNull(token, "token");
    PreparedStatement ps = null;
    try {
      ps = conn.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
      configureStreaming(ps);
      for (int i = 0; i < params.length; i++) {
        ps.setObject(i + 1, params[i]);
      }
      return new ResultSetCursor<>(ps, ps.executeQuery(), mapper, token);
    } catch (SQLException e) {
      if (ps != null) {
        try {
          ps.close();
        } catch (SQLException suppressed) {
          e.addSuppressed(suppressed);
        }
      }
      throw new FeedStoreException("Failed to open cursor", e);
    }
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength - 3) + "...";
  }
}
