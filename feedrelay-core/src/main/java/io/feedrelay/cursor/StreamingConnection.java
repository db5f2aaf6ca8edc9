package io.feedrelay.cursor;

import io.feedrelay.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Connection backing a {@link RecordCursor}, held in a read-only transaction until closed.
 *
 * <p>Drivers such as PgJDBC honour a statement's fetch size only outside auto-commit mode
 * and otherwise read the whole result before returning the first row. Closing ends the
 * transaction with a rollback and releases the connection.
 *
 * <pre>{@code
 * try (StreamingConnection sc = StreamingConnection.open(connectionProvider);
 *      RecordCursor<Feed> feeds = store.streamFeeds(sc.connection(), token)) {
 *   ...
 * }
 * }</pre>
 */
public final class StreamingConnection implements AutoCloseable {
  private final Connection connection;
  private boolean closed;

  private StreamingConnection(Connection connection) {
    this.connection = connection;
  }

  /**
   * Obtains a connection and starts a read-only transaction on it.
   *
   * @throws SQLException if the connection cannot be obtained or configured; it is closed then
   */
  public static StreamingConnection open(ConnectionProvider provider) throws SQLException {
    Objects.requireNonNull(provider, "provider");
    Connection conn = provider.getConnection();
    try {
      conn.setAutoCommit(true);
      conn.setReadOnly(true);
      conn.setAutoCommit(false);
      return new StreamingConnection(conn);
    } catch (SQLException | RuntimeException e) {
      try {
        conn.close();
      } catch (SQLException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw e;
    }
  }

  public Connection connection() {
    return connection;
  }

  /**
   * Rolls the transaction back and closes the connection. Idempotent.
   */
  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      connection.rollback();
      connection.setAutoCommit(true);
      connection.setReadOnly(false);
    } finally {
      connection.close();
    }
  }
}
