package io.feedrelay.jdbc;

import io.feedrelay.cursor.CancellationToken;
import io.feedrelay.cursor.RecordCursor;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RecordCursor} over an open {@link ResultSet}, reading one row ahead at most.
 *
 * <p>The statement and result set are closed when the rows are exhausted, when
 * {@link #close()} is called, or when the token is found cancelled on the next
 * {@link #hasNext()}. A {@link SQLException} while reading ends the sequence; it is
 * logged, not thrown. The connection itself is not owned by the cursor.
 *
 * <p>Not thread-safe.
 *
 * @param <T> record type
 */
public final class ResultSetCursor<T> implements RecordCursor<T> {
  private static final Logger logger = Logger.getLogger(ResultSetCursor.class.getName());

  private final PreparedStatement statement;
  private final ResultSet resultSet;
  private final JdbcTemplate.RowMapper<T> mapper;
  private final CancellationToken token;

  private T lookahead;
  private boolean closed;

  public ResultSetCursor(PreparedStatement statement, ResultSet resultSet,
      JdbcTemplate.RowMapper<T> mapper, CancellationToken token) {
    this.statement = Objects.requireNonNull(statement, "statement");
    this.resultSet = Objects.requireNonNull(resultSet, "resultSet");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.token = Objects.requireNonNull(token, "token");
  }

  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    if (token.isCancelled()) {
      logger.log(Level.FINE, "Cursor cancelled, releasing result set");
      close();
      return false;
    }
    if (lookahead != null) {
      return true;
    }
    try {
      if (!resultSet.next()) {
        close();
        return false;
      }
      lookahead = mapper.map(resultSet);
      return true;
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Read error, ending cursor early", e);
      close();
      return false;
    }
  }

  @Override
  public T next() {
    if (lookahead == null && !hasNext()) {
      throw new NoSuchElementException();
    }
    T value = lookahead;
    lookahead = null;
    return value;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    lookahead = null;
    try {
      resultSet.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close result set", e);
    }
    try {
      statement.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close statement", e);
    }
  }
}
