package io.feedrelay.jdbc.store;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * MySQL subscription store. Also compatible with MariaDB and TiDB.
 *
 * <p>Cursors use Connector/J row streaming ({@code fetchSize = Integer.MIN_VALUE}); while a
 * cursor is open its connection cannot run other statements, so callers stream on a
 * dedicated connection.
 */
public final class MySqlSubscriptionStore extends AbstractJdbcSubscriptionStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  protected String insertScopeIfAbsentSql() {
    return "INSERT IGNORE INTO admission_locks (scope, scope_id) VALUES (?, ?)";
  }

  @Override
  protected void configureStreaming(PreparedStatement ps) throws SQLException {
    ps.setFetchSize(Integer.MIN_VALUE);
  }
}
