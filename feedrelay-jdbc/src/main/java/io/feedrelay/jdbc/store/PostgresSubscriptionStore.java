package io.feedrelay.jdbc.store;

import java.util.List;

/**
 * PostgreSQL subscription store.
 *
 * <p>The driver honours the cursor fetch size only outside auto-commit mode; in
 * auto-commit it reads the whole result before the first row is returned.
 */
public final class PostgresSubscriptionStore extends AbstractJdbcSubscriptionStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String insertScopeIfAbsentSql() {
    return "INSERT INTO admission_locks (scope, scope_id) VALUES (?, ?) ON CONFLICT DO NOTHING";
  }
}
