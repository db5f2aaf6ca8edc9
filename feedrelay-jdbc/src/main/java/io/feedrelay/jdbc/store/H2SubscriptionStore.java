package io.feedrelay.jdbc.store;

import java.util.List;

/**
 * H2 subscription store. Primarily for testing.
 */
public final class H2SubscriptionStore extends AbstractJdbcSubscriptionStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String insertScopeIfAbsentSql() {
    return "MERGE INTO admission_locks (scope, scope_id) KEY (scope, scope_id) VALUES (?, ?)";
  }
}
