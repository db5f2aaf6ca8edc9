/**
 * JDBC {@link io.feedrelay.spi.SubscriptionStore} hierarchy.
 *
 * <p>{@link io.feedrelay.jdbc.store.AbstractJdbcSubscriptionStore} holds the shared SQL and
 * row mapping; subclasses supply the idempotent admission-row insert for H2 ({@code MERGE}),
 * MySQL ({@code INSERT IGNORE}) and PostgreSQL ({@code ON CONFLICT DO NOTHING}).
 *
 * @see io.feedrelay.jdbc.store.JdbcSubscriptionStores
 */
package io.feedrelay.jdbc.store;
