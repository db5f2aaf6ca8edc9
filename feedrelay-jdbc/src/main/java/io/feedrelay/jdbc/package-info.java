/**
 * JDBC plumbing shared by the subscription stores: {@link io.feedrelay.jdbc.JdbcTemplate},
 * {@link io.feedrelay.jdbc.ResultSetCursor} and {@link io.feedrelay.jdbc.DataSourceConnectionProvider}.
 */
package io.feedrelay.jdbc;
