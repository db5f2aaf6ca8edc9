package io.feedrelay.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 databases initialized from the bundled schema scripts.
 */
final class TestDatabase {

  private TestDatabase() {
  }

  static JdbcDataSource h2(String name) throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + name + "_" + UUID.randomUUID()
        + ";MODE=MySQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    createSchema(ds, "/schema/h2.sql");
    return ds;
  }

  static void createSchema(DataSource ds, String resource) throws IOException, SQLException {
    String schema = loadResource(resource);
    try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
      for (String stmt : schema.split(";")) {
        String trimmed = stmt.trim();
        if (!trimmed.isEmpty()) {
          st.execute(trimmed);
        }
      }
    }
  }

  static int count(DataSource ds, String sql) throws SQLException {
    try (Connection conn = ds.getConnection();
         Statement st = conn.createStatement();
         var rs = st.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  private static String loadResource(String path) throws IOException {
    try (InputStream is = TestDatabase.class.getResourceAsStream(path)) {
      if (is == null) throw new IOException("Resource not found: " + path);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
