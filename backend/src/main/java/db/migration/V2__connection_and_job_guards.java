package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V2__connection_and_job_guards extends BaseJavaMigration {
  private static final String DEFAULT_INDEX_NAME = "uq_platform_connections_default";
  private static final String JOB_STATUS_CONSTRAINT = "sync_jobs_status_valid";
  private static final String CONNECTION_STATUS_CONSTRAINT = "platform_connections_status_valid";

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    // Partial indexes are PostgreSQL only; elsewhere ConnectionService keeps the single default.
    if (isPostgres(connection)) {
      try (Statement statement = connection.createStatement()) {
        statement.executeUpdate(
            "CREATE UNIQUE INDEX IF NOT EXISTS "
                + DEFAULT_INDEX_NAME
                + " ON platform_connections (tenant_id, platform) WHERE is_default");
      }
    }

    if (!constraintExists(connection, "sync_jobs", JOB_STATUS_CONSTRAINT)) {
      try (Statement statement = connection.createStatement()) {
        statement.executeUpdate(
            "ALTER TABLE sync_jobs ADD CONSTRAINT "
                + JOB_STATUS_CONSTRAINT
                + " CHECK (status IN ('running', 'completed', 'failed'))");
      }
    }

    if (!constraintExists(connection, "platform_connections", CONNECTION_STATUS_CONSTRAINT)) {
      try (Statement statement = connection.createStatement()) {
        statement.executeUpdate(
            "ALTER TABLE platform_connections ADD CONSTRAINT "
                + CONNECTION_STATUS_CONSTRAINT
                + " CHECK (status IN ('pending', 'connected', 'error', 'revoked'))");
      }
    }
  }

  private boolean isPostgres(Connection connection) throws SQLException {
    String url = connection.getMetaData().getURL();
    if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
      return false;
    }
    String product = connection.getMetaData().getDatabaseProductName();
    return product != null && product.toLowerCase(Locale.ROOT).contains("postgres");
  }

  private boolean constraintExists(Connection connection, String table, String name) throws SQLException {
    String sql =
        "SELECT 1 FROM information_schema.table_constraints "
            + "WHERE LOWER(table_name) = ? "
            + "AND LOWER(constraint_name) = ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, table);
      ps.setString(2, name.toLowerCase(Locale.ROOT));
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
