package com.delta.adsync.sync.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

final class JdbcSupport {
    private static final Logger log = LoggerFactory.getLogger(JdbcSupport.class);

    private JdbcSupport() {
    }

    /**
     * True only for a real PostgreSQL connection. H2 in PostgreSQL mode does not understand
     * {@code ON CONFLICT}, so it takes the update-then-insert path.
     */
    static boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upserts", e);
            return false;
        }
    }

    static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static Date toSqlDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    static LocalDate toLocalDate(Date value) {
        return value == null ? null : value.toLocalDate();
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength);
    }
}
