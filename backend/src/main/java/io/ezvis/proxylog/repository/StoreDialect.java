package io.ezvis.proxylog.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * SQL differences between the supported stores. Every time expression evaluates in UTC.
 */
public enum StoreDialect {

    H2 {
        @Override
        List<String> createTable(String table) {
            return rowStoreDdl(table, "TIMESTAMP WITH TIME ZONE", "CHARACTER VARYING");
        }

        @Override
        public String hourBucket(String column) {
            return "DATE_TRUNC(HOUR, " + column + ")";
        }

        @Override
        public String hourOfDay(String column) {
            return "EXTRACT(HOUR FROM " + column + ")";
        }

        @Override
        public String isoDayOfWeek(String column) {
            return "EXTRACT(ISO_DAY_OF_WEEK FROM " + column + ")";
        }

        @Override
        public Instant readBucket(ResultSet rs, String column) throws SQLException {
            return rs.getObject(column, OffsetDateTime.class).toInstant();
        }
    },

    POSTGRES {
        @Override
        List<String> createTable(String table) {
            return rowStoreDdl(table, "TIMESTAMPTZ", "TEXT");
        }

        @Override
        public String hourBucket(String column) {
            return "date_trunc('hour', " + column + " AT TIME ZONE 'UTC')";
        }

        @Override
        public String hourOfDay(String column) {
            return "CAST(EXTRACT(HOUR FROM " + column + " AT TIME ZONE 'UTC') AS INTEGER)";
        }

        @Override
        public String isoDayOfWeek(String column) {
            return "CAST(EXTRACT(ISODOW FROM " + column + " AT TIME ZONE 'UTC') AS INTEGER)";
        }

        @Override
        public Instant readBucket(ResultSet rs, String column) throws SQLException {
            return rs.getObject(column, LocalDateTime.class).toInstant(ZoneOffset.UTC);
        }
    },

    CLICKHOUSE {
        @Override
        List<String> createTable(String table) {
            return List.of("""
                    CREATE TABLE IF NOT EXISTS %s (
                      ts DateTime64(3, 'UTC'),
                      remote_addr String,
                      identd String,
                      user_or_session String,
                      method LowCardinality(String),
                      url String,
                      scheme LowCardinality(String),
                      host String,
                      port Int32,
                      path String,
                      query String,
                      http_version LowCardinality(String),
                      status Int32,
                      bytes Int64,
                      country LowCardinality(String),
                      user_agent String,
                      raw String,
                      INDEX idx_%1$s_host host TYPE bloom_filter GRANULARITY 4,
                      INDEX idx_%1$s_status status TYPE set(600) GRANULARITY 4,
                      INDEX idx_%1$s_country country TYPE set(512) GRANULARITY 4
                    ) ENGINE = MergeTree
                    ORDER BY ts
                    """.formatted(table));
        }

        @Override
        public String timestampParameter() {
            return "fromUnixTimestamp64Milli(?)";
        }

        @Override
        public Object bindTimestamp(OffsetDateTime timestamp) {
            return timestamp.toInstant().toEpochMilli();
        }

        @Override
        public String hourBucket(String column) {
            return "toUnixTimestamp(toStartOfHour(" + column + "))";
        }

        @Override
        public String hourOfDay(String column) {
            return "toHour(" + column + ")";
        }

        @Override
        public String isoDayOfWeek(String column) {
            return "toDayOfWeek(" + column + ")";
        }

        @Override
        public Instant readBucket(ResultSet rs, String column) throws SQLException {
            return Instant.ofEpochSecond(rs.getLong(column));
        }
    };

    /** DDL statements, each idempotent. */
    abstract List<String> createTable(String table);

    /** Placeholder used wherever a timestamp parameter is bound. */
    public String timestampParameter() {
        return "?";
    }

    public Object bindTimestamp(OffsetDateTime timestamp) {
        return timestamp.withOffsetSameInstant(ZoneOffset.UTC);
    }

    public abstract String hourBucket(String column);

    public abstract String hourOfDay(String column);

    /** 1 = Monday ... 7 = Sunday. */
    public abstract String isoDayOfWeek(String column);

    public abstract Instant readBucket(ResultSet rs, String column) throws SQLException;

    private static List<String> rowStoreDdl(String table, String timestampType, String textType) {
        String ddl = """
                CREATE TABLE IF NOT EXISTS %1$s (
                  ts %2$s NOT NULL,
                  remote_addr %3$s,
                  identd %3$s,
                  user_or_session %3$s,
                  method %3$s,
                  url %3$s,
                  scheme %3$s,
                  host %3$s,
                  port INTEGER,
                  path %3$s,
                  query %3$s,
                  http_version %3$s,
                  status INTEGER,
                  bytes BIGINT,
                  country %3$s,
                  user_agent %3$s,
                  raw %3$s
                )
                """.formatted(table, timestampType, textType);
        return List.of(
                ddl,
                "CREATE INDEX IF NOT EXISTS idx_%1$s_ts ON %1$s (ts)".formatted(table),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_host ON %1$s (host)".formatted(table),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_status ON %1$s (status)".formatted(table),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_country ON %1$s (country)".formatted(table)
        );
    }
}
