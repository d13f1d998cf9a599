package io.ezvis.proxylog.repository;

import io.ezvis.proxylog.config.StoreProperties;
import io.ezvis.proxylog.parser.AccessLogRecord;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner of the wide {@code requests} table: schema creation, bulk append and the read path used by the
 * aggregation queries. Rows are never updated or deleted here.
 */
@Slf4j
@Repository
public class RequestStore {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    static final List<String> COLUMNS = List.of(
            "ts", "remote_addr", "identd", "user_or_session", "method", "url", "scheme", "host", "port",
            "path", "query", "http_version", "status", "bytes", "country", "user_agent", "raw");

    private final JdbcTemplate jdbc;
    private final StoreDialect dialect;
    private final String table;
    private final String insertSql;

    public RequestStore(JdbcTemplate jdbc, StoreProperties properties) {
        if (!TABLE_NAME.matcher(properties.getTable()).matches()) {
            throw new IllegalStateException("ezvis.store.table is not a valid identifier: " + properties.getTable());
        }
        this.jdbc = jdbc;
        this.dialect = properties.getDialect();
        this.table = properties.getTable();
        this.insertSql = "INSERT INTO " + table + " (" + String.join(", ", COLUMNS) + ") VALUES ("
                + dialect.timestampParameter() + ", ?".repeat(COLUMNS.size() - 1) + ")";
    }

    public StoreDialect dialect() {
        return dialect;
    }

    public String table() {
        return table;
    }

    /**
     * Creates the table and its secondary indexes when missing. Existing data is left untouched.
     */
    public void ensureSchema() {
        try {
            for (String ddl : dialect.createTable(table)) {
                jdbc.execute(ddl);
            }
            log.info("Store schema ensured: dialect={}, table='{}'", dialect, table);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to create schema for table " + table, e);
        }
    }

    /**
     * Persists the whole batch in one bulk statement; on failure nothing of this batch stays visible.
     *
     * @return number of rows written
     */
    @Transactional
    public int appendBatch(List<AccessLogRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        try {
            jdbc.batchUpdate(insertSql, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    bind(ps, records.get(i));
                }

                @Override
                public int getBatchSize() {
                    return records.size();
                }
            });
            return records.size();
        } catch (DataAccessException e) {
            throw new StorageException("Bulk append of " + records.size() + " rows into " + table + " failed", e);
        }
    }

    @Transactional(readOnly = true)
    public long count() {
        Long total = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return total == null ? 0L : total;
    }

    /**
     * Runs a read-only aggregation against the table. Callers receive Spring's {@link DataAccessException}
     * untranslated.
     */
    @Transactional(readOnly = true)
    public <T> List<T> select(String sql, List<Object> args, RowMapper<T> mapper) {
        return jdbc.query(sql, mapper, args.toArray());
    }

    private void bind(PreparedStatement ps, AccessLogRecord r) throws SQLException {
        int i = 1;
        ps.setObject(i++, dialect.bindTimestamp(r.timestamp()));
        ps.setString(i++, r.remoteAddr());
        ps.setString(i++, r.identd());
        ps.setString(i++, r.userOrSession());
        ps.setString(i++, r.method());
        ps.setString(i++, r.url());
        ps.setString(i++, r.scheme());
        ps.setString(i++, r.host());
        ps.setInt(i++, r.port());
        ps.setString(i++, r.path());
        ps.setString(i++, r.query());
        ps.setString(i++, r.httpVersion());
        ps.setInt(i++, r.status());
        ps.setLong(i++, r.bytes());
        ps.setString(i++, r.country());
        ps.setString(i++, r.userAgent());
        ps.setString(i, r.raw());
    }
}
