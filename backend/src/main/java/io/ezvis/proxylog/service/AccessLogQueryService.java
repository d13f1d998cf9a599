package io.ezvis.proxylog.service;

import io.ezvis.proxylog.config.QueryProperties;
import io.ezvis.proxylog.repository.RequestStore;
import io.ezvis.proxylog.repository.StoreDialect;
import io.ezvis.proxylog.service.dto.BandwidthPoint;
import io.ezvis.proxylog.service.dto.CountryCount;
import io.ezvis.proxylog.service.dto.HeatmapCell;
import io.ezvis.proxylog.service.dto.HostCount;
import io.ezvis.proxylog.service.dto.HostErrors;
import io.ezvis.proxylog.service.dto.PathStats;
import io.ezvis.proxylog.service.dto.StatusCount;
import io.ezvis.proxylog.service.dto.TimeSeriesPoint;
import io.ezvis.proxylog.service.dto.UserAgentCount;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The nine dashboard aggregations. Each one pushes the optional time window down as a filter on {@code ts},
 * orders ties by the grouping key ascending and reads through {@link RequestStore} only.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class AccessLogQueryService {

    static final int TOP_HOSTS_LIMIT = 15;
    static final int TOP_COUNTRIES_LIMIT = 20;
    static final int ERROR_HOSTS_LIMIT = 10;
    static final int TOP_PATHS_LIMIT = 15;
    static final int DAYS_PER_WEEK = 7;
    static final int HOURS_PER_DAY = 24;

    /** First matching family wins. */
    private static final String USER_AGENT_FAMILY = """
            CASE
              WHEN user_agent LIKE '%Chrome%' AND user_agent NOT LIKE '%Edg%' THEN 'Chrome'
              WHEN user_agent LIKE '%Firefox%' THEN 'Firefox'
              WHEN user_agent LIKE '%Safari%' AND user_agent NOT LIKE '%Chrome%' THEN 'Safari'
              WHEN user_agent LIKE '%Edg%' THEN 'Edge'
              WHEN user_agent LIKE '%Opera%' THEN 'Opera'
              WHEN user_agent LIKE '%bot%' OR user_agent LIKE '%Bot%' THEN 'Bot'
              ELSE 'Other'
            END""";

    private final RequestStore store;
    private final int userAgentLimit;

    public AccessLogQueryService(RequestStore store, QueryProperties properties) {
        this.store = store;
        this.userAgentLimit = Math.max(0, properties.getUserAgentLimit());
    }

    public List<?> run(QueryKind kind, TimeRange range) {
        return switch (kind) {
            case REQUESTS_OVER_TIME -> requestsOverTime(range);
            case BANDWIDTH_OVER_TIME -> bandwidthOverTime(range);
            case TOP_HOSTS -> topHosts(range);
            case STATUS_CODES -> statusCodes(range);
            case TOP_COUNTRIES -> topCountries(range);
            case HOURLY_HEATMAP -> hourlyHeatmap(range);
            case ERROR_ANALYSIS -> errorAnalysis(range);
            case USER_AGENTS -> userAgents(range);
            case TOP_PATHS -> topPaths(range);
        };
    }

    public List<TimeSeriesPoint> requestsOverTime(TimeRange range) {
        String bucket = dialect().hourBucket("ts");
        Filter filter = Filter.of(dialect(), range);
        String sql = "SELECT " + bucket + " AS bucket, COUNT(*) AS n FROM " + store.table()
                + filter.where() + " GROUP BY " + bucket + " ORDER BY bucket";
        return select(QueryKind.REQUESTS_OVER_TIME, sql, filter,
                (rs, i) -> new TimeSeriesPoint(dialect().readBucket(rs, "bucket"), rs.getLong("n")));
    }

    public List<BandwidthPoint> bandwidthOverTime(TimeRange range) {
        String bucket = dialect().hourBucket("ts");
        Filter filter = Filter.of(dialect(), range);
        String sql = "SELECT " + bucket + " AS bucket, SUM(bytes) AS total_bytes FROM " + store.table()
                + filter.where() + " GROUP BY " + bucket + " ORDER BY bucket";
        return select(QueryKind.BANDWIDTH_OVER_TIME, sql, filter,
                (rs, i) -> BandwidthPoint.of(dialect().readBucket(rs, "bucket"), rs.getLong("total_bytes")));
    }

    public List<HostCount> topHosts(TimeRange range) {
        Filter filter = Filter.of(dialect(), range, "host <> ''");
        String sql = "SELECT host, COUNT(*) AS n FROM " + store.table() + filter.where()
                + " GROUP BY host ORDER BY n DESC, host ASC LIMIT " + TOP_HOSTS_LIMIT;
        return select(QueryKind.TOP_HOSTS, sql, filter,
                (rs, i) -> new HostCount(rs.getString("host"), rs.getLong("n")));
    }

    public List<StatusCount> statusCodes(TimeRange range) {
        Filter filter = Filter.of(dialect(), range);
        String sql = "SELECT status, COUNT(*) AS n FROM " + store.table() + filter.where()
                + " GROUP BY status ORDER BY status ASC";
        return select(QueryKind.STATUS_CODES, sql, filter,
                (rs, i) -> new StatusCount(rs.getInt("status"), rs.getLong("n")));
    }

    /** Lines without a country code are not ranked. */
    public List<CountryCount> topCountries(TimeRange range) {
        Filter filter = Filter.of(dialect(), range, "country <> ''");
        String sql = "SELECT country, COUNT(*) AS n FROM " + store.table() + filter.where()
                + " GROUP BY country ORDER BY n DESC, country ASC LIMIT " + TOP_COUNTRIES_LIMIT;
        return select(QueryKind.TOP_COUNTRIES, sql, filter,
                (rs, i) -> new CountryCount(rs.getString("country"), rs.getLong("n")));
    }

    /**
     * Full 7 x 24 matrix in UTC, Monday first, zero-filled.
     */
    public List<HeatmapCell> hourlyHeatmap(TimeRange range) {
        String day = dialect().isoDayOfWeek("ts");
        String hour = dialect().hourOfDay("ts");
        Filter filter = Filter.of(dialect(), range);
        String sql = "SELECT " + day + " AS dow, " + hour + " AS hod, COUNT(*) AS n FROM " + store.table()
                + filter.where() + " GROUP BY " + day + ", " + hour;

        long[][] counts = new long[DAYS_PER_WEEK][HOURS_PER_DAY];
        select(QueryKind.HOURLY_HEATMAP, sql, filter, (rs, i) -> {
            counts[rs.getInt("dow") - 1][rs.getInt("hod")] += rs.getLong("n");
            return null;
        });

        List<HeatmapCell> cells = new ArrayList<>(DAYS_PER_WEEK * HOURS_PER_DAY);
        for (int d = 0; d < DAYS_PER_WEEK; d++) {
            for (int h = 0; h < HOURS_PER_DAY; h++) {
                cells.add(new HeatmapCell(d + 1, h, counts[d][h]));
            }
        }
        return cells;
    }

    public List<HostErrors> errorAnalysis(TimeRange range) {
        Filter filter = Filter.of(dialect(), range, "status >= 400", "host <> ''");
        String sql = "SELECT host, COUNT(*) AS n,"
                + " SUM(CASE WHEN status < 500 THEN 1 ELSE 0 END) AS client_errors,"
                + " SUM(CASE WHEN status >= 500 THEN 1 ELSE 0 END) AS server_errors"
                + " FROM " + store.table() + filter.where()
                + " GROUP BY host ORDER BY n DESC, host ASC LIMIT " + ERROR_HOSTS_LIMIT;
        return select(QueryKind.ERROR_ANALYSIS, sql, filter, (rs, i) -> new HostErrors(
                rs.getString("host"),
                rs.getLong("n"),
                rs.getLong("client_errors"),
                rs.getLong("server_errors")));
    }

    public List<UserAgentCount> userAgents(TimeRange range) {
        Filter filter = Filter.of(dialect(), range, "user_agent <> ''");
        String sql = "SELECT " + USER_AGENT_FAMILY + " AS family, COUNT(*) AS n FROM " + store.table()
                + filter.where() + " GROUP BY " + USER_AGENT_FAMILY + " ORDER BY n DESC, family ASC"
                + (userAgentLimit > 0 ? " LIMIT " + userAgentLimit : "");
        return select(QueryKind.USER_AGENTS, sql, filter,
                (rs, i) -> new UserAgentCount(rs.getString("family"), rs.getLong("n")));
    }

    /** The empty path and the bare root are not ranked. */
    public List<PathStats> topPaths(TimeRange range) {
        Filter filter = Filter.of(dialect(), range, "path <> ''", "path <> '/'");
        String sql = "SELECT path, COUNT(*) AS n, AVG(bytes) AS avg_bytes FROM " + store.table() + filter.where()
                + " GROUP BY path ORDER BY n DESC, path ASC LIMIT " + TOP_PATHS_LIMIT;
        return select(QueryKind.TOP_PATHS, sql, filter,
                (rs, i) -> new PathStats(rs.getString("path"), rs.getLong("n"), rs.getDouble("avg_bytes")));
    }

    private StoreDialect dialect() {
        return store.dialect();
    }

    private <T> List<T> select(QueryKind kind, String sql, Filter filter, RowMapper<T> mapper) {
        return guard(kind, () -> store.select(sql, filter.args(), mapper));
    }

    private <T> T guard(QueryKind kind, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.warn("Query {} failed: {}", kind.externalName(), e.getMessage());
            throw new QueryException("Query " + kind.externalName() + " failed", e);
        }
    }

    /**
     * WHERE clause with the pushed-down time window plus fixed predicates.
     */
    private record Filter(String where, List<Object> args) {

        static Filter of(StoreDialect dialect, TimeRange range, String... predicates) {
            List<String> conditions = new ArrayList<>(List.of(predicates));
            List<Object> args = new ArrayList<>();
            range.start().ifPresent(start -> {
                conditions.add("ts >= " + dialect.timestampParameter());
                args.add(dialect.bindTimestamp(start));
            });
            range.end().ifPresent(end -> {
                conditions.add("ts < " + dialect.timestampParameter());
                args.add(dialect.bindTimestamp(end));
            });
            String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
            return new Filter(where, List.copyOf(args));
        }
    }
}
