package io.ezvis.proxylog.service;

import static io.ezvis.proxylog.LogLines.line;
import static org.assertj.core.api.Assertions.assertThat;

import io.ezvis.proxylog.LogLines;
import io.ezvis.proxylog.repository.RequestStore;
import io.ezvis.proxylog.service.dto.BandwidthPoint;
import io.ezvis.proxylog.service.dto.CountryCount;
import io.ezvis.proxylog.service.dto.HeatmapCell;
import io.ezvis.proxylog.service.dto.HostCount;
import io.ezvis.proxylog.service.dto.HostErrors;
import io.ezvis.proxylog.service.dto.ImportSummary;
import io.ezvis.proxylog.service.dto.PathStats;
import io.ezvis.proxylog.service.dto.StatusCount;
import io.ezvis.proxylog.service.dto.TimeSeriesPoint;
import io.ezvis.proxylog.service.dto.UserAgentCount;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class AccessLogQueryServiceTest {

    private static final String CHROME = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String EDGE = CHROME + " Edg/120.0.0.0";
    private static final String SAFARI = "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_1) AppleWebKit/605.1.15 "
            + "(KHTML, like Gecko) Version/17.1 Safari/605.1.15";
    private static final String GOOGLEBOT = "Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)";

    @Autowired
    private LogImportService importService;

    @Autowired
    private AccessLogQueryService queryService;

    @Autowired
    private RequestStore store;

    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void cleanTable() {
        jdbc.update("DELETE FROM " + store.table());
    }

    @Test
    void exampleLineYieldsSingleStatusRow() {
        load(LogLines.EXAMPLE);

        assertThat(queryService.statusCodes(TimeRange.ALL)).containsExactly(new StatusCount(200, 1));
    }

    @Test
    void dashAndNumericBytesShareOneBandwidthBucket() {
        load(line("15/Feb/2026:00:10:00 +0000", "http://a.example/x", 200, "-", "US", "ua"),
                line("15/Feb/2026:00:50:00 +0000", "http://a.example/y", 200, "512", "US", "ua"));

        assertThat(jdbc.queryForList("SELECT bytes FROM requests ORDER BY bytes", Long.class))
                .containsExactly(0L, 512L);
        assertThat(queryService.bandwidthOverTime(TimeRange.ALL))
                .containsExactly(new BandwidthPoint(Instant.parse("2026-02-15T00:00:00Z"), 512L, 512 / 1e6));
    }

    @Test
    void reimportingTheSameLinesDoublesTheRowCount() {
        String[] lines = {
                line("15/Feb/2026:00:00:01 +0000", "http://a.example/1", 200),
                line("15/Feb/2026:00:00:02 +0000", "http://a.example/2", 200),
                line("15/Feb/2026:00:00:03 +0000", "http://a.example/3", 200),
                line("15/Feb/2026:00:00:04 +0000", "http://a.example/4", 200)
        };

        load(lines);
        load(lines);

        assertThat(store.count()).isEqualTo(8);
        assertThat(queryService.requestsOverTime(TimeRange.ALL)).extracting(TimeSeriesPoint::count).containsExactly(8L);
    }

    @Test
    void rowCountGrowsByValidLinesOnly() {
        long before = store.count();

        ImportSummary summary = importService.importLines("mixed.log", Stream.of(
                line("15/Feb/2026:00:00:01 +0000", "http://a.example/1", 200),
                "garbage line",
                line("15/Feb/2026:00:00:02 +0000", "http://a.example/2", 404),
                line("15/Feb/2026:00:00:03 +0000", "http://a.example/3", 200).replace(" 200 ", " 2x0 "),
                line("15/Feb/2026:00:00:04 +0000", "http://a.example/4", 500),
                line("15/Feb/2026:00:00:05 +0000", "http://a.example/5", 200)));

        assertThat(summary.imported()).isEqualTo(4);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(store.count()).isEqualTo(before + 4);
    }

    @Test
    void storedRowKeepsRawLineAndDerivedColumns() {
        load(LogLines.EXAMPLE);

        var row = jdbc.queryForMap("SELECT host, port, path, query, scheme, country, raw FROM requests");
        assertThat(row.get("HOST")).isEqualTo("www.jstor.org");
        assertThat(row.get("PORT")).isEqualTo(443);
        assertThat(row.get("PATH")).isEqualTo("/stable/12345");
        assertThat(row.get("QUERY")).isEqualTo("");
        assertThat(row.get("SCHEME")).isEqualTo("https");
        assertThat(row.get("COUNTRY")).isEqualTo("US");
        assertThat(row.get("RAW")).isEqualTo(LogLines.EXAMPLE);
        assertThat(jdbc.queryForObject("SELECT ts FROM requests", OffsetDateTime.class))
                .isEqualTo(OffsetDateTime.parse("2026-02-15T00:00:04Z"));
    }

    @Test
    void requestsOverTimeIsBucketedHourlyAscending() {
        load(line("15/Feb/2026:02:05:00 +0000", "http://a.example/", 200),
                line("15/Feb/2026:00:01:00 +0000", "http://a.example/", 200),
                line("15/Feb/2026:00:59:59 +0000", "http://a.example/", 200),
                line("15/Feb/2026:02:30:00 +0100", "http://a.example/", 200));

        assertThat(queryService.requestsOverTime(TimeRange.ALL)).containsExactly(
                new TimeSeriesPoint(Instant.parse("2026-02-15T00:00:00Z"), 2),
                new TimeSeriesPoint(Instant.parse("2026-02-15T01:00:00Z"), 1),
                new TimeSeriesPoint(Instant.parse("2026-02-15T02:00:00Z"), 1));
    }

    @Test
    void timeRangeIsHalfOpen() {
        load(line("15/Feb/2026:00:00:00 +0000", "http://a.example/", 200),
                line("15/Feb/2026:00:30:00 +0000", "http://a.example/", 404),
                line("15/Feb/2026:01:00:00 +0000", "http://a.example/", 500));

        TimeRange firstHour = TimeRange.parse("2026-02-15T00:00:00Z", "2026-02-15T01:00:00Z");

        assertThat(queryService.statusCodes(firstHour))
                .containsExactly(new StatusCount(200, 1), new StatusCount(404, 1));
        assertThat(queryService.requestsOverTime(firstHour))
                .containsExactly(new TimeSeriesPoint(Instant.parse("2026-02-15T00:00:00Z"), 2));
        assertThat(queryService.statusCodes(TimeRange.parse("2026-02-15T01:00:00Z", null)))
                .containsExactly(new StatusCount(500, 1));
    }

    @Test
    void statusCodesAreOrderedByCode() {
        load(line("15/Feb/2026:00:00:00 +0000", "http://a.example/", 500),
                line("15/Feb/2026:00:00:01 +0000", "http://a.example/", 200),
                line("15/Feb/2026:00:00:02 +0000", "http://a.example/", 404),
                line("15/Feb/2026:00:00:03 +0000", "http://a.example/", 200));

        assertThat(queryService.statusCodes(TimeRange.ALL)).containsExactly(
                new StatusCount(200, 2), new StatusCount(404, 1), new StatusCount(500, 1));
    }

    @Test
    void heatmapIsAlwaysAFullZeroFilledMatrix() {
        List<HeatmapCell> empty = queryService.hourlyHeatmap(TimeRange.ALL);

        assertThat(empty).hasSize(168).allSatisfy(cell -> assertThat(cell.count()).isZero());
        assertThat(empty.get(0)).isEqualTo(new HeatmapCell(1, 0, 0));
        assertThat(empty.get(167)).isEqualTo(new HeatmapCell(7, 23, 0));
    }

    @Test
    void heatmapCountsByUtcDayAndHour() {
        load(line("15/Feb/2026:00:00:04 +0000", "http://a.example/", 200),
                line("16/Feb/2026:13:00:00 +0000", "http://a.example/", 200),
                line("16/Feb/2026:13:45:00 +0000", "http://a.example/", 200),
                line("16/Feb/2026:01:00:00 +0200", "http://a.example/", 200));

        List<HeatmapCell> cells = queryService.hourlyHeatmap(TimeRange.ALL);

        int sunday = OffsetDateTime.parse("2026-02-15T00:00:04Z").getDayOfWeek().getValue();
        int monday = OffsetDateTime.parse("2026-02-16T13:00:00Z").getDayOfWeek().getValue();
        assertThat(cells).hasSize(168);
        assertThat(cells.stream().mapToLong(HeatmapCell::count).sum()).isEqualTo(4);
        assertThat(cell(cells, sunday, 0)).isEqualTo(1);
        assertThat(cell(cells, sunday, 23)).isEqualTo(1);
        assertThat(cell(cells, monday, 13)).isEqualTo(2);
        assertThat(cells).isSortedAccordingTo(
                Comparator.comparingInt(HeatmapCell::dayOfWeek).thenComparingInt(HeatmapCell::hour));
    }

    @Test
    void heatmapSumMatchesRequestsInRange() {
        load(line("15/Feb/2026:00:00:00 +0000", "http://a.example/", 200),
                line("15/Feb/2026:05:00:00 +0000", "http://a.example/", 200),
                line("17/Feb/2026:05:00:00 +0000", "http://a.example/", 200));

        List<HeatmapCell> cells = queryService.hourlyHeatmap(TimeRange.parse("2026-02-15", "2026-02-16"));

        assertThat(cells).hasSize(168);
        assertThat(cells.stream().mapToLong(HeatmapCell::count).sum()).isEqualTo(2);
    }

    @Test
    void topHostsAreCappedAndTieBrokenByHost() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String host = String.format("h%02d.example", i);
            for (int n = 0; n <= i % 4; n++) {
                lines.add(line("15/Feb/2026:00:00:00 +0000", "http://" + host + "/", 200));
            }
        }
        lines.add(line("15/Feb/2026:00:00:00 +0000", "not-a-url", 200));
        load(lines.toArray(String[]::new));

        List<HostCount> hosts = queryService.topHosts(TimeRange.ALL);

        assertThat(hosts).hasSize(15);
        assertThat(hosts.get(0)).isEqualTo(new HostCount("h03.example", 4));
        assertThat(hosts).extracting(HostCount::host).doesNotContain("");
        assertThat(hosts).isSortedAccordingTo(Comparator.comparingLong(HostCount::count).reversed()
                .thenComparing(HostCount::host));
        assertThat(queryService.topHosts(TimeRange.ALL)).isEqualTo(hosts);
    }

    @Test
    void topPathsSkipRootAndReportAverageBytes() {
        List<String> lines = new ArrayList<>();
        for (String bytes : List.of("100", "200", "600")) {
            lines.add(line("15/Feb/2026:00:00:00 +0000", "http://a.example/hot?x=1", 200, bytes, "US", "ua"));
        }
        for (int i = 0; i < 17; i++) {
            lines.add(line("15/Feb/2026:00:00:00 +0000", String.format("http://a.example/p%02d", i), 200));
        }
        for (int i = 0; i < 5; i++) {
            lines.add(line("15/Feb/2026:00:00:00 +0000", "http://a.example/", 200));
            lines.add(line("15/Feb/2026:00:00:00 +0000", "https://b.example", 200));
        }
        load(lines.toArray(String[]::new));

        List<PathStats> paths = queryService.topPaths(TimeRange.ALL);

        assertThat(paths).hasSize(15);
        assertThat(paths.get(0)).isEqualTo(new PathStats("/hot", 3, 300.0));
        assertThat(paths.get(14).path()).isEqualTo("/p13");
        assertThat(paths).extracting(PathStats::path).doesNotContain("/", "");
        assertThat(paths).isSortedAccordingTo(Comparator.comparingLong(PathStats::count).reversed()
                .thenComparing(PathStats::path));
    }

    @Test
    void errorAnalysisSplitsClientAndServerErrors() {
        load(line("15/Feb/2026:00:00:00 +0000", "http://a.example/", 404),
                line("15/Feb/2026:00:00:01 +0000", "http://a.example/", 404),
                line("15/Feb/2026:00:00:02 +0000", "http://a.example/", 500),
                line("15/Feb/2026:00:00:03 +0000", "http://b.example/", 503),
                line("15/Feb/2026:00:00:04 +0000", "http://c.example/", 200),
                line("15/Feb/2026:00:00:05 +0000", "http://c.example/", 301));

        assertThat(queryService.errorAnalysis(TimeRange.ALL)).containsExactly(
                new HostErrors("a.example", 3, 2, 1),
                new HostErrors("b.example", 1, 0, 1));
    }

    @Test
    void userAgentsAreGroupedIntoFamilies() {
        load(ua(CHROME), ua(CHROME), ua(EDGE), ua(LogLines.FIREFOX), ua(SAFARI), ua(GOOGLEBOT), ua("curl/8.4.0"), ua(""));

        assertThat(queryService.userAgents(TimeRange.ALL)).containsExactly(
                new UserAgentCount("Chrome", 2),
                new UserAgentCount("Bot", 1),
                new UserAgentCount("Edge", 1),
                new UserAgentCount("Firefox", 1),
                new UserAgentCount("Other", 1),
                new UserAgentCount("Safari", 1));
    }

    @Test
    void topCountriesRankByCountThenCodeWithoutEmptyCountry() {
        load(country("US"), country("US"), country("US"), country("FR"), country("DE"), country("FR"),
                country("DE"), country(""), country(""), country(""), country(""));

        assertThat(queryService.topCountries(TimeRange.ALL)).containsExactly(
                new CountryCount("US", 3),
                new CountryCount("DE", 2),
                new CountryCount("FR", 2));
    }

    @Test
    void dispatchByKindMatchesDirectCalls() {
        load(LogLines.EXAMPLE, line("15/Feb/2026:03:00:00 +0000", "http://a.example/x", 404));

        assertThat(queryService.run(QueryKind.HOURLY_HEATMAP, TimeRange.ALL)).hasSize(168);
        assertThat(queryService.run(QueryKind.TOP_HOSTS, TimeRange.ALL)).isEqualTo(queryService.topHosts(TimeRange.ALL));
        assertThat(queryService.run(QueryKind.STATUS_CODES, TimeRange.ALL)).hasSize(2);
    }

    private void load(String... lines) {
        ImportSummary summary = importService.importLines("test.log", Stream.of(lines));
        assertThat(summary.isComplete()).isTrue();
        assertThat(summary.failed()).isZero();
    }

    private static long cell(List<HeatmapCell> cells, int day, int hour) {
        return cells.stream()
                .filter(c -> c.dayOfWeek() == day && c.hour() == hour)
                .mapToLong(HeatmapCell::count)
                .findFirst()
                .orElseThrow();
    }

    private static String ua(String userAgent) {
        return line("15/Feb/2026:00:00:00 +0000", "http://a.example/", 200, "1", "US", userAgent);
    }

    private static String country(String code) {
        return line("15/Feb/2026:00:00:00 +0000", "http://a.example/", 200, "1", code, "ua");
    }
}
