package io.ezvis.proxylog.service;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed catalog of dashboard aggregations, addressed by their external names.
 */
public enum QueryKind {
    REQUESTS_OVER_TIME("requests_over_time"),
    BANDWIDTH_OVER_TIME("bandwidth_over_time"),
    TOP_HOSTS("top_hosts"),
    STATUS_CODES("status_codes"),
    TOP_COUNTRIES("top_countries"),
    HOURLY_HEATMAP("hourly_heatmap"),
    ERROR_ANALYSIS("error_analysis"),
    USER_AGENTS("user_agents"),
    TOP_PATHS("top_paths");

    private final String externalName;

    QueryKind(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }

    public static Optional<QueryKind> fromName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.externalName.equalsIgnoreCase(name))
                .findFirst();
    }
}
