package io.ezvis.proxylog.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request count for one (ISO day-of-week, UTC hour) pair; day 1 is Monday.
 */
public record HeatmapCell(@JsonProperty("day_of_week") int dayOfWeek, int hour, long count) {
}
