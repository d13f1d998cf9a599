package io.ezvis.proxylog.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PathStats(String path, long count, @JsonProperty("avg_bytes") double avgBytes) {
}
