package io.ezvis.proxylog.service.dto;

public record UserAgentCount(String family, long count) {
}
