package io.ezvis.proxylog.service.dto;

public record HostCount(String host, long count) {
}
