package io.ezvis.proxylog.service.dto;

public record StatusCount(int status, long count) {
}
