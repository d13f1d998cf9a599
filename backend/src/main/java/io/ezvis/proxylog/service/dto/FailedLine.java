package io.ezvis.proxylog.service.dto;

public record FailedLine(long lineNumber, String reason, String detail, String line) {
}
