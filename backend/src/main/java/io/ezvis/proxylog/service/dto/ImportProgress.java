package io.ezvis.proxylog.service.dto;

public record ImportProgress(String importId, String source, long processed, long imported, long failed) {
}
