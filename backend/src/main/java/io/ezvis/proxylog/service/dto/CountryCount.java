package io.ezvis.proxylog.service.dto;

public record CountryCount(String country, long count) {
}
