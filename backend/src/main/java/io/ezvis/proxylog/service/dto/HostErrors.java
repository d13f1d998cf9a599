package io.ezvis.proxylog.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HostErrors(
        String host,
        long errors,
        @JsonProperty("client_errors") long clientErrors,
        @JsonProperty("server_errors") long serverErrors) {
}
