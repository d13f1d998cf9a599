package io.ezvis.proxylog.http;

import io.ezvis.proxylog.service.InvalidTimeRangeException;
import io.ezvis.proxylog.service.QueryException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidTimeRangeException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRange(InvalidTimeRangeException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_time_range", e.getMessage());
    }

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<Map<String, Object>> handleQueryFailure(QueryException e) {
        log.error("Query failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "query_failed", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        return error(status, status.name().toLowerCase(Locale.ROOT), e.getReason());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
