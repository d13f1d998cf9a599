package io.ezvis.proxylog.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Half-open UTC window {@code [start, end)} on the request timestamp. Either bound may be absent.
 */
public record TimeRange(Optional<OffsetDateTime> start, Optional<OffsetDateTime> end) {

    public static final TimeRange ALL = new TimeRange(Optional.empty(), Optional.empty());

    private static final DateTimeFormatter BOUND_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    public TimeRange {
        start = start.map(value -> value.withOffsetSameInstant(ZoneOffset.UTC));
        end = end.map(value -> value.withOffsetSameInstant(ZoneOffset.UTC));
        if (start.isPresent() && end.isPresent() && start.get().isAfter(end.get())) {
            throw new InvalidTimeRangeException("start " + start.get() + " is after end " + end.get());
        }
    }

    public static TimeRange of(OffsetDateTime start, OffsetDateTime end) {
        return new TimeRange(Optional.ofNullable(start), Optional.ofNullable(end));
    }

    /**
     * Parses ISO-8601 bounds: offset date-time, local date-time (taken as UTC) or a date (start of day UTC).
     * Blank or null values leave the bound open.
     */
    public static TimeRange parse(String start, String end) {
        return new TimeRange(parseBound("start", start), parseBound("end", end));
    }

    private static Optional<OffsetDateTime> parseBound(String name, String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        TemporalAccessor parsed;
        try {
            parsed = BOUND_FORMAT.parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw new InvalidTimeRangeException("Malformed " + name + " bound '" + value + "', expected ISO-8601");
        }
        if (parsed instanceof OffsetDateTime offset) {
            return Optional.of(offset);
        }
        if (parsed instanceof LocalDateTime local) {
            return Optional.of(local.atOffset(ZoneOffset.UTC));
        }
        return Optional.of(((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC));
    }
}
