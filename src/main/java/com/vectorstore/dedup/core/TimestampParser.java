package com.vectorstore.dedup.core;

import com.vectorstore.dedup.core.model.AttributeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses calendar timestamps found in record attributes.
 *
 * <p>Accepted string forms, tried in order: ISO-8601 instant, ISO offset date-time,
 * RFC 1123, ISO local date-time and ISO local date. Local forms are read as UTC.
 * Numbers are epoch milliseconds.</p>
 */
public final class TimestampParser {
    private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private TimestampParser() {
    }

    /**
     * Parses a timestamp string.
     *
     * @return the instant, or empty if no supported format matches
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return Optional.of(parser.apply(trimmed));
            } catch (DateTimeParseException e) {
                log.trace("timestamp.format.mismatch value='{}' error={}", trimmed, e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a string or numeric attribute value. Other kinds never parse.
     */
    public static Optional<Instant> parse(AttributeValue value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.kind()) {
            case STRING:
                return parse(value.asString());
            case NUMBER:
                return Optional.of(Instant.ofEpochMilli((long) value.asNumber()));
            default:
                return Optional.empty();
        }
    }
}
