package com.vectorpipeline.ingest;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.List;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coerces timestamp-like values into epoch seconds. Unparseable input yields an empty result.
 */
public class TimestampParser {
    private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);
    // first match wins
    private static final List<DateTimeFormatter> FORMATS = List.of(
            formatter("d/M/uuuu H:m"),
            formatter("uuuu-M-d H:m:s"),
            formatter("uuuu-M-d'T'H:m:s"));

    private final ZoneId zone;

    public TimestampParser() {
        this(ZoneOffset.UTC);
    }

    public TimestampParser(ZoneId zone) {
        this.zone = zone;
    }

    public OptionalLong parse(Object value) {
        if (value == null) {
            return OptionalLong.empty();
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(number.longValue());
        }
        if (value instanceof Instant instant) {
            return OptionalLong.of(instant.getEpochSecond());
        }
        if (value instanceof ZonedDateTime zoned) {
            return OptionalLong.of(zoned.toEpochSecond());
        }
        if (value instanceof OffsetDateTime offset) {
            return OptionalLong.of(offset.toEpochSecond());
        }
        if (value instanceof LocalDateTime local) {
            return OptionalLong.of(local.atZone(zone).toEpochSecond());
        }
        if (value instanceof LocalDate date) {
            return OptionalLong.of(date.atStartOfDay(zone).toEpochSecond());
        }
        if (value instanceof Date date) {
            return OptionalLong.of(date.getTime() / 1000L);
        }
        String text = value.toString();
        if (text.isEmpty()) {
            return OptionalLong.empty();
        }
        for (DateTimeFormatter format : FORMATS) {
            try {
                return OptionalLong.of(LocalDateTime.parse(text, format).atZone(zone).toEpochSecond());
            } catch (DateTimeParseException e) {
                log.trace("Timestamp '{}' did not match {}", text, format);
            }
        }
        return OptionalLong.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
