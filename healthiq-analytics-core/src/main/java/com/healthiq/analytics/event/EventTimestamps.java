package com.healthiq.analytics.event;

import com.healthiq.analytics.exceptions.MalformedEventException;
import com.healthiq.model.event.HealthEvent;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;

/**
 * Parses the absolute part of event timestamps. Accepts ISO-8601 dates, local date-times (read as
 * UTC) and offset date-times. Anything else fails with {@link MalformedEventException}.
 */
public final class EventTimestamps {

    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private EventTimestamps() {}

    public static Instant parse(String eventId, String absolute) {
        if (absolute == null || absolute.isBlank()) {
            throw new MalformedEventException(eventId, "missing absolute timestamp");
        }
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(absolute.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            if (parsed instanceof LocalDateTime local) {
                return local.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedEventException(eventId, "unparseable timestamp '" + absolute + "'", e);
        }
    }

    public static Instant parse(HealthEvent event) {
        if (event == null) {
            throw new MalformedEventException(null, "event is null");
        }
        if (event.getTimestamp() == null) {
            throw new MalformedEventException(event.getId(), "missing timestamp");
        }
        return parse(event.getId(), event.getTimestamp().getAbsolute());
    }

    public static <E extends HealthEvent> TimedEvent<E> timed(E event) {
        return new TimedEvent<>(event, parse(event));
    }
}
