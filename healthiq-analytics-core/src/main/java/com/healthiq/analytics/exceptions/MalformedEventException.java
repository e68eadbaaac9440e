package com.healthiq.analytics.exceptions;

/**
 * Thrown when an event cannot be analyzed: missing identity or timestamp, an unparseable
 * timestamp, or a structurally invalid payload. Malformed events are never skipped because a
 * silently dropped event would distort every windowed statistic.
 */
public class MalformedEventException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String eventId;

    public MalformedEventException(String eventId, String reason) {
        super(buildMessage(eventId, reason));
        this.eventId = eventId;
    }

    public MalformedEventException(String eventId, String reason, Throwable cause) {
        super(buildMessage(eventId, reason), cause);
        this.eventId = eventId;
    }

    private static String buildMessage(String eventId, String reason) {
        return eventId == null
                ? String.format("Malformed health event: %s", reason)
                : String.format("Malformed health event '%s': %s", eventId, reason);
    }

    /**
     * @return id of the offending event, or null when the event carried none
     */
    public String getEventId() {
        return eventId;
    }
}
