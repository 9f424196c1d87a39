package com.protocolguide.application.ports;

/**
 * The ledger already holds this event id. Not an error for callers: the event was processed.
 */
public class DuplicateEventException extends RuntimeException {

    private final String eventId;

    public DuplicateEventException(String eventId, Throwable cause) {
        super("Billing event already recorded: " + eventId, cause);
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }
}
