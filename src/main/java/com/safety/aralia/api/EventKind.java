package com.safety.aralia.api;

import java.util.List;

/**
 * Kind tag carried by every event and by every argument reference.
 */
public enum EventKind {
    GATE("gate"),
    BASIC_EVENT("basic-event"),
    HOUSE_EVENT("house-event"),
    UNDEFINED_EVENT("event");

    /** Order in which argument groups are written inside one formula. */
    public static final List<EventKind> EMISSION_ORDER = List.of(HOUSE_EVENT, BASIC_EVENT, UNDEFINED_EVENT, GATE);

    private final String referenceElement;

    EventKind(String referenceElement) {
        this.referenceElement = referenceElement;
    }

    /** Element name used when the event is referenced from a formula. */
    public String referenceElement() {
        return referenceElement;
    }
}
