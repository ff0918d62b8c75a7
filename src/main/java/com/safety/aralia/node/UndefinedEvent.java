package com.safety.aralia.node;

import com.safety.aralia.api.Event;
import com.safety.aralia.api.EventKind;

/**
 * Placeholder for a name that gates reference but nothing declares.
 * One instance exists per name; later references reuse it.
 */
public final class UndefinedEvent implements Event {
    private final String name;

    public UndefinedEvent(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EventKind kind() {
        return EventKind.UNDEFINED_EVENT;
    }

    @Override
    public String toString() {
        return "UndefinedEvent[" + name + "]";
    }
}
