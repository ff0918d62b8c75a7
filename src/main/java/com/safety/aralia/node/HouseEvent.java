package com.safety.aralia.node;

import com.safety.aralia.api.Event;
import com.safety.aralia.api.EventKind;

/**
 * Leaf event with a fixed Boolean state.
 */
public final class HouseEvent implements Event {
    private final String name;
    private final boolean state;

    public HouseEvent(String name, boolean state) {
        this.name = name;
        this.state = state;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EventKind kind() {
        return EventKind.HOUSE_EVENT;
    }

    public boolean state() {
        return state;
    }

    @Override
    public String toString() {
        return "HouseEvent[" + name + "=" + state + "]";
    }
}
