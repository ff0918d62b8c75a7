package com.safety.aralia.node;

import com.safety.aralia.api.Event;
import com.safety.aralia.api.EventKind;

/**
 * Leaf event with a failure probability.
 *
 * The probability is kept as the literal text of the declaration ({@code 0},
 * {@code 1} or {@code 0.<digits>}) so that it is written back unchanged.
 */
public final class BasicEvent implements Event {
    private final String name;
    private final String probability;

    public BasicEvent(String name, String probability) {
        this.name = name;
        this.probability = probability;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EventKind kind() {
        return EventKind.BASIC_EVENT;
    }

    /** The probability literal as declared. */
    public String probability() {
        return probability;
    }

    public double probabilityValue() {
        return Double.parseDouble(probability);
    }

    @Override
    public String toString() {
        return "BasicEvent[" + name + "=" + probability + "]";
    }
}
