package com.safety.aralia.node;

import com.safety.aralia.api.EventKind;

/**
 * A resolved gate argument: a handle into the event arena tagged with the
 * event kind and the complement flag of this particular reference.
 *
 * @param handle     Arena handle of the referenced event.
 * @param name       Name of the referenced event.
 * @param kind       Kind of the referenced event.
 * @param complement True if the reference is negated ({@code ~name}).
 */
public record Argument(int handle, String name, EventKind kind, boolean complement) {

    public boolean isGate() {
        return kind == EventKind.GATE;
    }

    /** The argument as it would be written in the notation. */
    public String token() {
        return complement ? "~" + name : name;
    }
}
