package com.safety.aralia.api;

/**
 * A named node of the fault tree.
 *
 * Every declared gate, basic event, house event and every placeholder minted
 * for an undeclared reference implements this interface. Names are unique
 * across the whole namespace and case-sensitive.
 *
 * Events never hold references to their parents or to traversal state. Parent
 * membership lives in the {@link com.safety.aralia.engine.EventTable} arena and
 * traversal marks live in the algorithm that owns them.
 */
public interface Event {

    /**
     * Returns the declared (or referenced) identifier of this event.
     *
     * @return The unique name.
     */
    String name();

    /**
     * Returns the kind tag used for argument grouping and XML element names.
     *
     * @return The event kind.
     */
    EventKind kind();
}
