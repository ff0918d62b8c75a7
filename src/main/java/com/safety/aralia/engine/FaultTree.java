package com.safety.aralia.engine;

import com.safety.aralia.api.ConversionWarning;
import com.safety.aralia.api.Event;
import com.safety.aralia.node.BasicEvent;
import com.safety.aralia.node.Gate;
import com.safety.aralia.node.HouseEvent;
import com.safety.aralia.node.UndefinedEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * A fully built, verified fault tree.
 *
 * The FaultTree is the result of a successful conversion. It bridges the
 * handle-based {@link EventTable} arena and the name-based view the writers and
 * callers need.
 *
 * Guarantees:
 * 1. Every gate argument is resolved; undeclared names are undefined events.
 * 2. There is one top gate, or at least one in multi-top mode.
 * 3. The gate graph is acyclic and {@link #topologicalOrder()} covers every
 * gate exactly once.
 *
 * The FaultTree is not modified after construction.
 */
public final class FaultTree {
    private final String name;
    private final EventTable events;
    private final List<Gate> topGates;
    private final boolean multiTop;
    private final TopologicalOrder order;
    private final List<ConversionWarning> warnings;

    public FaultTree(String name, EventTable events, List<Gate> topGates, boolean multiTop,
            TopologicalOrder order, List<ConversionWarning> warnings) {
        this.name = name;
        this.events = events;
        this.topGates = List.copyOf(topGates);
        this.multiTop = multiTop;
        this.order = order;
        this.warnings = List.copyOf(warnings);
    }

    public String name() {
        return name;
    }

    public EventTable events() {
        return events;
    }

    /** Declared gates in declaration order. */
    public List<Gate> gates() {
        return events.gates();
    }

    /** Gates in serialization order: every gate after its gate arguments. */
    public List<Gate> sortedGates() {
        return order.gates();
    }

    public TopologicalOrder topologicalOrder() {
        return order;
    }

    public List<BasicEvent> basicEvents() {
        return events.basicEvents();
    }

    public List<HouseEvent> houseEvents() {
        return events.houseEvents();
    }

    public List<UndefinedEvent> undefinedEvents() {
        return events.undefinedEvents();
    }

    public List<Gate> topGates() {
        return topGates;
    }

    /**
     * Returns the single top gate.
     *
     * @throws IllegalStateException if the tree has several top gates.
     */
    public Gate topGate() {
        if (topGates.size() != 1)
            throw new IllegalStateException("Fault tree " + name + " has " + topGates.size() + " top gates");
        return topGates.get(0);
    }

    public boolean isMultiTop() {
        return multiTop;
    }

    /** Non-fatal findings in the order they were reported. */
    public List<ConversionWarning> warnings() {
        return warnings;
    }

    /**
     * Looks up any event by name.
     *
     * @return The event, or null if the name is unknown.
     */
    public Event event(String name) {
        int handle = events.handleOf(name);
        return handle < 0 ? null : events.event(handle);
    }

    /**
     * Type-safe lookup of a gate by name.
     *
     * @return The gate, or null if no gate has this name.
     */
    public Gate gate(String name) {
        return event(name) instanceof Gate g ? g : null;
    }

    /** Names of the gates referencing the named event, in first-reference order. */
    public List<String> parentsOf(String name) {
        int handle = events.handleOf(name);
        if (handle < 0)
            throw new IllegalArgumentException("Unknown event: " + name);
        List<String> result = new ArrayList<>();
        for (int parent : events.parents(handle))
            result.add(events.event(parent).name());
        return result;
    }
}
