package com.safety.aralia.engine;

import com.safety.aralia.api.ConversionWarning;
import com.safety.aralia.api.Event;
import com.safety.aralia.api.EventKind;
import com.safety.aralia.exception.FaultTreeException;
import com.safety.aralia.grammar.Formula;
import com.safety.aralia.grammar.NameValidator;
import com.safety.aralia.node.Argument;
import com.safety.aralia.node.BasicEvent;
import com.safety.aralia.node.Gate;
import com.safety.aralia.node.HouseEvent;
import com.safety.aralia.node.UndefinedEvent;

import java.util.*;

/**
 * Symbol table and arena of every event of one fault tree.
 *
 * <p>
 * Events are addressed by integer handles in creation order. Gates, basic
 * events and house events share one namespace; undefined events are minted
 * into their own table when a reference cannot be resolved.
 *
 * <h3>Two passes</h3>
 * <ol>
 * <li><b>Declare:</b> {@link #declareGate}, {@link #declareBasicEvent} and
 * {@link #declareHouseEvent} record declarations in input order. A gate keeps
 * only its raw argument tokens at this point, so references may point
 * forward.</li>
 * <li><b>Populate:</b> {@link #populate()} resolves every token into a tagged
 * {@link Argument} and records the parent relation as handle sets.</li>
 * </ol>
 *
 * <p>
 * Every table is insertion ordered, so iteration is reproducible for identical
 * input. Not thread-safe.
 */
public final class EventTable {
    // handle -> event
    private final List<Event> events = new ArrayList<>();

    // handle -> handles of the gates referencing it
    private final List<Set<Integer>> parents = new ArrayList<>();

    private final Map<String, Integer> gates = new LinkedHashMap<>();
    private final Map<String, Integer> basicEvents = new LinkedHashMap<>();
    private final Map<String, Integer> houseEvents = new LinkedHashMap<>();
    private final Map<String, Integer> undefinedEvents = new LinkedHashMap<>();

    private boolean populated;

    // ── Pass 1: declarations ─────────────────────────────────────

    /**
     * Declares a gate with its unresolved argument tokens.
     *
     * @return The handle of the new gate.
     * @throws FaultTreeException if the name is already declared.
     */
    public int declareGate(String name, Formula formula) {
        return register(new Gate(name, formula), gates);
    }

    /**
     * Declares a basic event.
     *
     * @return The handle of the new event.
     * @throws FaultTreeException if the name is already declared.
     */
    public int declareBasicEvent(String name, String probability) {
        return register(new BasicEvent(name, probability), basicEvents);
    }

    /**
     * Declares a house event.
     *
     * @return The handle of the new event.
     * @throws FaultTreeException if the name is already declared.
     */
    public int declareHouseEvent(String name, boolean state) {
        return register(new HouseEvent(name, state), houseEvents);
    }

    private int register(Event event, Map<String, Integer> table) {
        checkNotPopulated();
        checkRedefinition(event.name());
        int handle = events.size();
        events.add(event);
        parents.add(new LinkedHashSet<>());
        table.put(event.name(), handle);
        return handle;
    }

    private void checkRedefinition(String name) {
        if (gates.containsKey(name) || basicEvents.containsKey(name) || houseEvents.containsKey(name))
            throw new FaultTreeException("Redefinition of an event: " + name);
    }

    private void checkNotPopulated() {
        if (populated)
            throw new IllegalStateException("Event table is already populated");
    }

    // ── Pass 2: resolution ───────────────────────────────────────

    /**
     * Resolves the raw argument tokens of every gate and attaches them.
     *
     * <p>
     * Names are looked up in the gate, basic event, house event and undefined
     * event tables, in that order. A name found nowhere becomes a new
     * {@link UndefinedEvent}. Afterwards every basic or house event without a
     * parent is reported as an orphan.
     *
     * @return Warnings for undefined references and orphan events, in the order
     *         they were found.
     */
    public List<ConversionWarning> populate() {
        checkNotPopulated();
        populated = true;
        List<ConversionWarning> warnings = new ArrayList<>();

        for (int gateHandle : new ArrayList<>(gates.values())) {
            Gate gate = (Gate) events.get(gateHandle);
            for (String token : gate.rawArguments()) {
                boolean complement = NameValidator.isComplement(token);
                String name = NameValidator.bareName(token);
                int handle = resolve(name, warnings);
                Event target = events.get(handle);
                gate.attach(new Argument(handle, name, target.kind(), complement));
                parents.get(handle).add(gateHandle);
            }
        }

        for (int handle : basicEvents.values())
            if (isOrphan(handle))
                warnings.add(ConversionWarning.orphanBasicEvent(events.get(handle).name()));
        for (int handle : houseEvents.values())
            if (isOrphan(handle))
                warnings.add(ConversionWarning.orphanHouseEvent(events.get(handle).name()));
        return warnings;
    }

    private int resolve(String name, List<ConversionWarning> warnings) {
        Integer handle = gates.get(name);
        if (handle == null)
            handle = basicEvents.get(name);
        if (handle == null)
            handle = houseEvents.get(name);
        if (handle == null)
            handle = undefinedEvents.get(name);
        if (handle != null)
            return handle;

        warnings.add(ConversionWarning.undefinedEvent(name));
        int minted = events.size();
        events.add(new UndefinedEvent(name));
        parents.add(new LinkedHashSet<>());
        undefinedEvents.put(name, minted);
        return minted;
    }

    // ── Lookup ───────────────────────────────────────────────────

    public boolean isPopulated() {
        return populated;
    }

    /** Number of handles in the arena. */
    public int size() {
        return events.size();
    }

    public Event event(int handle) {
        return events.get(handle);
    }

    /**
     * Returns the gate stored under a handle.
     *
     * @throws IllegalArgumentException if the handle is not a gate.
     */
    public Gate gate(int handle) {
        if (!(events.get(handle) instanceof Gate g))
            throw new IllegalArgumentException("Not a gate: " + events.get(handle).name());
        return g;
    }

    /** Resolves a declared or minted name to its handle, or -1. */
    public int handleOf(String name) {
        for (Map<String, Integer> table : List.of(gates, basicEvents, houseEvents, undefinedEvents)) {
            Integer handle = table.get(name);
            if (handle != null)
                return handle;
        }
        return -1;
    }

    public boolean contains(String name) {
        return handleOf(name) >= 0;
    }

    /** Handles of the gates referencing the event, in first-reference order. */
    public Set<Integer> parents(int handle) {
        return Collections.unmodifiableSet(parents.get(handle));
    }

    public int parentCount(int handle) {
        return parents.get(handle).size();
    }

    public boolean isOrphan(int handle) {
        return parents.get(handle).isEmpty();
    }

    /** Handles of the distinct gate arguments of a gate, in declared order. */
    public int[] childGates(int gateHandle) {
        Set<Integer> children = new LinkedHashSet<>();
        for (Argument a : gate(gateHandle).arguments())
            if (a.isGate())
                children.add(a.handle());
        return children.stream().mapToInt(Integer::intValue).toArray();
    }

    public int gateCount() {
        return gates.size();
    }

    /** Gate handles in declaration order. */
    public List<Integer> gateHandles() {
        return List.copyOf(gates.values());
    }

    public List<Gate> gates() {
        return collect(gates, Gate.class);
    }

    public List<BasicEvent> basicEvents() {
        return collect(basicEvents, BasicEvent.class);
    }

    public List<HouseEvent> houseEvents() {
        return collect(houseEvents, HouseEvent.class);
    }

    /** Undefined events in the order they were first referenced. */
    public List<UndefinedEvent> undefinedEvents() {
        return collect(undefinedEvents, UndefinedEvent.class);
    }

    /** Kind of the event declared or minted under the given name, or null. */
    public EventKind kindOf(String name) {
        int handle = handleOf(name);
        return handle < 0 ? null : events.get(handle).kind();
    }

    private <T extends Event> List<T> collect(Map<String, Integer> table, Class<T> type) {
        List<T> result = new ArrayList<>(table.size());
        for (int handle : table.values())
            result.add(type.cast(events.get(handle)));
        return Collections.unmodifiableList(result);
    }
}
