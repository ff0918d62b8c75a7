package com.safety.aralia.node;

import com.safety.aralia.api.Event;
import com.safety.aralia.api.EventKind;
import com.safety.aralia.api.Operator;
import com.safety.aralia.grammar.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A gate: one operator applied to its arguments.
 *
 * A gate is created from its declaration with the raw argument tokens only.
 * Resolved {@link Argument}s are attached once, during the populate pass of
 * {@link com.safety.aralia.engine.EventTable}. Both lists keep the declared
 * order; kind-partitioned views are derived on demand.
 */
public final class Gate implements Event {
    private final String name;
    private final Operator operator;
    private final Integer minNumber;
    private final Integer maxNumber;
    private final List<String> rawArguments;
    private final List<Argument> arguments = new ArrayList<>();

    public Gate(String name, Formula formula) {
        this(name, formula.operator(), formula.arguments(), formula.minNumber(), formula.maxNumber());
    }

    public Gate(String name, Operator operator, List<String> rawArguments, Integer minNumber, Integer maxNumber) {
        if (rawArguments.isEmpty())
            throw new IllegalArgumentException("Gate without arguments: " + name);
        this.name = name;
        this.operator = operator;
        this.rawArguments = List.copyOf(rawArguments);
        this.minNumber = minNumber;
        this.maxNumber = maxNumber;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EventKind kind() {
        return EventKind.GATE;
    }

    public Operator operator() {
        return operator;
    }

    /** k of an ATLEAST gate, l of a CARDINALITY gate, null otherwise. */
    public Integer minNumber() {
        return minNumber;
    }

    /** h of a CARDINALITY gate, null otherwise. */
    public Integer maxNumber() {
        return maxNumber;
    }

    /** Argument tokens as declared, complement markers included. */
    public List<String> rawArguments() {
        return rawArguments;
    }

    /** Resolved arguments in declared order. Empty before population. */
    public List<Argument> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    /** Resolved arguments of one kind, in declared order. */
    public List<Argument> arguments(EventKind kind) {
        List<Argument> result = new ArrayList<>();
        for (Argument a : arguments)
            if (a.kind() == kind)
                result.add(a);
        return result;
    }

    /** Resolved arguments in output order: grouped by {@link EventKind#EMISSION_ORDER}. */
    public List<Argument> groupedArguments() {
        List<Argument> result = new ArrayList<>(arguments.size());
        for (EventKind kind : EventKind.EMISSION_ORDER)
            result.addAll(arguments(kind));
        return result;
    }

    /** Resolved arguments that are negated at this reference. */
    public List<Argument> complementArguments() {
        List<Argument> result = new ArrayList<>();
        for (Argument a : arguments)
            if (a.complement())
                result.add(a);
        return result;
    }

    public int argumentCount() {
        return rawArguments.size();
    }

    public boolean isPopulated() {
        return arguments.size() == rawArguments.size();
    }

    /**
     * Attaches a resolved argument.
     *
     * @throws IllegalStateException if the same reference is already attached
     *                               or all declared arguments are resolved.
     */
    public void attach(Argument argument) {
        if (arguments.contains(argument))
            throw new IllegalStateException("Argument " + argument.token() + " attached twice to gate " + name);
        if (isPopulated())
            throw new IllegalStateException("Gate " + name + " is already populated");
        arguments.add(argument);
    }

    @Override
    public String toString() {
        return "Gate[" + name + " " + operator + " " + rawArguments + "]";
    }
}
