package com.safety.aralia.grammar;

import java.util.List;

import com.safety.aralia.api.Operator;

/**
 * Result of recognizing the right-hand side of a gate declaration.
 *
 * @param operator  The recognized gate operator.
 * @param arguments Argument tokens in declared order, each possibly prefixed
 *                  with the complement marker.
 * @param minNumber k of an ATLEAST gate or l of a CARDINALITY gate, else null.
 * @param maxNumber h of a CARDINALITY gate, else null.
 */
public record Formula(Operator operator, List<String> arguments, Integer minNumber, Integer maxNumber) {

    public Formula {
        arguments = List.copyOf(arguments);
    }

    public Formula(Operator operator, List<String> arguments) {
        this(operator, arguments, null, null);
    }
}
