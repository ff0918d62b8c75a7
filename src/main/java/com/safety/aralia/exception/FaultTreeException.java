package com.safety.aralia.exception;

import java.util.List;

/**
 * Thrown when the described fault tree is structurally invalid.
 * <p>
 * Covers redefined names, repeated arguments in one formula, out-of-range
 * vote or cardinality bounds, a missing or ambiguous top gate, and cycles.
 * For cycles the offending path is kept in {@link #cycle()}, top-down and
 * starting at the repeated gate.
 * </p>
 */
public class FaultTreeException extends ConversionException {

    private final List<String> cycle;

    public FaultTreeException(String detail) {
        this(detail, List.of());
    }

    public FaultTreeException(String detail, List<String> cycle) {
        super(detail);
        this.cycle = List.copyOf(cycle);
    }

    private FaultTreeException(String detail, List<String> cycle, int lineNumber, String line) {
        super(detail, lineNumber, line);
        this.cycle = cycle;
    }

    /** Gate names along the detected cycle, or an empty list. */
    public List<String> cycle() {
        return cycle;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STRUCTURAL;
    }

    @Override
    public FaultTreeException atLine(int lineNumber, String line) {
        return new FaultTreeException(detail(), cycle, lineNumber, line);
    }
}
