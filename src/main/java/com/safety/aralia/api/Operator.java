package com.safety.aralia.api;

/**
 * Boolean or voting operator of a gate formula.
 */
public enum Operator {
    AND("and"),
    OR("or"),
    XOR("xor"),
    NOT("not"),
    NULL("null"),
    IMPLY("imply"),
    IFF("iff"),
    ATLEAST("atleast"),
    CARDINALITY("cardinality");

    private final String element;

    Operator(String element) {
        this.element = element;
    }

    /** Open-PSA MEF element name of the operator. */
    public String element() {
        return element;
    }

    /** NULL gates emit their single argument in place, without a wrapper. */
    public boolean isPassThrough() {
        return this == NULL;
    }
}
