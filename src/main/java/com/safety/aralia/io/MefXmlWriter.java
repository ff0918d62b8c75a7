package com.safety.aralia.io;

import com.safety.aralia.api.Operator;
import com.safety.aralia.engine.EventTable;
import com.safety.aralia.engine.FaultTree;
import com.safety.aralia.node.Argument;
import com.safety.aralia.node.BasicEvent;
import com.safety.aralia.node.Gate;
import com.safety.aralia.node.HouseEvent;

/**
 * Renders a {@link FaultTree} as an Open-PSA MEF XML document.
 *
 * <p>
 * The output puts one element per line without indentation. Gates are written
 * in topological order, then the model data: basic events and house events in
 * declaration order. Undefined events are only referenced, never defined.
 *
 * <p>
 * With a nesting depth above zero the formula of a gate argument is inlined in
 * place of its {@code <gate name=.../>} reference, recursively up to the given
 * depth. Shared sub-gates are inlined once per reference.
 */
public final class MefXmlWriter {
    public static final String XML_DECLARATION = "<?xml version=\"1.0\"?>";

    private final int nestingDepth;

    public MefXmlWriter() {
        this(0);
    }

    /**
     * @param nestingDepth Levels of gate formulas to inline.
     * @throws IllegalArgumentException if the depth is negative.
     */
    public MefXmlWriter(int nestingDepth) {
        if (nestingDepth < 0)
            throw new IllegalArgumentException("Nesting depth must be non-negative: " + nestingDepth);
        this.nestingDepth = nestingDepth;
    }

    public String write(FaultTree tree) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append(XML_DECLARATION).append('\n');
        sb.append("<opsa-mef>\n");
        sb.append("<define-fault-tree name=\"").append(tree.name()).append("\">\n");
        for (Gate gate : tree.sortedGates())
            writeGate(sb, tree.events(), gate);
        sb.append("</define-fault-tree>\n");

        sb.append("<model-data>\n");
        for (BasicEvent event : tree.basicEvents())
            writeBasicEvent(sb, event);
        for (HouseEvent event : tree.houseEvents())
            writeHouseEvent(sb, event);
        sb.append("</model-data>\n");
        sb.append("</opsa-mef>\n");
        return sb.toString();
    }

    /** Renders one {@code define-gate} element. */
    public String writeGate(EventTable events, Gate gate) {
        StringBuilder sb = new StringBuilder(256);
        writeGate(sb, events, gate);
        return sb.toString();
    }

    private void writeGate(StringBuilder sb, EventTable events, Gate gate) {
        sb.append("<define-gate name=\"").append(gate.name()).append("\">\n");
        writeFormula(sb, events, gate, nestingDepth);
        sb.append("</define-gate>\n");
    }

    private static void writeFormula(StringBuilder sb, EventTable events, Gate gate, int nest) {
        Operator operator = gate.operator();
        if (!operator.isPassThrough()) {
            sb.append('<').append(operator.element());
            if (operator == Operator.ATLEAST) {
                sb.append(" min=\"").append(gate.minNumber()).append('"');
            } else if (operator == Operator.CARDINALITY) {
                sb.append(" min=\"").append(gate.minNumber()).append('"')
                        .append(" max=\"").append(gate.maxNumber()).append('"');
            }
            sb.append(">\n");
        }

        for (Argument arg : gate.groupedArguments()) {
            if (arg.complement())
                sb.append("<not>\n");
            if (arg.isGate() && nest > 0) {
                writeFormula(sb, events, events.gate(arg.handle()), nest - 1);
            } else {
                sb.append('<').append(arg.kind().referenceElement())
                        .append(" name=\"").append(arg.name()).append("\"/>\n");
            }
            if (arg.complement())
                sb.append("</not>\n");
        }

        if (!operator.isPassThrough())
            sb.append("</").append(operator.element()).append(">\n");
    }

    private static void writeBasicEvent(StringBuilder sb, BasicEvent event) {
        sb.append("<define-basic-event name=\"").append(event.name()).append("\">\n")
                .append("<float value=\"").append(event.probability()).append("\"/>\n")
                .append("</define-basic-event>\n");
    }

    private static void writeHouseEvent(StringBuilder sb, HouseEvent event) {
        sb.append("<define-house-event name=\"").append(event.name()).append("\">\n")
                .append("<constant value=\"").append(event.state()).append("\"/>\n")
                .append("</define-house-event>\n");
    }
}
