package com.safety.aralia.io;

import com.safety.aralia.ConverterConfig;
import com.safety.aralia.api.ConversionListener;
import com.safety.aralia.api.ConversionWarning;
import com.safety.aralia.api.Operator;
import com.safety.aralia.engine.CycleDetector;
import com.safety.aralia.engine.EventTable;
import com.safety.aralia.engine.FaultTree;
import com.safety.aralia.engine.TopGateSelector;
import com.safety.aralia.engine.TopologicalOrder;
import com.safety.aralia.exception.FaultTreeException;
import com.safety.aralia.node.Argument;
import com.safety.aralia.node.Gate;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles parsed {@link Declarations} into a verified {@link FaultTree}.
 *
 * <p>
 * The phases run in order and each completes before the next starts:
 * <ol>
 * <li>populate: resolve argument names, mint undefined events, find orphans;</li>
 * <li>select the top gate(s);</li>
 * <li>verify the gate graph is acyclic;</li>
 * <li>sort the gates for serialization.</li>
 * </ol>
 * Any phase may abort with a {@link FaultTreeException}; nothing is returned
 * then.
 */
public final class FaultTreeCompiler {
    private final ConverterConfig config;

    public FaultTreeCompiler(ConverterConfig config) {
        this.config = config;
    }

    /**
     * Compiles the declarations.
     *
     * @param declarations The output of {@link AraliaParser}.
     * @return The verified fault tree.
     * @throws FaultTreeException on missing or multiple top gates and on cycles.
     */
    public FaultTree compile(Declarations declarations) {
        ConversionListener listener = config.getListener();
        EventTable events = declarations.events();
        listener.onDeclarationsRead(declarations.treeName(), declarations.lineCount());

        // 1. Resolve references
        List<ConversionWarning> warnings = new ArrayList<>(events.populate());
        warnings.forEach(listener::onWarning);

        // 2. Roots
        List<Integer> tops = TopGateSelector.select(events, config.isMultiTop());
        List<Gate> topGates = new ArrayList<>(tops.size());
        for (int handle : tops)
            topGates.add(events.gate(handle));
        listener.onTopGatesDetected(topGates.stream().map(Gate::name).toList());

        // 3. Cycles; the sort below relies on this.
        CycleDetector.verify(events, tops);

        // 4. Serialization order
        TopologicalOrder order = TopologicalOrder.of(events, tops);
        if (order.nodeCount() != events.gateCount())
            throw new IllegalStateException(
                    "Sorted " + order.nodeCount() + " gates out of " + events.gateCount());

        for (Gate gate : events.gates()) {
            if (isReorderedImply(gate)) {
                ConversionWarning warning = ConversionWarning.implyOrder(gate.name());
                warnings.add(warning);
                listener.onWarning(warning);
            }
        }

        FaultTree tree = new FaultTree(declarations.treeName(), events, topGates, config.isMultiTop(), order,
                warnings);
        listener.onConversionEnd(tree.name(), order.nodeCount());
        return tree;
    }

    /** True if grouping by kind on output swaps antecedent and consequent. */
    static boolean isReorderedImply(Gate gate) {
        if (gate.operator() != Operator.IMPLY)
            return false;
        List<Argument> declared = gate.arguments();
        List<Argument> written = gate.groupedArguments();
        return !declared.equals(written);
    }
}
