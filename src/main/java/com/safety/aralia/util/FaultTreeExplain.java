package com.safety.aralia.util;

import com.safety.aralia.engine.FaultTree;
import com.safety.aralia.engine.TopologicalOrder;
import com.safety.aralia.node.Argument;
import com.safety.aralia.node.Gate;

/**
 * Diagnostic utility for inspecting a compiled fault tree.
 *
 * <p>
 * Generates human-readable representations of the gate topology and a
 * Mermaid diagram of the whole tree. Intended for debugging and for the
 * {@code --mermaid} export of the command line.
 */
public final class FaultTreeExplain {
    private final FaultTree tree;
    private final TopologicalOrder topology;

    public FaultTreeExplain(FaultTree tree) {
        this.tree = tree;
        this.topology = tree.topologicalOrder();
    }

    /**
     * Dumps a single gate: its position, operator and arguments.
     */
    public String explainGate(String gateName) {
        int idx = topology.topoIndex(gateName);
        Gate gate = topology.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Gate: ").append(gateName).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Operator: ").append(gate.operator()).append('\n')
                .append("  Is top: ").append(topology.isTop(idx)).append('\n')
                .append("  Parents: ").append(topology.parentCount(idx)).append('\n');
        if (gate.minNumber() != null)
            sb.append("  Min: ").append(gate.minNumber()).append('\n');
        if (gate.maxNumber() != null)
            sb.append("  Max: ").append(gate.maxNumber()).append('\n');
        sb.append("  Arguments (").append(gate.argumentCount()).append("): ");
        var args = gate.arguments();
        for (int i = 0; i < args.size(); i++) {
            sb.append(args.get(i).token()).append(" [").append(args.get(i).kind().referenceElement()).append(']');
            if (i < args.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the gate topology, one gate per line in serialization order.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Fault tree ").append(tree.name()).append(" (").append(topology.nodeCount()).append(" gates):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            sb.append("  [").append(i).append("] ").append(topology.node(i).name());
            if (topology.isTop(i))
                sb.append(" (TOP)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)).name());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Gates are boxes labelled with their operator, events are rounded nodes.
     * Complemented references are drawn as edges labelled {@code not}. Node ids
     * are built from arena handles; the event name only appears in the label.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Nodes
        for (Gate gate : tree.gates()) {
            String label = gate.operator().element();
            if (gate.minNumber() != null)
                label += gate.maxNumber() != null
                        ? " " + gate.minNumber() + ".." + gate.maxNumber()
                        : " " + gate.minNumber();
            sb.append("  ").append(id(gate.name())).append("[\"").append(gate.name())
                    .append("<br/>").append(label).append("\"];\n");
        }
        tree.basicEvents().forEach(e -> sb.append("  ").append(id(e.name())).append("((\"")
                .append(e.name()).append("<br/>p=").append(e.probability()).append("\"));\n"));
        tree.houseEvents().forEach(e -> sb.append("  ").append(id(e.name())).append("((\"")
                .append(e.name()).append("<br/>").append(e.state()).append("\"));\n"));
        tree.undefinedEvents().forEach(e -> sb.append("  ").append(id(e.name())).append("((\"")
                .append(e.name()).append("<br/>?\"));\n"));

        // 2. Edges
        for (Gate gate : tree.gates()) {
            String gateId = id(gate.name());
            for (Argument arg : gate.arguments()) {
                if (arg.complement()) {
                    sb.append("  ").append(gateId).append(" -. \"not\" .-> ").append(id(arg.handle()))
                            .append(";\n");
                } else {
                    sb.append("  ").append(gateId).append(" --> ").append(id(arg.handle())).append(";\n");
                }
            }
        }
        return sb.toString();
    }

    private String id(String name) {
        return id(tree.events().handleOf(name));
    }

    private static String id(int handle) {
        return "n" + handle;
    }
}
