package com.safety.aralia.engine;

import com.safety.aralia.exception.FaultTreeException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Verifies that the gate graph of a populated {@link EventTable} is acyclic.
 *
 * <p>
 * Nodes are gates and edges are gate arguments that are themselves gates;
 * other arguments are leaves and cannot close a cycle. The search is a
 * depth-first walk with three marks per gate (unvisited, in progress, done)
 * kept in an array owned by one {@link #verify} call. The walk uses an explicit
 * stack so deep trees do not exhaust the thread stack, and that stack is the
 * path reported when a cycle closes.
 *
 * <p>
 * Gates still unvisited once every top gate is exhausted are unreachable from
 * all roots. Since top gate selection already ran, such a detached subgraph has
 * to contain a cycle; it is searched from each detached gate and every cycle
 * found is reported in one error.
 */
public final class CycleDetector {
    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    private CycleDetector() {
        // Utility class
    }

    /**
     * Checks the gates reachable from the top gates, then the detached ones.
     *
     * @param table    A populated event table.
     * @param topGates Handles of the top gates.
     * @throws FaultTreeException with the cycle path if a cycle exists.
     */
    public static void verify(EventTable table, List<Integer> topGates) {
        byte[] marks = new byte[table.size()];

        for (int top : topGates) {
            List<String> cycle = visit(table, top, marks);
            if (cycle != null)
                throw new FaultTreeException(describe(cycle), cycle);
        }

        List<Integer> detached = new ArrayList<>();
        for (int handle : table.gateHandles())
            if (marks[handle] == UNVISITED)
                detached.add(handle);
        if (detached.isEmpty())
            return;

        StringBuilder sb = new StringBuilder("Detected detached gates that may be in a cycle\n");
        sb.append(detached.stream().map(h -> table.event(h).name()).toList());
        List<String> first = null;
        for (int gate : detached) {
            List<String> cycle = visit(table, gate, marks);
            if (cycle != null) {
                sb.append('\n').append(describe(cycle));
                if (first == null)
                    first = cycle;
            }
        }
        if (first == null)
            throw new IllegalStateException("Detached gates without a cycle: " + detached);
        throw new FaultTreeException(sb.toString(), first);
    }

    /**
     * Searches for any cycle reachable from the given gates.
     *
     * @param table A populated event table.
     * @param seeds Handles of the gates to start from, in order.
     * @return The first cycle path found, or null if there is none.
     */
    public static List<String> findCycle(EventTable table, List<Integer> seeds) {
        byte[] marks = new byte[table.size()];
        for (int seed : seeds) {
            List<String> cycle = visit(table, seed, marks);
            if (cycle != null)
                return cycle;
        }
        return null;
    }

    /** Formats a cycle path for error messages: {@code g2->g3->g2}. */
    public static String describe(List<String> cycle) {
        return "Detected a cycle: " + String.join("->", cycle);
    }

    /**
     * Walks the subgraph below one gate.
     *
     * @return The cycle path top-down, starting and ending at the repeated gate,
     *         or null if the walk finished without closing a cycle.
     */
    private static List<String> visit(EventTable table, int root, byte[] marks) {
        if (marks[root] != UNVISITED)
            return null;

        Deque<Frame> stack = new ArrayDeque<>();
        marks[root] = IN_PROGRESS;
        stack.push(new Frame(root, table.childGates(root)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next < frame.children.length) {
                int child = frame.children[frame.next++];
                if (marks[child] == IN_PROGRESS) {
                    List<String> cycle = unwind(table, stack, child);
                    // Leave the aborted walk settled so later walks do not trip over it.
                    for (Frame f : stack)
                        marks[f.gate] = DONE;
                    return cycle;
                }
                if (marks[child] == UNVISITED) {
                    marks[child] = IN_PROGRESS;
                    stack.push(new Frame(child, table.childGates(child)));
                }
            } else {
                marks[frame.gate] = DONE;
                stack.pop();
            }
        }
        return null;
    }

    private static List<String> unwind(EventTable table, Deque<Frame> stack, int repeated) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        // Bottom of the stack is the root; walk it top-down.
        for (Iterator<Frame> it = stack.descendingIterator(); it.hasNext();) {
            Frame f = it.next();
            if (f.gate == repeated)
                inCycle = true;
            if (inCycle)
                path.add(table.event(f.gate).name());
        }
        path.add(table.event(repeated).name());
        return path;
    }

    private static final class Frame {
        final int gate;
        final int[] children;
        int next;

        Frame(int gate, int[] children) {
            this.gate = gate;
            this.children = children;
        }
    }
}
