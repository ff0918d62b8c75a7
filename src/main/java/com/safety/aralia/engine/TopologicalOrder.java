package com.safety.aralia.engine;

import com.safety.aralia.node.Gate;

import java.util.*;

/**
 * Topology -- CSR-encoded gate DAG in serialization order.
 *
 * This class is the immutable result of sorting the gates of a fault tree. It
 * is what the document writers iterate, so it must be deterministic for
 * identical input.
 *
 * Order:
 * Gates are listed children first: for every gate g and every gate argument c
 * of g, c comes before g. The order is produced by a depth-first walk from each
 * top gate that finishes a gate only after all of its gate arguments.
 *
 * Data layout (Compressed Sparse Row):
 * - topoOrder: the gates in serialization order.
 * - childrenList: one flat int array with the topological indices of the gate
 * arguments of every gate.
 * - childrenOffset: childrenOffset[i] points to the start of gate i's children
 * in childrenList; childrenOffset[i+1] to the end.
 */
public final class TopologicalOrder {
    // The gates in serialization order.
    private final Gate[] topoOrder;

    // CSR Index: childrenOffset[i] points to the start of gate i's children in
    // childrenList.
    private final int[] childrenOffset;

    // CSR Data: Flattened list of child indices.
    private final int[] childrenList;

    // Number of distinct parent gates of each gate
    private final int[] parentCount;

    // Lookup map for name resolution
    private final Map<String, Integer> nameToIndex;

    // Bitset: packs 64 top flags per long
    private final long[] topWords;

    private TopologicalOrder(Gate[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex, long[] topWords) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
        this.topWords = topWords;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the gate at the given topological index. */
    public Gate node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a gate name to its topological index. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown gate: " + name);
        return idx;
    }

    public boolean isTop(int ti) {
        return (topWords[ti >> 6] & (1L << ti)) != 0;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** The gates in serialization order. */
    public List<Gate> gates() {
        return List.of(topoOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sorts the gates of a populated, verified-acyclic event table.
     *
     * @param table    The event table.
     * @param topGates Handles of the top gates.
     * @return The topological order over every declared gate.
     * @throws IllegalStateException if the walk from the top gates does not
     *                               reach every gate exactly once.
     */
    public static TopologicalOrder of(EventTable table, List<Integer> topGates) {
        Builder builder = builder();
        for (Gate gate : table.gates())
            builder.addGate(gate);
        for (int handle : table.gateHandles()) {
            String parent = table.event(handle).name();
            for (int child : table.childGates(handle))
                builder.addEdge(parent, table.event(child).name());
        }
        for (int top : topGates)
            builder.markTop(table.event(top).name());
        return builder.build();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Edges point from a gate to its gate arguments.
     */
    public static final class Builder {
        private static final byte UNVISITED = 0;
        private static final byte IN_PROGRESS = 1;
        private static final byte DONE = 2;

        private final List<Gate> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();
        private final Set<Integer> topIndices = new LinkedHashSet<>();

        public Builder addGate(Gate gate) {
            if (nameToIdx.containsKey(gate.name()))
                throw new IllegalArgumentException("Duplicate gate name: " + gate.name());
            int idx = nodes.size();
            nodes.add(gate);
            nameToIdx.put(gate.name(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** Adds an edge from a gate to one of its gate arguments. Repeated edges are ignored. */
        public Builder addEdge(String parent, String child) {
            if (parent.equals(child))
                throw new IllegalArgumentException("Self-edge not allowed: " + parent);
            List<Integer> children = forwardEdges.get(requireIndex(parent));
            int childIdx = requireIndex(child);
            if (!children.contains(childIdx))
                children.add(childIdx);
            return this;
        }

        public Builder markTop(String name) {
            topIndices.add(requireIndex(name));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown gate: " + name);
            return idx;
        }

        /**
         * Compiles the order.
         * <p>
         * Walks depth-first from every top gate (or, if none is marked, from every
         * gate without a parent) and appends each gate once all its children are
         * done.
         *
         * @throws IllegalStateException on a cycle or on gates unreachable from
         *                               the roots.
         */
        public TopologicalOrder build() {
            int n = nodes.size();

            // 1. Calculate parent counts
            int[] inDegree = new int[n];
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            List<Integer> roots = new ArrayList<>(topIndices);
            if (roots.isEmpty())
                for (int i = 0; i < n; i++)
                    if (inDegree[i] == 0)
                        roots.add(i);

            // 2. Depth-first post-order walk with its own marks
            byte[] marks = new byte[n];
            int[] reverseMap = new int[n];
            int topoIdx = 0;
            Deque<int[]> stack = new ArrayDeque<>();
            for (int root : roots) {
                if (marks[root] != UNVISITED)
                    continue;
                marks[root] = IN_PROGRESS;
                stack.push(new int[] { root, 0 });
                while (!stack.isEmpty()) {
                    int[] frame = stack.peek();
                    List<Integer> children = forwardEdges.get(frame[0]);
                    if (frame[1] < children.size()) {
                        int child = children.get(frame[1]++);
                        if (marks[child] == IN_PROGRESS)
                            throw new IllegalStateException("Cycle detected through gate " + nodes.get(child).name());
                        if (marks[child] == UNVISITED) {
                            marks[child] = IN_PROGRESS;
                            stack.push(new int[] { child, 0 });
                        }
                    } else {
                        marks[frame[0]] = DONE;
                        reverseMap[topoIdx++] = frame[0];
                        stack.pop();
                    }
                }
            }
            if (topoIdx != n)
                throw new IllegalStateException("Topological order reached " + topoIdx + " of " + n + " gates");

            // 3. Construct compact arrays
            int[] topoMap = new int[n];
            Gate[] orderedNodes = new Gate[n];
            long[] topWords = new long[(n + 63) / 64];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);

            for (int ti = 0; ti < n; ti++) {
                int origIdx = reverseMap[ti];
                topoMap[origIdx] = ti;
                orderedNodes[ti] = nodes.get(origIdx);
                if (roots.contains(origIdx))
                    topWords[ti >> 6] |= (1L << ti);
                newNameToIndex.put(orderedNodes[ti].name(), ti);
                parentCounts[ti] = inDegree[origIdx];
            }

            // 4. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++)
                    flatChildren[base + j] = topoMap[children.get(j)];
            }
            return new TopologicalOrder(orderedNodes, offsets, flatChildren, parentCounts, newNameToIndex, topWords);
        }
    }
}
