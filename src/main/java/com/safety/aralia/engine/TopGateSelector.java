package com.safety.aralia.engine;

import com.safety.aralia.exception.FaultTreeException;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects the root gates of a populated {@link EventTable}: the gates no other
 * gate references.
 */
public final class TopGateSelector {

    private TopGateSelector() {
        // Utility class
    }

    /**
     * Selects the top gates.
     *
     * @param table    A populated event table.
     * @param multiTop Whether more than one root is acceptable.
     * @return Handles of the top gates in declaration order.
     * @throws FaultTreeException if there is no top gate (the message then
     *                            carries the cycle that swallowed the root),
     *                            or several without {@code multiTop}.
     */
    public static List<Integer> select(EventTable table, boolean multiTop) {
        if (!table.isPopulated())
            throw new IllegalStateException("Top gates are selected after population");

        List<Integer> tops = new ArrayList<>();
        for (int handle : table.gateHandles())
            if (table.isOrphan(handle))
                tops.add(handle);

        if (tops.size() > 1 && !multiTop) {
            List<String> names = tops.stream().map(h -> table.event(h).name()).toList();
            throw new FaultTreeException("Detected multiple top gates:\n" + names);
        }
        if (tops.isEmpty()) {
            // Every gate has an argument, so a rootless graph always hides a cycle.
            List<String> cycle = CycleDetector.findCycle(table, table.gateHandles());
            if (cycle == null)
                throw new FaultTreeException("No top gate is detected");
            throw new FaultTreeException("No top gate is detected\n" + CycleDetector.describe(cycle), cycle);
        }
        return List.copyOf(tops);
    }
}
