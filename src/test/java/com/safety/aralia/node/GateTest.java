package com.safety.aralia.node;

import com.safety.aralia.api.EventKind;
import com.safety.aralia.api.Operator;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GateTest {

    @Test
    public void testGroupedArgumentsFollowEmissionOrder() {
        Gate gate = new Gate("g1", Operator.AND, List.of("g2", "u1", "e1", "~h1"), null, null);
        gate.attach(new Argument(1, "g2", EventKind.GATE, false));
        gate.attach(new Argument(2, "u1", EventKind.UNDEFINED_EVENT, false));
        gate.attach(new Argument(3, "e1", EventKind.BASIC_EVENT, false));
        gate.attach(new Argument(4, "h1", EventKind.HOUSE_EVENT, true));

        assertTrue(gate.isPopulated());
        assertEquals(List.of("g2", "u1", "e1", "h1"),
                gate.arguments().stream().map(Argument::name).toList());
        assertEquals(List.of("h1", "e1", "u1", "g2"),
                gate.groupedArguments().stream().map(Argument::name).toList());
        assertEquals(1, gate.complementArguments().size());
        assertEquals("~h1", gate.complementArguments().get(0).token());
        assertEquals(1, gate.arguments(EventKind.GATE).size());
    }

    @Test
    public void testAttributes() {
        Gate gate = new Gate("g1", Operator.CARDINALITY, List.of("a", "b", "c"), 1, 2);
        assertEquals(EventKind.GATE, gate.kind());
        assertEquals(Integer.valueOf(1), gate.minNumber());
        assertEquals(Integer.valueOf(2), gate.maxNumber());
        assertEquals(3, gate.argumentCount());
        assertFalse(gate.isPopulated());
        assertTrue(gate.arguments().isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void testAttachSameReferenceTwice() {
        Gate gate = new Gate("g1", Operator.OR, List.of("a", "b"), null, null);
        gate.attach(new Argument(1, "a", EventKind.UNDEFINED_EVENT, false));
        gate.attach(new Argument(1, "a", EventKind.UNDEFINED_EVENT, false));
    }

    @Test(expected = IllegalStateException.class)
    public void testAttachBeyondDeclaredArguments() {
        Gate gate = new Gate("g1", Operator.NULL, List.of("a"), null, null);
        gate.attach(new Argument(1, "a", EventKind.UNDEFINED_EVENT, false));
        gate.attach(new Argument(2, "b", EventKind.UNDEFINED_EVENT, false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGateWithoutArguments() {
        new Gate("g1", Operator.AND, List.of(), null, null);
    }

    @Test
    public void testBasicEventProbability() {
        BasicEvent e = new BasicEvent("e1", "0.25");
        assertEquals("0.25", e.probability());
        assertEquals(0.25, e.probabilityValue(), 1e-12);
        assertEquals(EventKind.BASIC_EVENT, e.kind());
    }
}
