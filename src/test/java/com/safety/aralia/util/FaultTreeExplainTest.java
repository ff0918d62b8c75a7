package com.safety.aralia.util;

import com.safety.aralia.AraliaConverter;
import com.safety.aralia.engine.FaultTree;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class FaultTreeExplainTest {

    private static FaultTree sample() {
        return AraliaConverter.convert(List.of(
                "FT",
                "top := g-a | ~g-b",
                "g-a := #(1, 2, [e1, e2, h1])",
                "g-b := e1 & e2",
                "p(e1) = 0.1",
                "p(e2) = 0.2",
                "s(h1) = false"));
    }

    @Test
    public void testDumpTopology() {
        String dump = new FaultTreeExplain(sample()).dumpTopology();
        assertEquals(String.join("\n",
                "Fault tree FT (3 gates):",
                "  [0] g-a",
                "  [1] g-b",
                "  [2] top (TOP) -> g-a, g-b",
                ""), dump);
    }

    @Test
    public void testExplainGate() {
        String text = new FaultTreeExplain(sample()).explainGate("g-a");
        assertTrue(text.startsWith("Gate: g-a\n"));
        assertTrue(text.contains("  Operator: CARDINALITY\n"));
        assertTrue(text.contains("  Is top: false\n"));
        assertTrue(text.contains("  Min: 1\n"));
        assertTrue(text.contains("  Max: 2\n"));
        assertTrue(text.contains("e1 [basic-event], e2 [basic-event], h1 [house-event]"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownGate() {
        new FaultTreeExplain(sample()).explainGate("e1");
    }

    private static String id(FaultTree tree, String name) {
        return "n" + tree.events().handleOf(name);
    }

    @Test
    public void testMermaid() {
        FaultTree tree = sample();
        String mermaid = new FaultTreeExplain(tree).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("  " + id(tree, "top") + "[\"top<br/>or\"];\n"));
        assertTrue(mermaid.contains("  " + id(tree, "g-a") + "[\"g-a<br/>cardinality 1..2\"];\n"));
        assertTrue(mermaid.contains("  " + id(tree, "e1") + "((\"e1<br/>p=0.1\"));\n"));
        assertTrue(mermaid.contains("  " + id(tree, "h1") + "((\"h1<br/>false\"));\n"));
        assertTrue(mermaid.contains("  " + id(tree, "top") + " --> " + id(tree, "g-a") + ";\n"));
        assertTrue(mermaid.contains("  " + id(tree, "top") + " -. \"not\" .-> " + id(tree, "g-b") + ";\n"));
        assertTrue(mermaid.contains("  " + id(tree, "g-b") + " --> " + id(tree, "e2") + ";\n"));
    }

    @Test
    public void testMermaidKeepsSimilarNamesApart() {
        FaultTree tree = AraliaConverter.convert(List.of(
                "FT",
                "end := g-1 & g_1",
                "g-1 := a | b",
                "g_1 := c | d"));
        String mermaid = new FaultTreeExplain(tree).toMermaid();

        Set<String> ids = new HashSet<>();
        for (String name : List.of("end", "g-1", "g_1", "a", "b", "c", "d"))
            ids.add(id(tree, name));
        assertEquals(7, ids.size());

        String g1 = id(tree, "g-1");
        String g2 = id(tree, "g_1");
        assertEquals(1, count(mermaid, "  " + g1 + "[\"g-1<br/>or\"];\n"));
        assertEquals(1, count(mermaid, "  " + g2 + "[\"g_1<br/>or\"];\n"));
        assertEquals(1, count(mermaid, " --> " + g1 + ";\n"));
        assertEquals(1, count(mermaid, " --> " + g2 + ";\n"));
        assertTrue(mermaid.contains("  " + g1 + " --> " + id(tree, "a") + ";\n"));
        assertTrue(mermaid.contains("  " + g2 + " --> " + id(tree, "c") + ";\n"));
        assertFalse(mermaid.contains(g1 + " --> " + id(tree, "c")));
        assertFalse(mermaid.contains("  end"));
    }

    private static int count(String text, String part) {
        int n = 0;
        for (int i = text.indexOf(part); i >= 0; i = text.indexOf(part, i + 1))
            n++;
        return n;
    }
}
