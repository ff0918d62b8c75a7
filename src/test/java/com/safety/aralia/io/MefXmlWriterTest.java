package com.safety.aralia.io;

import com.safety.aralia.ConverterConfig;
import com.safety.aralia.engine.FaultTree;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class MefXmlWriterTest {

    private static FaultTree tree(boolean multiTop, String... lines) {
        return new FaultTreeCompiler(ConverterConfig.builder().multiTop(multiTop).build())
                .compile(AraliaParser.parse(List.of(lines)));
    }

    private static final String[] SAMPLE = {
            "FT",
            "g1 := g2 & ~e1 & h1 & u1",
            "g2 := e1 | e2",
            "p(e1) = 0.1",
            "p(e2) = 0.2",
            "s(h1) = true"
    };

    @Test
    public void testDocument() {
        String expected = String.join("\n",
                "<?xml version=\"1.0\"?>",
                "<opsa-mef>",
                "<define-fault-tree name=\"FT\">",
                "<define-gate name=\"g2\">",
                "<or>",
                "<basic-event name=\"e1\"/>",
                "<basic-event name=\"e2\"/>",
                "</or>",
                "</define-gate>",
                "<define-gate name=\"g1\">",
                "<and>",
                "<house-event name=\"h1\"/>",
                "<not>",
                "<basic-event name=\"e1\"/>",
                "</not>",
                "<event name=\"u1\"/>",
                "<gate name=\"g2\"/>",
                "</and>",
                "</define-gate>",
                "</define-fault-tree>",
                "<model-data>",
                "<define-basic-event name=\"e1\">",
                "<float value=\"0.1\"/>",
                "</define-basic-event>",
                "<define-basic-event name=\"e2\">",
                "<float value=\"0.2\"/>",
                "</define-basic-event>",
                "<define-house-event name=\"h1\">",
                "<constant value=\"true\"/>",
                "</define-house-event>",
                "</model-data>",
                "</opsa-mef>",
                "");
        assertEquals(expected, new MefXmlWriter().write(tree(false, SAMPLE)));
    }

    @Test
    public void testNestingInlinesChildFormula() {
        FaultTree tree = tree(false, SAMPLE);
        String g1 = new MefXmlWriter(1).writeGate(tree.events(), tree.gate("g1"));
        String expected = String.join("\n",
                "<define-gate name=\"g1\">",
                "<and>",
                "<house-event name=\"h1\"/>",
                "<not>",
                "<basic-event name=\"e1\"/>",
                "</not>",
                "<event name=\"u1\"/>",
                "<or>",
                "<basic-event name=\"e1\"/>",
                "<basic-event name=\"e2\"/>",
                "</or>",
                "</and>",
                "</define-gate>",
                "");
        assertEquals(expected, g1);

        // The child gate keeps its own definition
        assertTrue(new MefXmlWriter(1).write(tree).contains("<define-gate name=\"g2\">"));
    }

    @Test
    public void testNestingWrapsComplementedGate() {
        FaultTree tree = tree(false, "FT", "g1 := ~g2 | e3", "g2 := e1 & e2");
        String g1 = new MefXmlWriter(2).writeGate(tree.events(), tree.gate("g1"));
        assertTrue(g1.contains("<not>\n<and>\n<event name=\"e1\"/>\n<event name=\"e2\"/>\n</and>\n</not>\n"));
    }

    @Test
    public void testNestingDepthLimit() {
        FaultTree tree = tree(false, "FT", "a := b | x", "b := c & y", "c := z ^ w");
        String depth1 = new MefXmlWriter(1).writeGate(tree.events(), tree.gate("a"));
        assertTrue(depth1.contains("<and>"));
        assertTrue(depth1.contains("<gate name=\"c\"/>"));
        assertFalse(depth1.contains("<xor>"));

        String depth2 = new MefXmlWriter(2).writeGate(tree.events(), tree.gate("a"));
        assertTrue(depth2.contains("<xor>"));
        assertFalse(depth2.contains("<gate name="));
    }

    @Test
    public void testSharedSubGateInlinedPerReference() {
        FaultTree tree = tree(false, "FT", "top := a | b", "a := c & e1", "b := c & e2", "c := e3 ^ e4");
        String top = new MefXmlWriter(2).writeGate(tree.events(), tree.gate("top"));
        assertEquals(2, top.split("<xor>", -1).length - 1);
    }

    @Test
    public void testOperatorAttributes() {
        FaultTree tree = tree(true, "FT", "g1 := @(2, [a, b, c])", "g2 := #(1, 2, [a, b, c])", "g3 := ~(a)",
                "g4 := a", "g5 := a <=> b");
        MefXmlWriter writer = new MefXmlWriter();
        assertTrue(writer.writeGate(tree.events(), tree.gate("g1")).contains("<atleast min=\"2\">\n"));
        assertTrue(writer.writeGate(tree.events(), tree.gate("g2")).contains("<cardinality min=\"1\" max=\"2\">\n"));
        assertTrue(writer.writeGate(tree.events(), tree.gate("g3")).contains("<not>\n<event name=\"a\"/>\n</not>\n"));
        assertEquals("<define-gate name=\"g4\">\n<event name=\"a\"/>\n</define-gate>\n",
                writer.writeGate(tree.events(), tree.gate("g4")));
        assertTrue(writer.writeGate(tree.events(), tree.gate("g5")).contains("<iff>\n"));
    }

    @Test
    public void testComplementAndPlainReferenceBothWritten() {
        FaultTree tree = tree(false, "FT", "g1 := ~e2 & e2", "p(e2) = 0.2");
        assertEquals(String.join("\n",
                "<define-gate name=\"g1\">",
                "<and>",
                "<not>",
                "<basic-event name=\"e2\"/>",
                "</not>",
                "<basic-event name=\"e2\"/>",
                "</and>",
                "</define-gate>",
                ""), new MefXmlWriter().writeGate(tree.events(), tree.gate("g1")));
    }

    @Test
    public void testUndefinedEventsHaveNoDefinition() {
        String xml = new MefXmlWriter().write(tree(false, "FT", "g1 := a | b"));
        assertTrue(xml.contains("<model-data>\n</model-data>\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDepthRejected() {
        new MefXmlWriter(-1);
    }
}
