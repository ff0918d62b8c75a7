package com.safety.aralia.grammar;

import com.safety.aralia.api.Operator;
import com.safety.aralia.exception.ConversionException;
import com.safety.aralia.exception.FaultTreeException;
import com.safety.aralia.exception.ParsingException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FormulaRecognizerTest {

    @Test
    public void testOr() {
        Formula f = FormulaRecognizer.recognize("g1 | g2 | e1");
        assertEquals(Operator.OR, f.operator());
        assertEquals(List.of("g1", "g2", "e1"), f.arguments());
        assertNull(f.minNumber());
        assertNull(f.maxNumber());
    }

    @Test
    public void testAndInParentheses() {
        Formula f = FormulaRecognizer.recognize("(e2 & g3 & g5)");
        assertEquals(Operator.AND, f.operator());
        assertEquals(List.of("e2", "g3", "g5"), f.arguments());
    }

    @Test
    public void testBinaryOperators() {
        assertEquals(Operator.XOR, FormulaRecognizer.recognize("(g6 ^ e2)").operator());
        assertEquals(Operator.IMPLY, FormulaRecognizer.recognize("(a => b)").operator());
        assertEquals(Operator.IFF, FormulaRecognizer.recognize("a <=> b").operator());
        assertEquals(List.of("a", "b"), FormulaRecognizer.recognize("(a => b)").arguments());
        assertEquals(List.of("a", "b"), FormulaRecognizer.recognize("a <=> b").arguments());
    }

    @Test
    public void testAtLeast() {
        Formula f = FormulaRecognizer.recognize("@(2, [e1, e2, e3, e4, e5])");
        assertEquals(Operator.ATLEAST, f.operator());
        assertEquals(List.of("e1", "e2", "e3", "e4", "e5"), f.arguments());
        assertEquals(Integer.valueOf(2), f.minNumber());
        assertNull(f.maxNumber());
    }

    @Test
    public void testCardinality() {
        Formula f = FormulaRecognizer.recognize("#(2, 4, [e1, e2, e3, e4, e5])");
        assertEquals(Operator.CARDINALITY, f.operator());
        assertEquals(List.of("e1", "e2", "e3", "e4", "e5"), f.arguments());
        assertEquals(Integer.valueOf(2), f.minNumber());
        assertEquals(Integer.valueOf(4), f.maxNumber());
    }

    @Test
    public void testCardinalityBoundsMayBeEqualOrZero() {
        assertEquals(Integer.valueOf(0), FormulaRecognizer.recognize("#(0, 3, [a, b, c])").minNumber());
        assertEquals(Integer.valueOf(3), FormulaRecognizer.recognize("#(3, 3, [a, b, c])").maxNumber());
    }

    @Test
    public void testNotAndNull() {
        Formula not = FormulaRecognizer.recognize("~(a)");
        assertEquals(Operator.NOT, not.operator());
        assertEquals(List.of("a"), not.arguments());

        Formula notComplement = FormulaRecognizer.recognize("~(~e2)");
        assertEquals(Operator.NOT, notComplement.operator());
        assertEquals(List.of("~e2"), notComplement.arguments());

        Formula nul = FormulaRecognizer.recognize("a");
        assertEquals(Operator.NULL, nul.operator());
        assertEquals(List.of("a"), nul.arguments());

        assertEquals(List.of("~e2"), FormulaRecognizer.recognize("~e2").arguments());
    }

    @Test
    public void testComplementArguments() {
        assertEquals(List.of("e1", "~e2"), FormulaRecognizer.recognize("e1 | ~e2").arguments());
        assertEquals(List.of("e1", "~e2"), FormulaRecognizer.recognize("e1 ^ ~e2").arguments());
        assertEquals(List.of("e1", "~e2"), FormulaRecognizer.recognize("e1 => ~e2").arguments());
        assertEquals(List.of("e1", "~e2", "e3"), FormulaRecognizer.recognize("@(2, [e1, ~e2, e3])").arguments());
        // Same name, different marker: two distinct references
        assertEquals(List.of("~e2", "e2"), FormulaRecognizer.recognize("~e2 & e2").arguments());
    }

    @Test
    public void testFreeWhitespace() {
        Formula f = FormulaRecognizer.recognize("  (  a|b  |  c )  ");
        assertEquals(Operator.OR, f.operator());
        assertEquals(List.of("a", "b", "c"), f.arguments());
        assertEquals(Operator.ATLEAST, FormulaRecognizer.recognize("@( 2 ,[a,b,c] )").operator());
    }

    @Test
    public void testShapeOf() {
        assertEquals(FormulaShape.OR, FormulaRecognizer.shapeOf("a | b"));
        assertEquals(FormulaShape.CARDINALITY, FormulaRecognizer.shapeOf("#(1, 2, [a, b, c])"));
        assertNull(FormulaRecognizer.shapeOf("a + b"));
    }

    @Test
    public void testUnrecognizedFormulas() {
        String[] formulas = {
                "g2 + e1", "g2 * e1", "-e1", "g2 / e1", "(3 == (e1 + e2 + e3))",
                "(1, [e1, e2, e3])", "(2, [])", "(2, [e1])", "(2, [e1, e2])", "(-1, [e1, e2, e3])",
                "a | b)", "(a | b", "((a | b)", "((a | b))",
                "e1 | e2 ^ e3", "e1 | e2 & e3", "e1 | @(2, [e2, e3, e4])", "e1 ^ e2 ^ e3",
                "e1 ^ e2 & e3", "~~e1", "~e1~a", "e1 => e2 => e3", "e1 => e2 || e3",
                "e1 <=> e2 <=> e3", "e1 <=> e2 || e3",
                "@(1, [a, b, c])", "@(2, [a, b])", "#(1, 2, [a, b])", "#(10, 12, [a, b, c])"
        };
        for (String formula : formulas) {
            try {
                FormulaRecognizer.recognize(formula);
                fail("Should not recognize " + formula);
            } catch (ParsingException e) {
                assertEquals(ConversionException.ErrorKind.RECOGNITION, e.kind());
                assertTrue(e.getMessage().startsWith("Cannot interpret the formula:\n"));
            }
        }
    }

    @Test
    public void testAtLeastVoteNotBelowArgumentCount() {
        for (String formula : new String[] { "@(3, [a, b, c])", "@(4, [a, b, c])" }) {
            try {
                FormulaRecognizer.recognize(formula);
                fail("Should reject " + formula);
            } catch (FaultTreeException e) {
                assertEquals("Invalid k/n for the combination formula:\n" + formula, e.getMessage());
            }
        }
    }

    @Test
    public void testCardinalityBounds() {
        for (String formula : new String[] { "#(3, 2, [a, b, c])", "#(2, 4, [a, b, c])" }) {
            try {
                FormulaRecognizer.recognize(formula);
                fail("Should reject " + formula);
            } catch (FaultTreeException e) {
                assertEquals("Invalid l/h for the cardinality formula:\n" + formula, e.getMessage());
            }
        }
    }

    @Test
    public void testRepeatedArguments() {
        try {
            FormulaRecognizer.recognize("e1 & e1");
            fail("Should reject repeated arguments");
        } catch (FaultTreeException e) {
            assertEquals(ConversionException.ErrorKind.STRUCTURAL, e.kind());
            assertTrue(e.getMessage().startsWith("Repeated arguments:\n"));
        }
    }

    @Test(expected = FaultTreeException.class)
    public void testRepeatedArgumentsInList() {
        FormulaRecognizer.recognize("@(2, [a, b, a])");
    }

    @Test
    public void testCaseSensitiveArguments() {
        assertEquals(List.of("g2", "G2"), FormulaRecognizer.recognize("g2 & G2").arguments());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExtractWithWrongShape() {
        FormulaShape.AND.extract("a | b");
    }
}
