package com.safety.aralia.grammar;

import com.safety.aralia.exception.FaultTreeException;
import com.safety.aralia.exception.ParsingException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a gate formula into one of the {@link FormulaShape}s.
 *
 * <p>
 * One pair of enclosing parentheses is optional for every shape:
 * {@code (a | b)} and {@code a | b} are the same formula. Only a single pair
 * without inner parentheses is stripped, so {@code ((a | b))} is rejected.
 */
public final class FormulaRecognizer {

    private static final Pattern OPTIONAL_PARENS = Pattern.compile("\\(([^()]+)\\)");

    private FormulaRecognizer() {
        // Utility class
    }

    /**
     * Recognizes the right-hand side of a gate declaration.
     *
     * @param formula The text to the right of {@code :=}.
     * @return The recognized formula.
     * @throws ParsingException   if no shape matches.
     * @throws FaultTreeException on repeated arguments or invalid bounds.
     */
    public static Formula recognize(String formula) {
        String text = unwrap(formula.strip());
        for (FormulaShape shape : FormulaShape.values()) {
            if (shape.matches(text))
                return shape.extract(text);
        }
        throw new ParsingException("Cannot interpret the formula:\n" + text);
    }

    /** Returns the shape that would accept the formula, or null. */
    public static FormulaShape shapeOf(String formula) {
        String text = unwrap(formula.strip());
        for (FormulaShape shape : FormulaShape.values()) {
            if (shape.matches(text))
                return shape;
        }
        return null;
    }

    static String unwrap(String text) {
        Matcher m = OPTIONAL_PARENS.matcher(text);
        return m.matches() ? m.group(1).strip() : text;
    }
}
