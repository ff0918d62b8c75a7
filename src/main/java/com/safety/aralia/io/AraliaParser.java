package com.safety.aralia.io;

import com.safety.aralia.engine.EventTable;
import com.safety.aralia.exception.ConversionException;
import com.safety.aralia.exception.FormatException;
import com.safety.aralia.exception.ParsingException;
import com.safety.aralia.grammar.FormulaRecognizer;
import com.safety.aralia.grammar.NameValidator;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line interpreter for the Aralia fault tree notation.
 *
 * <p>
 * Each non-blank line holds exactly one declaration:
 *
 * <pre>
 * FaultTreeName                        fault tree name, once
 * gate_name := formula                 gate, see {@link com.safety.aralia.grammar.FormulaShape}
 * p(event_name) = probability          basic event: 0, 1 or 0.digits
 * s(event_name) = state                house event: true or false
 * </pre>
 *
 * <p>
 * Whitespace around tokens is free. Names are case-sensitive and follow
 * {@link NameValidator}. Parsing is the declaration pass only: references are
 * resolved later by {@link FaultTreeCompiler}.
 */
public final class AraliaParser {
    private static final String NAME = NameValidator.NAME_SIGNATURE;

    private static final Pattern PROBABILITY = Pattern.compile(
            "p\\(\\s*(?<name>" + NAME + ")\\s*\\)\\s*=\\s*(?<prob>1|0|0\\.\\d+)");
    private static final Pattern STATE = Pattern.compile(
            "s\\(\\s*(?<name>" + NAME + ")\\s*\\)\\s*=\\s*(?<state>true|false)");
    private static final Pattern GATE = Pattern.compile(
            "(?<name>" + NAME + ")\\s*:=\\s*(?<formula>.+)");

    private AraliaParser() {
        // Utility class
    }

    /** Parses Aralia text. */
    public static Declarations parse(String text) {
        return parse(text.lines().toList());
    }

    /**
     * Interprets the lines in order and records every declaration.
     *
     * @param lines Input lines without line terminators.
     * @return The declarations.
     * @throws ConversionException at the first offending line, with the line
     *                             number and text attached, or a
     *                             {@link FormatException} if no tree name is
     *                             given.
     */
    public static Declarations parse(List<String> lines) {
        Interpreter interpreter = new Interpreter();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            try {
                interpreter.interpret(line);
            } catch (ConversionException e) {
                throw e.atLine(lineNumber, line);
            }
        }
        if (interpreter.treeName == null)
            throw new FormatException("The fault tree name is not given.");
        return new Declarations(interpreter.treeName, interpreter.events, lineNumber);
    }

    /** Declaration state accumulated over the lines of one input. */
    private static final class Interpreter {
        private final EventTable events = new EventTable();
        private String treeName;

        void interpret(String rawLine) {
            String line = rawLine.strip();
            if (line.isEmpty())
                return;

            Matcher m = GATE.matcher(line);
            if (m.matches()) {
                events.declareGate(m.group("name"), FormulaRecognizer.recognize(m.group("formula")));
                return;
            }
            m = PROBABILITY.matcher(line);
            if (m.matches()) {
                events.declareBasicEvent(m.group("name"), m.group("prob"));
                return;
            }
            m = STATE.matcher(line);
            if (m.matches()) {
                events.declareHouseEvent(m.group("name"), Boolean.parseBoolean(m.group("state")));
                return;
            }
            if (NameValidator.isValid(line)) {
                if (treeName != null)
                    throw new FormatException("Redefinition of the fault tree name:\n" + treeName + " to " + line);
                treeName = line;
                return;
            }
            throw new ParsingException("Cannot interpret the line.");
        }
    }
}
