package com.safety.aralia.exception;

/**
 * Thrown when a line or a gate formula matches none of the supported shapes.
 * <p>
 * Typical causes are arithmetic operators ({@code a + b}), operators mixed at
 * one nesting level ({@code a | b & c}), redundant or unbalanced parentheses
 * and identifiers that break the naming rules.
 * </p>
 */
public class ParsingException extends ConversionException {

    public ParsingException(String detail) {
        super(detail);
    }

    public ParsingException(String detail, int lineNumber, String line) {
        super(detail, lineNumber, line);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RECOGNITION;
    }

    @Override
    public ParsingException atLine(int lineNumber, String line) {
        return new ParsingException(detail(), lineNumber, line);
    }
}
