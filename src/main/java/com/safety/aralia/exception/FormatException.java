package com.safety.aralia.exception;

/**
 * Thrown when the input document is badly formed as a whole: the fault tree
 * name is missing or declared a second time.
 */
public class FormatException extends ConversionException {

    public FormatException(String detail) {
        super(detail);
    }

    public FormatException(String detail, int lineNumber, String line) {
        super(detail, lineNumber, line);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DOCUMENT_FORMAT;
    }

    @Override
    public FormatException atLine(int lineNumber, String line) {
        return new FormatException(detail(), lineNumber, line);
    }
}
