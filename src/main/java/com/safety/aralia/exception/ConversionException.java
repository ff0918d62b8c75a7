package com.safety.aralia.exception;

/**
 * Base class of every fatal conversion error.
 * <p>
 * A conversion stops at the first {@code ConversionException}; no partial tree
 * or document is produced. Errors raised while a particular input line is being
 * interpreted carry that line's number and text, see {@link #atLine(int, String)}.
 * </p>
 *
 * @see ParsingException
 * @see FormatException
 * @see FaultTreeException
 */
public abstract class ConversionException extends RuntimeException {

    /** Category of a fatal conversion error. */
    public enum ErrorKind {
        /** Text matches no supported line or formula shape. */
        RECOGNITION,
        /** Tree name missing or declared twice. */
        DOCUMENT_FORMAT,
        /** Well-formedness violation of the fault tree itself. */
        STRUCTURAL
    }

    private final String detail;
    private final int lineNumber;
    private final String line;

    protected ConversionException(String detail) {
        this(detail, -1, null);
    }

    protected ConversionException(String detail, int lineNumber, String line) {
        super(lineNumber > 0 ? detail + "\nIn line " + lineNumber + ":\n" + line : detail);
        this.detail = detail;
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** The error category. */
    public abstract ErrorKind kind();

    /**
     * Returns a copy of this error that points at the given input line.
     *
     * @param lineNumber 1-based number of the offending line.
     * @param line       The raw line text.
     * @return The located error, of the same concrete type.
     */
    public abstract ConversionException atLine(int lineNumber, String line);

    /** The message without the line location. */
    public String detail() {
        return detail;
    }

    /** 1-based line number, or -1 when the error is not tied to a line. */
    public int lineNumber() {
        return lineNumber;
    }

    /** The offending line text, or null when the error is not tied to a line. */
    public String line() {
        return line;
    }
}
