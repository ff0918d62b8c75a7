package com.safety.aralia.cli;

import java.io.IOException;

import com.safety.aralia.exception.ConversionException;

import picocli.CommandLine;

/**
 * Keeps conversion failures short: a heading naming the error class and the
 * message, no stack trace unless {@code -Daralia.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
            Exception ex,
            CommandLine commandLine,
            CommandLine.ParseResult parseResult) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(heading(ex) + "\n" + message));
        if (Boolean.getBoolean("aralia.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String heading(Exception ex) {
        if (ex instanceof ConversionException ce) {
            switch (ce.kind()) {
                case RECOGNITION:
                    return "Parsing Error:";
                case DOCUMENT_FORMAT:
                    return "Format Error:";
                default:
                    return "Fault Tree Error:";
            }
        }
        if (ex instanceof IOException)
            return "IO Error:";
        return "Error:";
    }
}
