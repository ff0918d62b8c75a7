package com.safety.aralia.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /** The configured command line, shared with tests. */
    static CommandLine commandLine() {
        return new CommandLine(new ConvertCommand())
                .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
