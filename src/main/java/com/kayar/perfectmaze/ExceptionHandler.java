package com.kayar.perfectmaze;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Maps failures during command execution to exit codes: invalid settings are a usage
 * error, anything else is a software error.
 */
public class ExceptionHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ExceptionHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof IllegalArgumentException) {
            commandLine.getErr().println(commandLine.getColorScheme().errorText(ex.getMessage()));
            commandLine.usage(commandLine.getErr());
            commandLine.getErr().flush();
            return CommandLine.ExitCode.USAGE;
        }
        log.error("Maze run failed", ex);
        commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + ex.getMessage()));
        commandLine.getErr().flush();
        return CommandLine.ExitCode.SOFTWARE;
    }
}
