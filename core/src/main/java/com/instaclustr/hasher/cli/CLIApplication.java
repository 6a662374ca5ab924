package com.instaclustr.hasher.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public abstract class CLIApplication {

    private static final Logger logger = LoggerFactory.getLogger(CLIApplication.class);

    public static int execute(final Runnable runnable, final String... args) {
        return execute(new CommandLine(runnable), args);
    }

    /**
     * Invalid arguments end with exit code 2, a failed execution with exit code 1.
     */
    public static int execute(final CommandLine commandLine, final String... args) {
        return commandLine
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionExceptionHandler((ex, cl, parseResult) -> {
                logger.debug("Execution of {} failed", cl.getCommandName(), ex);
                cl.getErr().println(cl.getColorScheme().errorText(ex.getMessage()));
                return cl.getCommandSpec().exitCodeOnExecutionException();
            })
            .execute(args);
    }

    public abstract String title();
}
