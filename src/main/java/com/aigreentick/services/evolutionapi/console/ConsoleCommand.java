package com.aigreentick.services.evolutionapi.console;

/**
 * Operational command run with {@code java -jar app.jar <name> [args] [--options]}.
 */
public interface ConsoleCommand {

    int SUCCESS = 0;
    int FAILURE = 1;

    /** First command-line argument that selects this command */
    String name();

    String description();

    /**
     * @return process exit code, {@link #SUCCESS} or {@link #FAILURE}
     */
    int execute(CommandInput input, ConsoleIO io);
}
