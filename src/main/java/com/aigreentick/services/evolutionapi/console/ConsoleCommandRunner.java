package com.aigreentick.services.evolutionapi.console;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the console command named by the first non-option argument.
 *
 * Without such an argument the application is a web service and this
 * runner does nothing. The command's result is reported through
 * {@link ExitCodeGenerator}, so {@code SpringApplication.exit} turns it into
 * the process exit code.
 */
@Component
@Slf4j
public class ConsoleCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    /** Names recognised before the context exists, see EvolutionApiApplication */
    static final Set<String> COMMAND_NAMES = Set.of("install", "health", "instances", "prune", "retry");

    private final Map<String, ConsoleCommand> commands = new LinkedHashMap<>();
    private final ConsoleIO io;

    private volatile int exitCode = ConsoleCommand.SUCCESS;

    public ConsoleCommandRunner(List<ConsoleCommand> commands, ConsoleIO io) {
        for (ConsoleCommand command : commands) {
            this.commands.put(command.name(), command);
        }
        this.io = io;
    }

    public static boolean isCommandInvocation(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return COMMAND_NAMES.contains(arg);
            }
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> nonOptions = args.getNonOptionArgs();
        if (nonOptions.isEmpty()) {
            return;
        }
        ConsoleCommand command = commands.get(nonOptions.get(0));
        if (command == null) {
            log.debug("Not a console command: {}", nonOptions.get(0));
            return;
        }

        log.debug("Running console command: {}", command.name());
        try {
            exitCode = command.execute(new CommandInput(args), io);
        } catch (RuntimeException ex) {
            log.error("Command {} failed", command.name(), ex);
            io.error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            exitCode = ConsoleCommand.FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
