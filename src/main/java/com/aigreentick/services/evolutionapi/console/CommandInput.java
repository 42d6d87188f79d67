package com.aigreentick.services.evolutionapi.console;

import org.springframework.boot.ApplicationArguments;

import java.util.List;

/**
 * Arguments after the command name plus {@code --option[=value]} flags.
 *
 * {@code instances connect sales --connection=eu} gives
 * argument(0) = "connect", argument(1) = "sales", option("connection") = "eu".
 */
public class CommandInput {

    private final List<String> arguments;
    private final ApplicationArguments applicationArguments;

    public CommandInput(ApplicationArguments applicationArguments) {
        List<String> nonOptions = applicationArguments.getNonOptionArgs();
        this.arguments = nonOptions.isEmpty() ? List.of() : List.copyOf(nonOptions.subList(1, nonOptions.size()));
        this.applicationArguments = applicationArguments;
    }

    /** Positional argument, or null when absent */
    public String argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    public String argument(int index, String defaultValue) {
        String value = argument(index);
        return value != null ? value : defaultValue;
    }

    public boolean hasFlag(String name) {
        return applicationArguments.containsOption(name);
    }

    /** Last value given for {@code --name=value}, or null */
    public String option(String name) {
        List<String> values = applicationArguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value.isBlank() ? null : value;
    }

    /**
     * @throws IllegalArgumentException when the value is not an integer
     */
    public int intOption(String name, int defaultValue) {
        String value = option(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Option --" + name + " must be a number, got: " + value);
        }
    }
}
