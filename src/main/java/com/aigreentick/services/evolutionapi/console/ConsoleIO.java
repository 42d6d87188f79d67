package com.aigreentick.services.evolutionapi.console;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Terminal input and output for console commands.
 */
public class ConsoleIO {

    private final BufferedReader in;
    private final PrintStream out;
    private final Console console;

    public ConsoleIO(BufferedReader in, PrintStream out, Console console) {
        this.in = in;
        this.out = out;
        this.console = console;
    }

    public static ConsoleIO system() {
        return new ConsoleIO(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out,
                System.console());
    }

    public void line(String text) {
        out.println(text);
    }

    public void newLine() {
        out.println();
    }

    public void info(String text) {
        out.println(text);
    }

    public void comment(String text) {
        out.println("  " + text);
    }

    public void warn(String text) {
        out.println("WARNING: " + text);
    }

    public void error(String text) {
        out.println("ERROR: " + text);
    }

    /**
     * Prompt with a default shown in brackets; empty input takes the default.
     */
    public String ask(String question, String defaultValue) {
        out.print(defaultValue != null ? question + " [" + defaultValue + "]: " : question + ": ");
        out.flush();
        String answer = readLine();
        return answer == null || answer.isBlank() ? defaultValue : answer.trim();
    }

    /**
     * Prompt without echo when a terminal is attached.
     */
    public String secret(String question) {
        if (console != null) {
            char[] value = console.readPassword("%s: ", question);
            return value == null ? null : new String(value).trim();
        }
        out.print(question + ": ");
        out.flush();
        String answer = readLine();
        return answer == null ? null : answer.trim();
    }

    public boolean confirm(String question, boolean defaultValue) {
        String answer = ask(question + " (yes/no)", defaultValue ? "yes" : "no");
        if (answer == null) {
            return defaultValue;
        }
        String normalized = answer.toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes");
    }

    /**
     * Bordered table:
     * <pre>
     * +----------+--------+
     * | Instance | Status |
     * +----------+--------+
     * | sales    | open   |
     * +----------+--------+
     * </pre>
     */
    public void table(List<String> headers, List<List<String>> rows) {
        List<Integer> widths = new ArrayList<>();
        for (String header : headers) {
            widths.add(header.length());
        }
        for (List<String> row : rows) {
            for (int i = 0; i < headers.size(); i++) {
                widths.set(i, Math.max(widths.get(i), cell(row, i).length()));
            }
        }

        String border = border(widths);
        out.println(border);
        out.println(row(headers, widths));
        out.println(border);
        for (List<String> row : rows) {
            out.println(row(row, widths));
        }
        out.println(border);
    }

    private String border(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.toString();
    }

    private String row(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < widths.size(); i++) {
            String value = cell(cells, i);
            sb.append(' ').append(value).append(" ".repeat(widths.get(i) - value.length())).append(" |");
        }
        return sb.toString();
    }

    private static String cell(List<String> row, int index) {
        String value = index < row.size() ? row.get(index) : null;
        return value != null ? value : "-";
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not read console input", ex);
        }
    }
}
