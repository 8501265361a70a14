package com.storyline.dispatch.cli;

import com.storyline.core.parser.TextSyntaxException;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Storyline CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STORYLINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STORYLINE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void syntaxError(String file, TextSyntaxException e) {
        error(file + ":" + e.position().line() + ":" + e.position().column() + ": " + e.getMessage());
    }

    /**
     * One row of the directive tree printed by {@code storyline parse}.
     */
    public static void directive(int depth, String kind, String identity, String detail) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  ".repeat(depth) + "@|bold,fg(blue) " + kind + "|@ " + identity
                        + (detail.isEmpty() ? "" : " @|faint " + detail + "|@")));
    }

    public static void branch(int depth, int index, String detail) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  ".repeat(depth) + "@|fg(yellow) [" + index + "]|@ " + detail));
    }
}
