package com.mcpcheck.dispatch.cli;

import com.mcpcheck.core.plugin.Outcome;
import com.mcpcheck.core.report.Report;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the mcp-check CLI.
 */
public class ConsoleOutput {

    static final String RULE = "══════════════════════════════════════════════════════════════════════";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) MCP CHECK v0.1.0|@ - automated MCP server test suite"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MCPCHECK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void section(String title) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
        System.out.println(RULE);
    }

    /**
     * One progress line per plugin, followed by its message and error detail.
     */
    public static void outcome(Outcome outcome) {
        String status = switch (outcome.state()) {
            case PASSED -> "@|fg(green) PASS|@";
            case FAILED -> "@|fg(red) FAIL|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
        };
        String duration = outcome.durationMs() != null ? " (" + outcome.durationMs() + "ms)" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + outcome.pluginName() + duration));
        if (outcome.message() != null) {
            System.out.println("      " + outcome.message());
        }
        if (outcome.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "      @|fg(red) Error: " + escape(outcome.error()) + "|@"));
        }
    }

    public static void summary(Report report) {
        var s = report.summary();
        section("Test Summary");
        System.out.println("Total:  " + s.total() + " tests");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) Passed: " + s.passed() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) Failed: " + s.failed() + "|@"));
        System.out.println("Time:   " + formatDuration(s.durationMs()));
        System.out.println();
        if (report.cancelled()) {
            warn("Run cancelled before all plugins completed");
        }
        if (s.failed() == 0) {
            success("All tests passed!");
        } else {
            error(s.failed() + " test(s) failed");
        }
    }

    /**
     * Picocli markup uses "|@" as a terminator, so free text must not contain it.
     */
    static String escape(String text) {
        return text.replace("@|", "@ |").replace("|@", "| @");
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
