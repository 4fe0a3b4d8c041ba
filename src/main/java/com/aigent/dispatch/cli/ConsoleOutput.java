package com.aigent.dispatch.cli;

import com.aigent.core.model.StepResult;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Aigent CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AIGENT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AIGENT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String id, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + id + "]|@ " + message));
    }

    /**
     * Prints a step outcome and, for hierarchical results, its subtree indented below it.
     */
    public static void stepResult(String stepName, StepResult step, int depth) {
        String indent = "  ".repeat(depth + 1);
        var result = step.result();
        boolean ok = result != null && result.success();
        String status = ok ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        String message = result != null && result.message() != null ? result.message() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + status + " " + stepName + (message.isEmpty() ? "" : ": " + message)));
        for (Map.Entry<String, StepResult> child : step.children().entrySet()) {
            stepResult(child.getKey(), child.getValue(), depth + 1);
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "workflow.started" -> "@|fg(cyan) [WORKFLOW]|@";
            case "workflow.step.completed" -> "@|fg(blue) [STEP]|@";
            case "workflow.step.skipped" -> "@|fg(white) [SKIP]|@";
            case "agent.registered", "agent.unregistered" -> "@|fg(magenta) [AGENT]|@";
            case "workflow.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "workflow.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
