package com.homeostat.dispatch.cli;

import com.homeostat.core.mode.ModeTransition;
import com.homeostat.core.model.MetricsSummary;
import com.homeostat.core.model.Mode;
import com.homeostat.core.model.StepRecord;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Homeostat CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HOMEOSTAT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HOMEOSTAT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void mode(Mode mode, String detail) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold," + modeColor(mode) + " [" + mode + "]|@ " + detail));
    }

    public static void transition(ModeTransition t) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [MODE]|@ " + t.oldMode() + " -> @|bold," + modeColor(t.newMode()) + " "
                        + t.newMode() + "|@ (rule " + t.rule() + ", " + t.triggerMetric() + "="
                        + format(t.triggerValue()) + ")"));
    }

    public static void approval(String id, String subject, String reason) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(magenta) [APPROVAL " + id + "]|@ " + subject + ": " + reason));
    }

    public static void step(StepRecord step) {
        String color = step.toState().name().equals("FAILED") ? "fg(red)" : "fg(blue)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + step.sequence() + ".|@ " + step.fromState() + " -> " + step.toState()
                        + " (" + step.durationMs() + "ms" + (step.attempts() > 1 ? ", " + step.attempts() + " attempts" : "")
                        + ")"));
    }

    public static void metrics(MetricsSummary m) {
        if (m == null) {
            return;
        }
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Resource usage|@"));
        System.out.println("  Samples: " + m.sampleCount() + ", threshold crossings: " + m.thresholdCrossings());
        System.out.println("  CPU: avg " + format(m.cpuAvg()) + "%, max " + format(m.cpuMax()) + "%");
        System.out.println("  Memory: avg " + format(m.memoryAvg()) + "%, max " + format(m.memoryMax()) + "%");
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "mode_transition" -> "@|bold,fg(yellow) [MODE]|@";
            case "approval_required" -> "@|bold,fg(magenta) [APPROVAL]|@";
            case "approval_granted" -> "@|fg(green) [APPROVED]|@";
            case "approval_denied" -> "@|fg(red) [DENIED]|@";
            case "control_signal" -> "@|fg(cyan) [SIGNAL]|@";
            case "policy_violation" -> "@|fg(red),bold [VIOLATION]|@";
            case "task_started", "task_completed", "task_failed" -> "@|fg(blue) [TASK]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String format(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.1f", value);
    }

    private static String modeColor(Mode mode) {
        return switch (mode) {
            case NORMAL -> "fg(green)";
            case ALERT, RECOVERY -> "fg(yellow)";
            case DEGRADED -> "fg(magenta)";
            case LOCKDOWN -> "fg(red)";
        };
    }
}
