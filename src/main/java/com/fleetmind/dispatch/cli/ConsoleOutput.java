package com.fleetmind.dispatch.cli;

import com.fleetmind.core.engine.TickReport;
import com.fleetmind.core.model.Message;
import com.fleetmind.core.model.Task;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the fleetmind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLEETMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLEETMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void task(String workerId, Task task) {
        String status = switch (task.status()) {
            case BLOCKED -> "@|fg(yellow) blocked|@";
            case ASSIGNED -> "@|fg(cyan) assigned|@";
            case DONE -> "@|fg(green) done|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + workerId + "]|@ " + task.taskId() + " " + status
                + (task.redoOf() != null ? " (redo of " + task.redoOf() + ")" : "")
                + (task.blockedBy().isEmpty() ? "" : " blocked_by=" + task.blockedBy())));
    }

    public static void workerRow(String workerId, String model, String taskId, String taskStatus,
                                 int unread, String activity, String phase) {
        String activityColor = switch (activity) {
            case "busy" -> "fg(yellow)";
            case "idle" -> "fg(green)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-10s %-12s %-16s %-9s %3d  @|%s %-6s|@ %s",
                workerId, model, taskId, taskStatus, unread, activityColor, activity, phase)));
    }

    public static void messages(List<Message> messages) {
        if (messages.isEmpty()) {
            info("No messages.");
            return;
        }
        for (Message m : messages) {
            String marker = m.read() ? "@|faint  |@" : "@|bold,fg(yellow) *|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    marker + " " + m.id() + " [" + m.from() + "/" + m.type() + "] " + truncate(m.content(), 100)));
        }
    }

    public static void tick(TickReport report) {
        if (report.quiet()) {
            info("Tick " + report.tick() + ": nothing to do");
            return;
        }
        info("Tick " + report.tick());
        report.unblocked().forEach(w -> success("unblocked " + w));
        report.switched().forEach(w -> info("model switch queued for " + w));
        report.announced().forEach(w -> success("announced task to " + w));
        report.nudged().forEach(w -> success("nudged " + w));
        report.deferred().forEach(w -> info("deferred " + w + " (busy)"));
        report.absent().forEach(w -> info("no session for " + w));
        report.failures().forEach((w, reason) -> error(w + ": " + reason));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
