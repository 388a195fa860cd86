package com.fiscalpilot.dispatch.cli;

import com.fiscalpilot.core.engine.EngineSummary;
import com.fiscalpilot.core.model.ActionStatus;
import com.fiscalpilot.core.model.ActionStep;
import com.fiscalpilot.core.model.ApprovalLevel;
import com.fiscalpilot.core.model.ExecutionResult;
import com.fiscalpilot.core.model.ProposedAction;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the FiscalPilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FISCALPILOT v0.4.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FISCALPILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static String levelBadge(ApprovalLevel level) {
        String color = switch (level) {
            case GREEN -> "fg(green)";
            case YELLOW -> "fg(yellow)";
            case RED -> "fg(red)";
            case CRITICAL -> "fg(red),bold";
        };
        return CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " " + String.format("%-8s", level.name()) + "|@");
    }

    public static void legend() {
        System.out.println(levelBadge(ApprovalLevel.GREEN) + " auto-approve (low risk)");
        System.out.println(levelBadge(ApprovalLevel.YELLOW) + " auto-approve + notify (moderate risk)");
        System.out.println(levelBadge(ApprovalLevel.RED) + " requires explicit approval (high risk)");
        System.out.println(levelBadge(ApprovalLevel.CRITICAL) + " requires multi-party approval (very high risk)");
    }

    public static void actionRow(int index, ProposedAction action) {
        System.out.printf(Locale.US, "  %2d. %s %-40s %12s  %s%n",
                index, levelBadge(action.getApprovalLevel()), truncate(action.getTitle(), 40),
                money(action.getEstimatedSavings()), action.getStatus().value());
    }

    public static void actionDetails(ProposedAction action) {
        System.out.println();
        System.out.println(levelBadge(action.getApprovalLevel()) + " "
                + CommandLine.Help.Ansi.AUTO.string("@|bold " + action.getTitle() + "|@")
                + " (" + action.getId() + ")");
        if (!action.getDescription().isEmpty()) {
            System.out.println("    " + action.getDescription());
        }
        for (ActionStep step : action.getSteps()) {
            System.out.println("    " + step.order() + ". " + step.description()
                    + (step.reversible() ? " (reversible)" : ""));
        }
    }

    public static void result(ExecutionResult result) {
        String statusColor = switch (result.status()) {
            case COMPLETED, ROLLED_BACK -> "fg(green)";
            case FAILED -> "fg(red)";
            default -> "fg(yellow)";
        };
        String line = "  @|" + statusColor + " " + String.format("%-11s", result.status().name()) + "|@ "
                + result.actionId() + " " + result.summary();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        if (result.status() == ActionStatus.FAILED && result.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(red) " + result.error() + "|@"));
        }
    }

    public static void summary(EngineSummary s) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Engine Summary|@"));
        System.out.println("  Executors: " + String.join(", ", s.registeredExecutors()));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Executed: " + s.totalExecuted() + " (@|fg(green) " + s.succeeded() + " succeeded|@, @|fg(red) "
                        + s.failed() + " failed|@)"));
        System.out.println("  Pending approval: " + s.pendingActions());
        System.out.println("  Dry-run by default: " + s.dryRunByDefault()
                + " | Max actions per run: " + s.maxActionsPerRun());
    }

    static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
