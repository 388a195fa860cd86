package com.fiscalpilot.dispatch.cli;

import com.fiscalpilot.core.approval.ApprovalGate;
import com.fiscalpilot.core.model.ActionType;
import com.fiscalpilot.core.model.ApprovalLevel;
import com.fiscalpilot.core.model.DefaultApprovalLevels;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: fiscalpilot policy
 * <p>
 * Prints the default risk tier of every action type together with the
 * approval rules the gate is currently configured with.
 */
@Command(name = "policy", mixinStandardHelpOptions = true, description = "Show risk tiers and approval rules")
@Component
public class PolicyCommand implements Runnable {

    private final ApprovalGate approvalGate;

    public PolicyCommand(ApprovalGate approvalGate) {
        this.approvalGate = approvalGate;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.legend();

        System.out.println();
        System.out.printf("  %-24s %s%n", "ACTION TYPE", "DEFAULT TIER");
        System.out.println("  " + "-".repeat(40));
        for (ActionType type : ActionType.values()) {
            System.out.printf("  %-24s %s%n", type.value(), ConsoleOutput.levelBadge(DefaultApprovalLevels.forType(type)));
        }

        System.out.println();
        if (!approvalGate.isRequireApproval()) {
            ConsoleOutput.error("Approval is disabled: every proposed action is approved automatically");
        }
        for (ApprovalLevel level : ApprovalLevel.values()) {
            approvalGate.ruleFor(level).ifPresent(rule -> ConsoleOutput.info(String.format(
                    "%s rule: approvers=%s, require all=%s, timeout=%dh",
                    level.name(), rule.approvers().isEmpty() ? "anyone" : String.join(", ", rule.approvers()),
                    rule.requireAll(), rule.timeoutHours())));
        }
    }
}
