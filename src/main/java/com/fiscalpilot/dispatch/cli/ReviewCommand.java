package com.fiscalpilot.dispatch.cli;

import com.fiscalpilot.core.approval.ApprovalGate;
import com.fiscalpilot.core.config.PipelineProperties;
import com.fiscalpilot.core.model.ApprovalLevel;
import com.fiscalpilot.core.model.ProposedAction;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: fiscalpilot review &lt;file&gt;
 * <p>
 * Routes a batch through a scratch gate built from the current configuration and
 * shows which actions would be auto-approved and which would wait for a decision.
 * Nothing is executed.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Preview how a batch of actions would be gated")
@Component
public class ReviewCommand implements Runnable {

    static final int MAX_DETAILED = 10;

    @Parameters(index = "0", description = "JSON file containing an array of proposed actions")
    private Path file;

    private final PipelineProperties properties;
    private final ActionBatchReader reader = new ActionBatchReader();

    public ReviewCommand(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ProposedAction> actions;
        try {
            actions = reader.read(file);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read action batch " + file + ": " + e.getMessage());
            return;
        }
        if (actions.isEmpty()) {
            ConsoleOutput.info("No actions in " + file);
            return;
        }

        var approval = properties.getApproval();
        var gate = new ApprovalGate(properties.approvalRules(), approval.isRequireApproval(),
                approval.isAutoApproveGreen(), approval.isAutoApproveYellow());
        var outcome = gate.process(actions);

        ConsoleOutput.info(String.format("%d action(s): %d auto-approved, %d awaiting approval",
                actions.size(), outcome.autoApproved().size(), outcome.needsApproval().size()));
        System.out.println();
        for (int i = 0; i < actions.size(); i++) {
            ConsoleOutput.actionRow(i + 1, actions.get(i));
        }

        var notable = actions.stream()
                .filter(a -> a.getApprovalLevel() != ApprovalLevel.GREEN)
                .limit(MAX_DETAILED)
                .toList();
        for (ProposedAction action : notable) {
            ConsoleOutput.actionDetails(action);
        }

        double total = actions.stream().mapToDouble(ProposedAction::getEstimatedSavings).sum();
        System.out.println();
        ConsoleOutput.info("Total estimated savings: " + ConsoleOutput.money(total));
    }
}
