package com.fiscalpilot.dispatch.cli;

import com.fiscalpilot.core.engine.ExecutionEngine;
import com.fiscalpilot.core.model.ExecutionResult;
import com.fiscalpilot.core.model.ProposedAction;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: fiscalpilot run &lt;file&gt;
 * <p>
 * Proposes a batch, applies the operator's decisions and executes every action of
 * the batch that ends up approved. Runs are dry unless {@code --live} is given.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Gate and execute a batch of actions")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "JSON file containing an array of proposed actions")
    private Path file;

    @Option(names = {"--approve", "-a"}, split = ",", description = "Action ids to approve")
    private List<String> approve = new ArrayList<>();

    @Option(names = {"--reject", "-r"}, split = ",", description = "Action ids to reject")
    private List<String> reject = new ArrayList<>();

    @Option(names = "--as", description = "Identity recorded for approvals and rejections (default: ${DEFAULT-VALUE})",
            defaultValue = "operator")
    private String identity;

    @Option(names = "--reason", description = "Reason recorded with the decisions", defaultValue = "")
    private String reason;

    @Option(names = "--live", description = "Apply changes for real instead of a dry run")
    private boolean live;

    private final ExecutionEngine engine;
    private final ActionBatchReader reader = new ActionBatchReader();

    public RunCommand(ExecutionEngine engine) {
        this.engine = engine;
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

        var outcome = engine.propose(actions);
        ConsoleOutput.info(String.format("Proposed %d action(s): %d auto-approved, %d awaiting approval",
                actions.size(), outcome.autoApproved().size(), outcome.needsApproval().size()));

        if (!approve.isEmpty()) {
            var approved = engine.approve(approve, identity, reason);
            for (ProposedAction action : approved) {
                ConsoleOutput.success("Approved " + action.getId() + " (" + action.getStatus().value() + ")");
            }
        }
        if (!reject.isEmpty()) {
            var rejected = engine.reject(reject, identity, reason);
            for (ProposedAction action : rejected) {
                ConsoleOutput.error("Rejected " + action.getId());
            }
        }

        boolean dryRun = !live;
        ConsoleOutput.info(dryRun ? "Executing approved actions (dry run)" : "Executing approved actions (LIVE)");
        List<ExecutionResult> results = engine.execute(actions, dryRun);
        if (results.isEmpty()) {
            ConsoleOutput.info("Nothing to execute");
        }
        for (ExecutionResult result : results) {
            ConsoleOutput.result(result);
        }

        var pending = engine.approvalGate().pendingActions();
        if (!pending.isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Still awaiting approval:");
            for (int i = 0; i < pending.size(); i++) {
                ConsoleOutput.actionRow(i + 1, pending.get(i));
            }
        }

        ConsoleOutput.summary(engine.summary());
    }
}
