package com.fiscalpilot.dispatch.cli;

import com.fiscalpilot.core.approval.ApprovalGate;
import com.fiscalpilot.core.config.PipelineProperties;
import com.fiscalpilot.core.engine.ExecutionEngine;
import com.fiscalpilot.core.executor.CategorizationExecutor;
import com.fiscalpilot.core.executor.InMemoryTransactionLedger;
import com.fiscalpilot.core.model.ActionStatus;
import com.fiscalpilot.core.model.ApprovalLevel;
import com.fiscalpilot.core.model.ApprovalRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the FiscalPilot CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private static final String BATCH = """
            [
              {"id": "a1", "title": "Tag SaaS spend", "action_type": "tag_expense",
               "estimated_savings": 100,
               "parameters": {"transaction_ids": ["txn-1", "txn-2"], "category": "software"}},
              {"id": "a2", "title": "Remind late payer", "action_type": "send_reminder",
               "estimated_savings": 500, "parameters": {"channel": "email"}},
              {"id": "a3", "title": "Cancel unused CRM", "action_type": "cancel_subscription",
               "estimated_savings": 5000, "description": "No logins in 90 days",
               "steps": [{"order": 1, "description": "Export CRM data", "reversible": true},
                         {"order": 2, "description": "Cancel plan", "reversible": false}]},
              {"id": "a4", "title": "Close dormant account", "action_type": "close_account",
               "estimated_savings": 50000, "finding_ids": ["f-9"]}
            ]
            """;

    @TempDir
    Path tempDir;

    private Path batchFile;
    private InMemoryTransactionLedger ledger;
    private ExecutionEngine engine;
    private PipelineProperties properties;

    private record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() throws IOException {
        batchFile = tempDir.resolve("actions.json");
        Files.writeString(batchFile, BATCH);
        ledger = new InMemoryTransactionLedger();
        var gate = new ApprovalGate(
                List.of(new ApprovalRule(ApprovalLevel.CRITICAL, List.of("cfo", "ceo"), true)),
                true, true, true);
        engine = new ExecutionEngine(gate, List.of(new CategorizationExecutor(ledger)), 50, true);
        properties = new PipelineProperties();
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == PolicyCommand.class) {
                    return (K) new PolicyCommand(engine.approvalGate());
                }
                if (cls == ReviewCommand.class) {
                    return (K) new ReviewCommand(properties);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(capture, true));
        try {
            var cmd = new FiscalPilotCommand();
            CommandLine commandLine = new CommandLine(cmd, createFactory());
            commandLine.setOut(new PrintWriter(System.out, true));
            int exitCode = commandLine.execute(args);
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    @Nested
    @DisplayName("top level")
    class TopLevel {

        @Test
        @DisplayName("no arguments prints banner and usage")
        void usage() {
            var result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FISCALPILOT"));
            assertTrue(result.output().contains("policy"));
            assertTrue(result.output().contains("review"));
            assertTrue(result.output().contains("run"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            var result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FiscalPilot 0.4.0"));
        }
    }

    @Nested
    @DisplayName("policy")
    class Policy {

        @Test
        @DisplayName("lists every action type and the configured rules")
        void table() {
            var result = execute("policy");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("categorize_transaction"));
            assertTrue(result.output().contains("close_account"));
            assertTrue(result.output().contains("CRITICAL rule: approvers=cfo, ceo"));
        }
    }

    @Nested
    @DisplayName("review")
    class Review {

        @Test
        @DisplayName("shows the partition and details of non-GREEN actions")
        void partition() {
            var result = execute("review", batchFile.toString());
            assertEquals(0, result.exitCode());
            String out = result.output();
            assertTrue(out.contains("4 action(s): 2 auto-approved, 2 awaiting approval"));
            assertTrue(out.contains("Export CRM data (reversible)"));
            assertTrue(out.contains("Total estimated savings: $55,600.00"));
        }

        @Test
        @DisplayName("does not touch the running engine")
        void preview() {
            execute("review", batchFile.toString());
            assertTrue(engine.approvalGate().pendingActions().isEmpty());
        }

        @Test
        @DisplayName("unreadable file is reported")
        void missingFile() {
            var result = execute("review", tempDir.resolve("nope.json").toString());
            assertTrue(result.output().contains("Cannot read action batch"));
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("dry run executes auto-approved actions only")
        void dryRun() {
            var result = execute("run", batchFile.toString());
            String out = result.output();

            assertEquals(0, result.exitCode());
            assertTrue(out.contains("(dry run)"));
            assertTrue(out.contains("Would categorize 2 transaction(s) as 'software'"));
            assertTrue(out.contains("[DRY-RUN] Remind late payer"));
            assertTrue(out.contains("Still awaiting approval"));
            assertEquals(InMemoryTransactionLedger.UNCATEGORIZED, ledger.categoryOf("txn-1"));
        }

        @Test
        @DisplayName("--live with approvals executes approved actions for real")
        void live() {
            var result = execute("run", batchFile.toString(), "--approve", "a3", "--reject", "a4",
                    "--as", "controller", "--live");
            String out = result.output();

            assertTrue(out.contains("Approved a3"));
            assertTrue(out.contains("Rejected a4"));
            assertTrue(out.contains("Categorized 2 transaction(s) as 'software'"));
            assertTrue(out.contains("[LOGGED] Cancel unused CRM"));
            assertEquals("software", ledger.categoryOf("txn-1"));
            assertEquals(ActionStatus.REJECTED, engine.approvalGate().getAction("a4").orElseThrow().getStatus());
            assertEquals(3, engine.summary().totalExecuted());
        }

        @Test
        @DisplayName("a single approver cannot complete a multi-party action")
        void multiParty() {
            execute("run", batchFile.toString(), "--approve", "a4", "--as", "cfo");
            assertEquals(ActionStatus.PROPOSED, engine.approvalGate().getAction("a4").orElseThrow().getStatus());
        }
    }
}
