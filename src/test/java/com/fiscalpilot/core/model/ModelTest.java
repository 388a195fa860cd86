package com.fiscalpilot.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static ProposedAction action(ActionType type) {
        return new ProposedAction("act-1", "Cancel unused SaaS", "Nobody logged in for 90 days", type, 1200.0);
    }

    @Nested
    @DisplayName("ApprovalLevel")
    class ApprovalLevelTests {

        @Test
        @DisplayName("tiers are ordered from least to most oversight")
        void ordered() {
            assertTrue(ApprovalLevel.CRITICAL.isAtLeast(ApprovalLevel.RED));
            assertTrue(ApprovalLevel.RED.isAtLeast(ApprovalLevel.RED));
            assertFalse(ApprovalLevel.YELLOW.isAtLeast(ApprovalLevel.RED));
        }

        @Test
        @DisplayName("only GREEN and YELLOW are auto-approvable")
        void autoApprovable() {
            assertTrue(ApprovalLevel.GREEN.isAutoApprovable());
            assertTrue(ApprovalLevel.YELLOW.isAutoApprovable());
            assertFalse(ApprovalLevel.RED.isAutoApprovable());
            assertFalse(ApprovalLevel.CRITICAL.isAutoApprovable());
        }

        @Test
        @DisplayName("parses wire values and enum names case-insensitively")
        void fromValue() {
            assertEquals(ApprovalLevel.CRITICAL, ApprovalLevel.fromValue("critical"));
            assertEquals(ApprovalLevel.YELLOW, ApprovalLevel.fromValue("YELLOW"));
            assertThrows(IllegalArgumentException.class, () -> ApprovalLevel.fromValue("purple"));
        }
    }

    @Nested
    @DisplayName("ActionType")
    class ActionTypeTests {

        @Test
        @DisplayName("there are fifteen action types with snake_case wire values")
        void wireValues() {
            assertEquals(15, ActionType.values().length);
            assertEquals("categorize_transaction", ActionType.CATEGORIZE_TRANSACTION.value());
            assertEquals("modify_tax_filing", ActionType.MODIFY_TAX_FILING.value());
            assertEquals(ActionType.PAY_INVOICE, ActionType.fromValue("pay_invoice"));
        }

        @Test
        @DisplayName("unknown wire value is rejected")
        void unknown() {
            assertThrows(IllegalArgumentException.class, () -> ActionType.fromValue("launch_rocket"));
        }
    }

    @Nested
    @DisplayName("DefaultApprovalLevels")
    class DefaultApprovalLevelsTests {

        @Test
        @DisplayName("every action type has a default tier")
        void complete() {
            for (ActionType type : ActionType.values()) {
                assertNotNull(DefaultApprovalLevels.forType(type), type.name());
            }
            assertEquals(ActionType.values().length, DefaultApprovalLevels.table().size());
        }

        @Test
        @DisplayName("representative assignments")
        void assignments() {
            assertEquals(ApprovalLevel.GREEN, DefaultApprovalLevels.forType(ActionType.CATEGORIZE_TRANSACTION));
            assertEquals(ApprovalLevel.GREEN, DefaultApprovalLevels.forType(ActionType.FLAG_FOR_REVIEW));
            assertEquals(ApprovalLevel.YELLOW, DefaultApprovalLevels.forType(ActionType.SEND_REMINDER));
            assertEquals(ApprovalLevel.YELLOW, DefaultApprovalLevels.forType(ActionType.UPDATE_CATEGORY_BULK));
            assertEquals(ApprovalLevel.RED, DefaultApprovalLevels.forType(ActionType.TRANSFER_FUNDS));
            assertEquals(ApprovalLevel.RED, DefaultApprovalLevels.forType(ActionType.CUSTOM));
            assertEquals(ApprovalLevel.CRITICAL, DefaultApprovalLevels.forType(ActionType.CHANGE_PAYROLL));
            assertEquals(ApprovalLevel.CRITICAL, DefaultApprovalLevels.forType(ActionType.CLOSE_ACCOUNT));
        }

        @Test
        @DisplayName("missing type falls back to RED")
        void fallback() {
            assertEquals(ApprovalLevel.RED, DefaultApprovalLevels.FALLBACK);
            assertEquals(ApprovalLevel.RED, DefaultApprovalLevels.forType(null));
        }
    }

    @Nested
    @DisplayName("ActionStatus")
    class ActionStatusTests {

        @Test
        @DisplayName("allows only the lifecycle edges")
        void edges() {
            assertTrue(ActionStatus.PROPOSED.canTransitionTo(ActionStatus.APPROVED));
            assertTrue(ActionStatus.PROPOSED.canTransitionTo(ActionStatus.REJECTED));
            assertTrue(ActionStatus.APPROVED.canTransitionTo(ActionStatus.EXECUTING));
            assertTrue(ActionStatus.APPROVED.canTransitionTo(ActionStatus.FAILED));
            assertTrue(ActionStatus.EXECUTING.canTransitionTo(ActionStatus.COMPLETED));
            assertTrue(ActionStatus.EXECUTING.canTransitionTo(ActionStatus.FAILED));
            assertTrue(ActionStatus.COMPLETED.canTransitionTo(ActionStatus.ROLLED_BACK));

            assertFalse(ActionStatus.PROPOSED.canTransitionTo(ActionStatus.EXECUTING));
            assertFalse(ActionStatus.REJECTED.canTransitionTo(ActionStatus.APPROVED));
            assertFalse(ActionStatus.FAILED.canTransitionTo(ActionStatus.ROLLED_BACK));
            assertFalse(ActionStatus.ROLLED_BACK.canTransitionTo(ActionStatus.COMPLETED));
        }

        @Test
        @DisplayName("terminal states")
        void terminal() {
            assertTrue(ActionStatus.REJECTED.isTerminal());
            assertTrue(ActionStatus.FAILED.isTerminal());
            assertTrue(ActionStatus.ROLLED_BACK.isTerminal());
            assertFalse(ActionStatus.PROPOSED.isTerminal());
            assertFalse(ActionStatus.APPROVED.isTerminal());
        }
    }

    @Nested
    @DisplayName("ProposedAction")
    class ProposedActionTests {

        @Test
        @DisplayName("new action is PROPOSED with defaults")
        void defaults() {
            var a = action(ActionType.CANCEL_SUBSCRIPTION);
            assertEquals(ActionStatus.PROPOSED, a.getStatus());
            assertEquals(ApprovalLevel.RED, a.getApprovalLevel());
            assertEquals(0.8, a.getConfidence());
            assertNotNull(a.getCreatedAt());
            assertNull(a.getApprovedAt());
            assertNull(a.getApprovedBy());
            assertTrue(a.getSteps().isEmpty());
            assertTrue(a.getParameters().isEmpty());
        }

        @Test
        @DisplayName("explicit tier overrides the default table")
        void override() {
            var a = new ProposedAction("x", "t", "d", ActionType.CATEGORIZE_TRANSACTION, ApprovalLevel.CRITICAL, 10);
            assertEquals(ApprovalLevel.CRITICAL, a.getApprovalLevel());
        }

        @Test
        @DisplayName("markApproved stamps approver and time")
        void markApproved() {
            var a = action(ActionType.PAY_INVOICE);
            Instant when = Instant.parse("2025-01-01T10:00:00Z");
            a.markApproved("cfo@acme.test", when);

            assertEquals(ActionStatus.APPROVED, a.getStatus());
            assertEquals("cfo@acme.test", a.getApprovedBy());
            assertEquals(when, a.getApprovedAt());
            assertTrue(a.isActionable());
        }

        @Test
        @DisplayName("illegal transition throws")
        void illegalTransition() {
            var a = action(ActionType.PAY_INVOICE);
            var ex = assertThrows(IllegalStateException.class, () -> a.transitionTo(ActionStatus.COMPLETED));
            assertTrue(ex.getMessage().contains("act-1"));
            assertEquals(ActionStatus.PROPOSED, a.getStatus());
        }

        @Test
        @DisplayName("recordApproval reports repeated identities")
        void recordApproval() {
            var a = action(ActionType.CLOSE_ACCOUNT);
            assertTrue(a.recordApproval("alice"));
            assertFalse(a.recordApproval("alice"));
            assertTrue(a.recordApproval("bob"));
            assertEquals(List.of("alice", "bob"), List.copyOf(a.getApprovals()));
        }

        @Test
        @DisplayName("applyModifications edits allowed fields and reports the rest")
        void modifications() {
            var a = action(ActionType.PAY_INVOICE);
            var changes = new HashMap<String, Object>();
            changes.put("title", "Pay invoice #42 (partial)");
            changes.put("estimated_savings", 300);
            changes.put("parameters", Map.of("amount", 150));
            changes.put("status", "completed");

            List<String> ignored = a.applyModifications(changes);

            assertEquals("Pay invoice #42 (partial)", a.getTitle());
            assertEquals(300.0, a.getEstimatedSavings());
            assertEquals(150, a.getParameters().get("amount"));
            assertEquals(List.of("status"), ignored);
            assertEquals(ActionStatus.PROPOSED, a.getStatus());
        }

        @Test
        @DisplayName("list parameters accept a single scalar")
        void listParameter() {
            var a = action(ActionType.TAG_EXPENSE);
            a.setParameters(Map.of("transaction_ids", "txn-1", "category", "travel"));
            assertEquals(List.of("txn-1"), a.stringListParameter("transaction_ids"));
            assertEquals("travel", a.stringParameter("category"));
            assertTrue(a.stringListParameter("missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("ExecutionResult")
    class ExecutionResultTests {

        @Test
        @DisplayName("completed and rolled back results count as succeeded")
        void succeeded() {
            assertTrue(ExecutionResult.completed("a", "ok", Map.of(), false, true).succeeded());
            assertTrue(ExecutionResult.rolledBack("a", "undone", Map.of()).succeeded());
            assertFalse(ExecutionResult.failed("a", "boom", "err", false).succeeded());
        }

        @Test
        @DisplayName("failed results never offer rollback")
        void failedNoRollback() {
            var r = ExecutionResult.failed("a", "boom", "err", false);
            assertFalse(r.rollbackAvailable());
            assertEquals("err", r.error());
        }

        @Test
        @DisplayName("details are copied and unmodifiable, null values allowed")
        void details() {
            var source = new HashMap<String, Object>();
            source.put("k", null);
            var r = ExecutionResult.completed("a", "ok", source, true, false);
            source.put("other", 1);

            assertTrue(r.details().containsKey("k"));
            assertFalse(r.details().containsKey("other"));
            assertThrows(UnsupportedOperationException.class, () -> r.details().put("x", 1));
        }
    }

    @Nested
    @DisplayName("ApprovalRule")
    class ApprovalRuleTests {

        @Test
        @DisplayName("multi-party only when require-all and approvers are set")
        void multiParty() {
            assertTrue(new ApprovalRule(ApprovalLevel.CRITICAL, List.of("cfo", "ceo"), true).isMultiParty());
            assertFalse(new ApprovalRule(ApprovalLevel.CRITICAL, List.of("cfo", "ceo"), false).isMultiParty());
            assertFalse(new ApprovalRule(ApprovalLevel.CRITICAL, List.of(), true).isMultiParty());
        }

        @Test
        @DisplayName("default timeout is 48 hours")
        void defaultTimeout() {
            assertEquals(48, new ApprovalRule(ApprovalLevel.RED, List.of(), false).timeoutHours());
        }
    }
}
