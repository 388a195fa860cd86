package com.fiscalpilot.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiscalpilot.core.approval.ApprovalGate;
import com.fiscalpilot.core.events.PipelineEvent;
import com.fiscalpilot.core.events.PipelineEventBus;
import com.fiscalpilot.core.model.ActionType;
import com.fiscalpilot.core.model.ProposedAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditJournalTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("writes one JSON line per event")
    void jsonLines() throws Exception {
        var journal = new AuditJournal(tempDir.resolve("audit/journal.jsonl"));

        journal.append(new PipelineEvent("action.rejected", "r1", "cfo", Map.of("reason", "no"),
                Instant.parse("2026-01-05T09:00:00Z")));
        journal.append(new PipelineEvent("action.approved", "r2", "cfo", Map.of(), Instant.now()));

        List<String> lines = Files.readAllLines(journal.getPath());
        assertEquals(2, lines.size());

        var node = new ObjectMapper().readTree(lines.get(0));
        assertEquals("2026-01-05T09:00:00Z", node.get("timestamp").asText());
        assertEquals("action.rejected", node.get("event").asText());
        assertEquals("r1", node.get("action_id").asText());
        assertEquals("cfo", node.get("actor").asText());
        assertEquals("no", node.get("payload").get("reason").asText());
    }

    @Test
    @DisplayName("attached journal records gate decisions until detached")
    void attached() throws Exception {
        var bus = new PipelineEventBus();
        var journal = new AuditJournal(tempDir.resolve("journal.jsonl"));
        journal.attach(bus);
        var gate = new ApprovalGate(List.of(), true, true, true, bus, null);

        gate.process(List.of(new ProposedAction("g1", "Tag", "", ActionType.TAG_EXPENSE, 1)));
        journal.detach();
        gate.process(List.of(new ProposedAction("g2", "Tag", "", ActionType.TAG_EXPENSE, 1)));

        List<String> lines = Files.readAllLines(journal.getPath());
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"action_id\":\"g1\""));
    }

    @Test
    @DisplayName("an unwritable journal does not break publishing")
    void unwritable() throws Exception {
        Path blocker = tempDir.resolve("file");
        Files.writeString(blocker, "x");
        var journal = new AuditJournal(blocker.resolve("journal.jsonl"));

        assertDoesNotThrow(() -> journal.append(
                new PipelineEvent("action.approved", "a1", "cfo", Map.of(), Instant.now())));
    }
}
