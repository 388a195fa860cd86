package com.fiscalpilot.dispatch.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiscalpilot.core.model.ActionStep;
import com.fiscalpilot.core.model.ActionType;
import com.fiscalpilot.core.model.ApprovalLevel;
import com.fiscalpilot.core.model.ProposedAction;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON array of proposed actions, as produced by the analysis side, into
 * {@link ProposedAction} instances. Field names are snake_case.
 */
public class ActionBatchReader {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<ProposedAction> read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public List<ProposedAction> read(InputStream in) throws IOException {
        List<ActionEntry> entries = objectMapper.readValue(in, new TypeReference<List<ActionEntry>>() {});
        var actions = new ArrayList<ProposedAction>(entries.size());
        var seen = new HashSet<String>();
        for (ActionEntry entry : entries) {
            if (entry.id() == null || entry.id().isBlank()) {
                throw new IOException("Action entry without an id: " + entry.title());
            }
            if (!seen.add(entry.id())) {
                throw new IOException("Duplicate action id in batch: " + entry.id());
            }
            actions.add(toAction(entry));
        }
        return actions;
    }

    private static ProposedAction toAction(ActionEntry entry) throws IOException {
        ActionType type;
        ApprovalLevel level = null;
        try {
            type = entry.actionType() != null ? ActionType.fromValue(entry.actionType()) : ActionType.CUSTOM;
            if (entry.approvalLevel() != null) {
                level = ApprovalLevel.fromValue(entry.approvalLevel());
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Action " + entry.id() + ": " + e.getMessage(), e);
        }

        var action = new ProposedAction(entry.id(), entry.title(), entry.description(), type,
                level, entry.estimatedSavings() != null ? entry.estimatedSavings() : 0.0);
        if (entry.confidence() != null) {
            action.setConfidence(entry.confidence());
        }
        if (entry.steps() != null) {
            action.setSteps(entry.steps());
        }
        if (entry.parameters() != null) {
            action.setParameters(entry.parameters());
        }
        if (entry.findingIds() != null) {
            action.setFindingIds(entry.findingIds());
        }
        action.setExecutor(entry.executor());
        return action;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ActionEntry(
        String id,
        String title,
        String description,
        @JsonProperty("action_type") String actionType,
        @JsonProperty("approval_level") String approvalLevel,
        @JsonProperty("estimated_savings") Double estimatedSavings,
        Double confidence,
        List<ActionStep> steps,
        Map<String, Object> parameters,
        @JsonProperty("finding_ids") List<String> findingIds,
        String executor
    ) {}
}
