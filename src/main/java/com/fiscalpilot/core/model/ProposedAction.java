package com.fiscalpilot.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A candidate operation produced by the analysis layer.
 * <p>
 * Instances are mutated in place as they move through the pipeline and are passed
 * by reference between the approval gate and the execution engine. Status changes
 * go through {@link #transitionTo(ActionStatus)}, which only allows forward moves.
 * Not thread-safe: callers sharing an instance across threads must serialize access.
 */
public class ProposedAction {

    private final String id;
    private String title;
    private String description;
    private final ActionType actionType;
    private ApprovalLevel approvalLevelOverride;
    private ActionStatus status = ActionStatus.PROPOSED;
    private List<ActionStep> steps = new ArrayList<>();
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private double estimatedSavings;
    private double confidence = 0.8;
    private List<String> findingIds = new ArrayList<>();
    private String executor;
    private final Instant createdAt;
    private Instant approvedAt;
    private Instant executedAt;
    private Instant completedAt;
    private String approvedBy;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Set<String> approvals = new LinkedHashSet<>();

    public ProposedAction(String id, String title, String description,
                          ActionType actionType, double estimatedSavings) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title != null ? title : "";
        this.description = description != null ? description : "";
        this.actionType = actionType != null ? actionType : ActionType.CUSTOM;
        this.estimatedSavings = estimatedSavings;
        this.createdAt = Instant.now();
    }

    public ProposedAction(String id, String title, String description,
                          ActionType actionType, ApprovalLevel approvalLevel, double estimatedSavings) {
        this(id, title, description, actionType, estimatedSavings);
        this.approvalLevelOverride = approvalLevel;
    }

    // -- lifecycle -----------------------------------------------------------

    /**
     * Moves this action to {@code next}.
     *
     * @throws IllegalStateException if the move is not an edge of the status graph
     */
    public void transitionTo(ActionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Action " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    public boolean canTransitionTo(ActionStatus next) {
        return status.canTransitionTo(next);
    }

    /** Ready for the execution engine. */
    public boolean isActionable() {
        return status == ActionStatus.APPROVED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** PROPOSED to APPROVED, stamping who approved and when. */
    public void markApproved(String approver, Instant when) {
        transitionTo(ActionStatus.APPROVED);
        this.approvedBy = approver;
        this.approvedAt = when;
    }

    /**
     * Records the approval of one party in a multi-party sign-off.
     *
     * @return false when this identity had already approved
     */
    public boolean recordApproval(String approver) {
        return approvals.add(approver);
    }

    /** Identities that have approved so far, in arrival order. */
    public Set<String> getApprovals() {
        return Collections.unmodifiableSet(approvals);
    }

    /**
     * Applies reviewer edits made at approval time. Identity, status and lifecycle
     * timestamps are not editable.
     *
     * @return the keys that were not recognised and therefore ignored
     */
    @SuppressWarnings("unchecked")
    public List<String> applyModifications(Map<String, Object> changes) {
        var ignored = new ArrayList<String>();
        if (changes == null) {
            return ignored;
        }
        for (var entry : changes.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "title" -> setTitle(String.valueOf(value));
                case "description" -> setDescription(String.valueOf(value));
                case "parameters" -> {
                    if (value instanceof Map<?, ?> map) {
                        setParameters((Map<String, Object>) map);
                    } else {
                        ignored.add(entry.getKey());
                    }
                }
                case "estimated_savings", "estimatedSavings" -> {
                    if (value instanceof Number n) {
                        setEstimatedSavings(n.doubleValue());
                    } else {
                        ignored.add(entry.getKey());
                    }
                }
                case "confidence" -> {
                    if (value instanceof Number n) {
                        setConfidence(n.doubleValue());
                    } else {
                        ignored.add(entry.getKey());
                    }
                }
                case "executor" -> setExecutor(value != null ? String.valueOf(value) : null);
                default -> ignored.add(entry.getKey());
            }
        }
        return ignored;
    }

    // -- parameter helpers ---------------------------------------------------

    public String stringParameter(String key) {
        Object value = parameters.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    /** A list-valued parameter; a single scalar is treated as a one-element list. */
    public List<String> stringListParameter(String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Iterable<?> items) {
            var result = new ArrayList<String>();
            for (Object item : items) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
            return result;
        }
        return List.of(String.valueOf(value));
    }

    // -- accessors -----------------------------------------------------------

    public String getId() { return id; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public ActionType getActionType() { return actionType; }

    /** The explicit override if one was set, otherwise the default tier for the action type. */
    public ApprovalLevel getApprovalLevel() {
        return approvalLevelOverride != null ? approvalLevelOverride : DefaultApprovalLevels.forType(actionType);
    }

    public void setApprovalLevel(ApprovalLevel approvalLevel) { this.approvalLevelOverride = approvalLevel; }
    public ActionStatus getStatus() { return status; }
    public List<ActionStep> getSteps() { return Collections.unmodifiableList(steps); }
    public void setSteps(List<ActionStep> steps) { this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>(); }
    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
    }
    public double getEstimatedSavings() { return estimatedSavings; }
    public void setEstimatedSavings(double estimatedSavings) { this.estimatedSavings = estimatedSavings; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }
    public List<String> getFindingIds() { return Collections.unmodifiableList(findingIds); }
    public void setFindingIds(List<String> findingIds) {
        this.findingIds = findingIds != null ? new ArrayList<>(findingIds) : new ArrayList<>();
    }

    /** Name of an executor that should handle this action regardless of its type, or null. */
    public String getExecutor() { return executor; }
    public void setExecutor(String executor) { this.executor = executor; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getApprovedAt() { return approvedAt; }
    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public String getApprovedBy() { return approvedBy; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "ProposedAction{id=" + id + ", type=" + actionType.value() + ", level=" + getApprovalLevel().value()
                + ", status=" + status.value() + ", title='" + title + "'}";
    }
}
