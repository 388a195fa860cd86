package com.fiscalpilot.core.approval;

import com.fiscalpilot.core.events.PipelineEvent;
import com.fiscalpilot.core.events.PipelineEventBus;
import com.fiscalpilot.core.logging.MdcContext;
import com.fiscalpilot.core.metrics.PipelineMetrics;
import com.fiscalpilot.core.model.ActionStatus;
import com.fiscalpilot.core.model.ApprovalDecision;
import com.fiscalpilot.core.model.ApprovalLevel;
import com.fiscalpilot.core.model.ApprovalNotification;
import com.fiscalpilot.core.model.ApprovalRule;
import com.fiscalpilot.core.model.DecisionType;
import com.fiscalpilot.core.model.ProcessOutcome;
import com.fiscalpilot.core.model.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes proposed actions through tiered human oversight.
 * <ul>
 *   <li>GREEN actions auto-approve immediately.</li>
 *   <li>YELLOW actions auto-approve and queue a notification.</li>
 *   <li>RED and CRITICAL actions wait in the pending queue for {@link #approve} or {@link #reject},
 *       with multi-party sign-off when the tier's {@link ApprovalRule} requires it.</li>
 * </ul>
 * Every decision is appended to a ledger that is never edited. The pending queue,
 * ledger and notification queue are owned by this instance; mutating entry points are
 * serialized on the instance monitor.
 */
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    public static final String SYSTEM_ACTOR = "system:auto";

    private final Map<ApprovalLevel, ApprovalRule> rules = new EnumMap<>(ApprovalLevel.class);
    private final boolean requireApproval;
    private final boolean autoApproveGreen;
    private final boolean autoApproveYellow;
    private final PipelineEventBus eventBus;
    private final PipelineMetrics metrics;

    /** Actions held for a human decision, in arrival order, with the time they were queued. */
    private final Map<String, ProposedAction> pending = new LinkedHashMap<>();
    private final Map<String, Instant> queuedAt = new LinkedHashMap<>();
    private final List<ApprovalDecision> decisions = new ArrayList<>();
    private final List<ApprovalNotification> notifications = new ArrayList<>();

    public ApprovalGate() {
        this(List.of(), true, true, true);
    }

    public ApprovalGate(List<ApprovalRule> rules, boolean requireApproval,
                        boolean autoApproveGreen, boolean autoApproveYellow) {
        this(rules, requireApproval, autoApproveGreen, autoApproveYellow, null, null);
    }

    public ApprovalGate(List<ApprovalRule> rules, boolean requireApproval,
                        boolean autoApproveGreen, boolean autoApproveYellow,
                        PipelineEventBus eventBus, PipelineMetrics metrics) {
        if (rules != null) {
            for (ApprovalRule rule : rules) {
                this.rules.put(rule.level(), rule);
            }
        }
        this.requireApproval = requireApproval;
        this.autoApproveGreen = autoApproveGreen;
        this.autoApproveYellow = autoApproveYellow;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Routes a batch through the gate, in the order given.
     * <p>
     * Auto-approved actions come back APPROVED and may be executed immediately.
     * The rest stay PROPOSED and are held in the pending queue.
     * <p>
     * Some inputs appear in neither list of the returned outcome, so callers must not assume
     * {@code autoApproved + needsApproval} covers the batch:
     * <ul>
     *   <li>actions that are no longer PROPOSED are skipped untouched;</li>
     *   <li>an action whose id the gate already holds is skipped, and the held instance keeps
     *       its place and queue time.</li>
     * </ul>
     * Both cases log a warning and record no decision.
     */
    public synchronized ProcessOutcome process(List<ProposedAction> actions) {
        var autoApproved = new ArrayList<ProposedAction>();
        var needsApproval = new ArrayList<ProposedAction>();

        for (ProposedAction action : actions) {
            MdcContext.setAction(action.getId(), action.getActionType().value());
            try {
                if (action.getStatus() != ActionStatus.PROPOSED) {
                    log.warn("Action {} is in state {}, not routing it through the gate",
                            action.getId(), action.getStatus());
                    continue;
                }
                if (pending.containsKey(action.getId())) {
                    log.warn("Action {} is already held by the gate (status {}), ignoring the duplicate",
                            action.getId(), pending.get(action.getId()).getStatus());
                    continue;
                }

                if (!requireApproval) {
                    autoApprove(action, "Approval disabled globally");
                    autoApproved.add(action);
                    continue;
                }

                ApprovalLevel level = action.getApprovalLevel();
                if (level == ApprovalLevel.GREEN && autoApproveGreen) {
                    autoApprove(action, "Green auto-approve");
                    autoApproved.add(action);
                    log.debug("Auto-approved GREEN action: {}", action.getTitle());
                } else if (level == ApprovalLevel.YELLOW && autoApproveYellow) {
                    autoApprove(action, "Yellow auto-approve + notify");
                    autoApproved.add(action);
                    queueNotification(action);
                    log.debug("Auto-approved YELLOW action: {} (notification queued)", action.getTitle());
                } else {
                    hold(action);
                    needsApproval.add(action);
                    log.info("Action '{}' requires {} approval, queued for review",
                            action.getTitle(), level.value());
                }
            } finally {
                MdcContext.clearAction();
            }
        }

        return new ProcessOutcome(autoApproved, needsApproval);
    }

    /**
     * Approves pending actions on behalf of {@code approver}.
     * <p>
     * When the action's tier requires every named approver, each call records one
     * sign-off and logs a {@code partial_approval} decision until all named approvers
     * have approved. Ids that are unknown or no longer PROPOSED are skipped.
     *
     * @param actionIds     ids to approve
     * @param approver      free-form identity; not authenticated here
     * @param reason        optional reason, recorded in the ledger
     * @param modifications optional per-action edits (action id to field changes) applied on final approval
     * @return the actions that became APPROVED in this call
     */
    public synchronized List<ProposedAction> approve(List<String> actionIds, String approver, String reason,
                                                     Map<String, Map<String, Object>> modifications) {
        var approved = new ArrayList<ProposedAction>();
        Map<String, Map<String, Object>> mods = modifications != null ? modifications : Map.of();

        for (String actionId : actionIds) {
            ProposedAction action = pending.get(actionId);
            if (action == null) {
                log.warn("Action {} not found in pending queue", actionId);
                continue;
            }
            if (action.getStatus() != ActionStatus.PROPOSED) {
                log.warn("Action {} is in state {}, cannot approve", actionId, action.getStatus());
                continue;
            }

            MdcContext.setAction(action.getId(), action.getActionType().value());
            try {
                ApprovalRule rule = rules.get(action.getApprovalLevel());
                if (rule != null && rule.isMultiParty()) {
                    action.recordApproval(approver);
                    long signed = rule.approvers().stream().filter(action.getApprovals()::contains).count();
                    if (signed < rule.approvers().size()) {
                        String progress = String.format("Multi-party: %d/%d", signed, rule.approvers().size());
                        log.info("Action {}: {}/{} approvals received", actionId, signed, rule.approvers().size());
                        recordDecision(action, DecisionType.PARTIAL_APPROVAL, approver, progress);
                        continue;
                    }
                }

                if (mods.containsKey(actionId)) {
                    List<String> ignored = action.applyModifications(mods.get(actionId));
                    if (!ignored.isEmpty()) {
                        log.warn("Ignored unsupported modifications {} on action {}", ignored, actionId);
                    }
                }

                action.markApproved(approver, Instant.now());
                approved.add(action);
                recordDecision(action, DecisionType.APPROVED, approver, reason);
                log.info("Approved action: {} (by {})", action.getTitle(), approver);
            } finally {
                MdcContext.clearAction();
            }
        }

        return approved;
    }

    public List<ProposedAction> approve(List<String> actionIds, String approver, String reason) {
        return approve(actionIds, approver, reason, null);
    }

    public List<ProposedAction> approve(List<String> actionIds, String approver) {
        return approve(actionIds, approver, "", null);
    }

    /**
     * Rejects pending actions. Ids that are unknown or no longer PROPOSED are skipped.
     *
     * @return the actions that became REJECTED in this call
     */
    public synchronized List<ProposedAction> reject(List<String> actionIds, String rejector, String reason) {
        var rejected = new ArrayList<ProposedAction>();
        for (String actionId : actionIds) {
            ProposedAction action = pending.get(actionId);
            if (action == null) {
                log.warn("Action {} not found in pending queue", actionId);
                continue;
            }
            if (action.getStatus() != ActionStatus.PROPOSED) {
                log.warn("Action {} is in state {}, cannot reject", actionId, action.getStatus());
                continue;
            }

            action.transitionTo(ActionStatus.REJECTED);
            rejected.add(action);
            recordDecision(action, DecisionType.REJECTED, rejector, reason);
            log.info("Rejected action: {} (by {}, reason: {})", action.getTitle(), rejector, reason);
        }
        return rejected;
    }

    public List<ProposedAction> reject(List<String> actionIds, String rejector) {
        return reject(actionIds, rejector, "");
    }

    /** Actions still waiting for a human decision. */
    public synchronized List<ProposedAction> pendingActions() {
        return pending.values().stream()
                .filter(a -> a.getStatus() == ActionStatus.PROPOSED)
                .toList();
    }

    /** Actions held by this gate that a human has approved and that have not been executed yet. */
    public synchronized List<ProposedAction> approvedActions() {
        return pending.values().stream()
                .filter(ProposedAction::isActionable)
                .toList();
    }

    /**
     * Pending actions whose tier timeout has elapsed since they were queued.
     * Advisory only: the host decides whether to reject them.
     */
    public synchronized List<ProposedAction> expiredPendingActions(Instant now) {
        var expired = new ArrayList<ProposedAction>();
        for (ProposedAction action : pending.values()) {
            if (action.getStatus() != ActionStatus.PROPOSED) {
                continue;
            }
            ApprovalRule rule = rules.get(action.getApprovalLevel());
            if (rule == null || rule.timeoutHours() <= 0) {
                continue;
            }
            Instant deadline = queuedAt.get(action.getId()).plus(Duration.ofHours(rule.timeoutHours()));
            if (!now.isBefore(deadline)) {
                expired.add(action);
            }
        }
        return expired;
    }

    /** Looks up an action held by the gate. */
    public synchronized Optional<ProposedAction> getAction(String actionId) {
        return Optional.ofNullable(pending.get(actionId));
    }

    public Optional<ApprovalRule> ruleFor(ApprovalLevel level) {
        return Optional.ofNullable(rules.get(level));
    }

    /** Full audit trail of approval decisions, oldest first. */
    public synchronized List<ApprovalDecision> decisions() {
        return List.copyOf(decisions);
    }

    /** Notifications queued for auto-approved YELLOW actions. */
    public synchronized List<ApprovalNotification> notifications() {
        return List.copyOf(notifications);
    }

    /** Returns the queued notifications and empties the queue, for a delivery sink. */
    public synchronized List<ApprovalNotification> drainNotifications() {
        var drained = List.copyOf(notifications);
        notifications.clear();
        return drained;
    }

    public boolean isRequireApproval() {
        return requireApproval;
    }

    // -- internals -----------------------------------------------------------

    private void autoApprove(ProposedAction action, String reason) {
        action.markApproved(SYSTEM_ACTOR, Instant.now());
        recordDecision(action, DecisionType.APPROVED, SYSTEM_ACTOR, reason);
    }

    private void hold(ProposedAction action) {
        pending.put(action.getId(), action);
        queuedAt.put(action.getId(), Instant.now());
        publish("action.queued", action, SYSTEM_ACTOR, Map.of("level", action.getApprovalLevel().value()));
    }

    private void queueNotification(ProposedAction action) {
        var notification = new ApprovalNotification(
                action.getId(),
                action.getTitle(),
                action.getApprovalLevel(),
                String.format(Locale.US, "Auto-approved action: %s (saves $%,.2f)",
                        action.getTitle(), action.getEstimatedSavings()));
        notifications.add(notification);
        publish("action.notification", action, SYSTEM_ACTOR, Map.of("message", notification.message()));
    }

    private void recordDecision(ProposedAction action, DecisionType decision, String decidedBy, String reason) {
        var entry = new ApprovalDecision(action.getId(), decision, decidedBy, reason, Instant.now());
        decisions.add(entry);
        if (metrics != null) {
            metrics.recordApprovalDecision(decision.value(), action.getApprovalLevel().value());
        }
        publish("action." + decision.value(), action, decidedBy,
                Map.of("level", action.getApprovalLevel().value(), "reason", entry.reason()));
    }

    private void publish(String type, ProposedAction action, String actor, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new PipelineEvent(type, action.getId(), actor, payload, Instant.now()));
        }
    }
}
