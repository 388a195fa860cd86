package com.fiscalpilot.core.config;

import com.fiscalpilot.core.engine.ExecutionEngine;
import com.fiscalpilot.core.model.ApprovalLevel;
import com.fiscalpilot.core.model.ApprovalRule;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "fiscalpilot")
public class PipelineProperties {

    private Approval approval = new Approval();
    private Execution execution = new Execution();
    private Audit audit = new Audit();

    public Approval getApproval() { return approval; }
    public void setApproval(Approval approval) { this.approval = approval; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    /** Configured rules as domain objects, one per tier that has a rule. */
    public List<ApprovalRule> approvalRules() {
        var result = new ArrayList<ApprovalRule>();
        approval.rules.forEach((level, rule) ->
                result.add(new ApprovalRule(level, rule.approvers, rule.requireAll, rule.timeoutHours)));
        return result;
    }

    public static class Approval {
        private boolean requireApproval = true;
        private boolean autoApproveGreen = true;
        private boolean autoApproveYellow = true;
        private Map<ApprovalLevel, Rule> rules = new EnumMap<>(ApprovalLevel.class);

        public boolean isRequireApproval() { return requireApproval; }
        public void setRequireApproval(boolean requireApproval) { this.requireApproval = requireApproval; }
        public boolean isAutoApproveGreen() { return autoApproveGreen; }
        public void setAutoApproveGreen(boolean autoApproveGreen) { this.autoApproveGreen = autoApproveGreen; }
        public boolean isAutoApproveYellow() { return autoApproveYellow; }
        public void setAutoApproveYellow(boolean autoApproveYellow) { this.autoApproveYellow = autoApproveYellow; }
        public Map<ApprovalLevel, Rule> getRules() { return rules; }
        public void setRules(Map<ApprovalLevel, Rule> rules) { this.rules = rules; }
    }

    public static class Rule {
        private List<String> approvers = List.of();
        private boolean requireAll = false;
        private int timeoutHours = ApprovalRule.DEFAULT_TIMEOUT_HOURS;

        public List<String> getApprovers() { return approvers; }
        public void setApprovers(List<String> approvers) { this.approvers = approvers; }
        public boolean isRequireAll() { return requireAll; }
        public void setRequireAll(boolean requireAll) { this.requireAll = requireAll; }
        public int getTimeoutHours() { return timeoutHours; }
        public void setTimeoutHours(int timeoutHours) { this.timeoutHours = timeoutHours; }
    }

    public static class Execution {
        private int maxActionsPerRun = ExecutionEngine.DEFAULT_MAX_ACTIONS_PER_RUN;
        private boolean dryRunByDefault = true;

        public int getMaxActionsPerRun() { return maxActionsPerRun; }
        public void setMaxActionsPerRun(int maxActionsPerRun) { this.maxActionsPerRun = maxActionsPerRun; }
        public boolean isDryRunByDefault() { return dryRunByDefault; }
        public void setDryRunByDefault(boolean dryRunByDefault) { this.dryRunByDefault = dryRunByDefault; }
    }

    public static class Audit {
        /** JSON Lines journal location; journaling is off when empty. */
        private String journalPath = "";

        public String getJournalPath() { return journalPath; }
        public void setJournalPath(String journalPath) { this.journalPath = journalPath; }
    }
}
