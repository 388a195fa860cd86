package com.fiscalpilot.core.config;

import com.fiscalpilot.core.approval.ApprovalGate;
import com.fiscalpilot.core.engine.ExecutionEngine;
import com.fiscalpilot.core.events.PipelineEventBus;
import com.fiscalpilot.core.executor.ActionExecutor;
import com.fiscalpilot.core.executor.CategorizationExecutor;
import com.fiscalpilot.core.executor.InMemoryTransactionLedger;
import com.fiscalpilot.core.executor.LoggingNotificationSender;
import com.fiscalpilot.core.executor.NotificationExecutor;
import com.fiscalpilot.core.executor.NotificationSender;
import com.fiscalpilot.core.executor.TransactionLedger;
import com.fiscalpilot.core.metrics.PipelineMetrics;
import com.fiscalpilot.core.persistence.AuditJournal;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Wires the approval gate, execution engine and bundled executors from {@link PipelineProperties}.
 * Hosts replace the in-memory {@link TransactionLedger} and logging {@link NotificationSender}
 * by declaring their own beans.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public PipelineEventBus pipelineEventBus() {
        return new PipelineEventBus();
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry) {
        return new PipelineMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionLedger transactionLedger() {
        return new InMemoryTransactionLedger();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSender notificationSender() {
        return new LoggingNotificationSender();
    }

    @Bean
    public CategorizationExecutor categorizationExecutor(TransactionLedger ledger) {
        return new CategorizationExecutor(ledger);
    }

    @Bean
    public NotificationExecutor notificationExecutor(NotificationSender sender) {
        return new NotificationExecutor(sender);
    }

    @Bean
    public ApprovalGate approvalGate(PipelineProperties properties, PipelineEventBus eventBus,
                                     @Autowired(required = false) PipelineMetrics metrics) {
        var approval = properties.getApproval();
        return new ApprovalGate(properties.approvalRules(), approval.isRequireApproval(),
                approval.isAutoApproveGreen(), approval.isAutoApproveYellow(), eventBus, metrics);
    }

    /**
     * Executors are registered in bean order; the first one that claims an action wins.
     */
    @Bean
    public ExecutionEngine executionEngine(ApprovalGate approvalGate, List<ActionExecutor> executors,
                                           PipelineProperties properties, PipelineEventBus eventBus,
                                           @Autowired(required = false) PipelineMetrics metrics) {
        var execution = properties.getExecution();
        return new ExecutionEngine(approvalGate, executors, execution.getMaxActionsPerRun(),
                execution.isDryRunByDefault(), eventBus, metrics);
    }

    @Bean
    @ConditionalOnProperty(name = "fiscalpilot.audit.journal-path")
    public AuditJournal auditJournal(PipelineProperties properties, PipelineEventBus eventBus) {
        var journal = new AuditJournal(Path.of(properties.getAudit().getJournalPath()));
        journal.attach(eventBus);
        return journal;
    }
}
