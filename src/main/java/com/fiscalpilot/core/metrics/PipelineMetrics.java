package com.fiscalpilot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the approval and execution pipeline.
 */
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordApprovalDecision(String decision, String level) {
        Counter.builder("fiscalpilot.approval.decisions")
                .tag("decision", decision)
                .tag("level", level)
                .register(registry)
                .increment();
    }

    public void recordExecutionResult(String executor, String status, boolean dryRun) {
        Counter.builder("fiscalpilot.execution.results")
                .tag("executor", executor)
                .tag("status", status)
                .tag("dry_run", String.valueOf(dryRun))
                .register(registry)
                .increment();
    }

    public void recordExecutionDuration(String executor, long ms) {
        Timer.builder("fiscalpilot.execution.duration")
                .tag("executor", executor)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRollbackResult(String status) {
        Counter.builder("fiscalpilot.rollback.results")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records actions left untouched because a run hit the per-call cap.
     *
     * @param deferred number of approved actions beyond the cap
     */
    public void recordRateLimited(int deferred) {
        Counter.builder("fiscalpilot.execution.rate_limited")
                .description("Approved actions deferred by the per-run execution cap")
                .register(registry)
                .increment(deferred);
    }
}
