package com.qa.trust.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger flakyTestCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.flakyTestCount = registry.gauge("flaky.tests.active", new AtomicInteger(0));
    }

    public void recordRecordBuilt(boolean deploymentAllowed) {
        Counter.builder("record.built.count")
                .tag("deployment_allowed", String.valueOf(deploymentAllowed))
                .register(registry)
                .increment();
    }

    public void recordHashVerification(boolean valid) {
        Counter.builder("record.verification.count")
                .tag("result", valid ? "valid" : "mismatch")
                .register(registry)
                .increment();
    }

    public void recordClaimCheck(boolean verified, double trustScore) {
        Counter.builder("claim.check.count")
                .tag("verified", String.valueOf(verified))
                .register(registry)
                .increment();

        DistributionSummary.builder("claim.trust_score")
                .register(registry)
                .record(trustScore);
    }

    public void recordDiscrepancy(String kind, String severity) {
        Counter.builder("claim.discrepancy.count")
                .tag("kind", kind)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDeceptionScore(String tier, double overallScore) {
        Counter.builder("deception.score.count")
                .tag("tier", tier)
                .register(registry)
                .increment();

        DistributionSummary.builder("deception.overall_score")
                .tag("tier", tier)
                .register(registry)
                .record(overallScore);
    }

    public void recordAlert(String project) {
        Counter.builder("alert.fired.count")
                .tag("project", project)
                .register(registry)
                .increment();
    }

    public void recordCallbackFailure(String callback) {
        Counter.builder("alert.callback.failures")
                .tag("callback", callback)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStorageFailure(String store) {
        Counter.builder("storage.failure.count")
                .tag("store", store)
                .register(registry)
                .increment();
    }

    public void updateFlakyTestCount(int count) {
        flakyTestCount.set(count);
    }
}
