package com.ivamare.reliability.metrics;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.batching.BatchingEngine;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Read-only aggregation over the monitor and the core services.
 */
public class ReliabilityDashboard {

    private static final Duration AUDIT_WINDOW = Duration.ofDays(1);

    private final ReliabilityMonitor monitor;
    private final CircuitBreakerRegistry breakerRegistry;
    private final BatchingEngine batchingEngine;
    private final AuditLedger auditLedger;
    private final Clock clock;

    public ReliabilityDashboard(
            ReliabilityMonitor monitor,
            CircuitBreakerRegistry breakerRegistry,
            BatchingEngine batchingEngine,
            AuditLedger auditLedger,
            Clock clock) {
        this.monitor = monitor;
        this.breakerRegistry = breakerRegistry;
        this.batchingEngine = batchingEngine;
        this.auditLedger = auditLedger;
        this.clock = clock;
    }

    public DashboardSnapshot snapshot() {
        Instant now = clock.instant();
        return new DashboardSnapshot(
            now,
            breakerRegistry.healthCheck(),
            monitor.getLatestBusinessMetrics(),
            monitor.getComplianceStatus(),
            monitor.getActiveAlerts(),
            monitor.getAlertSummary(),
            monitor.getSlaStatus(),
            batchingEngine.getPerformanceAnalytics(),
            auditLedger.getAuditTrailSummary(now.minus(AUDIT_WINDOW), now));
    }
}
