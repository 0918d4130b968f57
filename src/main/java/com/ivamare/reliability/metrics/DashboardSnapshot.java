package com.ivamare.reliability.metrics;

import com.ivamare.reliability.audit.AuditTrailSummary;
import com.ivamare.reliability.batching.PerformanceAnalytics;
import com.ivamare.reliability.breaker.BreakerHealth;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the whole reliability core.
 *
 * @param generatedAt When the snapshot was taken
 * @param systemHealth Circuit breaker health check
 * @param businessMetrics Latest value of every business metric seen in the last hour
 * @param complianceStatus Tracked compliance metrics
 * @param activeAlerts Unresolved alerts
 * @param alertSummary Alert counts
 * @param slaStatus Status per SLA metric
 * @param batching Batching analytics
 * @param audit Audit trail summary over the last day
 */
public record DashboardSnapshot(
    Instant generatedAt,
    BreakerHealth systemHealth,
    List<MetricSample> businessMetrics,
    List<ComplianceMetric> complianceStatus,
    List<Alert> activeAlerts,
    AlertSummary alertSummary,
    Map<String, SlaStatus> slaStatus,
    PerformanceAnalytics batching,
    AuditTrailSummary audit
) {
}
