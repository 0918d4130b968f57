package com.ivamare.reliability.metrics;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A discrete alert handed to the metrics collaborator.
 *
 * @param id Unique alert id
 * @param severity Alert severity
 * @param category Alert category
 * @param message Human-readable message
 * @param metric Metric that triggered the alert (nullable)
 * @param value Observed value (nullable)
 * @param threshold Threshold that was crossed (nullable)
 * @param raisedAt When the alert was raised (nullable until the sink stamps it)
 * @param acknowledged Whether an operator acknowledged the alert
 * @param resolvedAt When the alert was resolved (nullable)
 * @param metadata Extra context (never null)
 */
public record Alert(
    String id,
    AlertSeverity severity,
    AlertCategory category,
    String message,
    String metric,
    Double value,
    Double threshold,
    Instant raisedAt,
    boolean acknowledged,
    Instant resolvedAt,
    Map<String, Object> metadata
) {
    public Alert {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Creates an alert without a metric reference.
     */
    public static Alert of(AlertSeverity severity, AlertCategory category, String message,
                           Map<String, Object> metadata) {
        return new Alert(UUID.randomUUID().toString(), severity, category, message,
            null, null, null, null, false, null, metadata);
    }

    /**
     * Creates an alert for a metric that crossed a threshold.
     */
    public static Alert forMetric(AlertSeverity severity, AlertCategory category, String message,
                                  String metric, double value, double threshold,
                                  Map<String, Object> metadata) {
        return new Alert(UUID.randomUUID().toString(), severity, category, message,
            metric, value, threshold, null, false, null, metadata);
    }

    public boolean isActive() {
        return resolvedAt == null;
    }

    public Alert withRaisedAt(Instant instant) {
        return new Alert(id, severity, category, message, metric, value, threshold,
            instant, acknowledged, resolvedAt, metadata);
    }

    public Alert withAcknowledged() {
        return new Alert(id, severity, category, message, metric, value, threshold,
            raisedAt, true, resolvedAt, metadata);
    }

    public Alert withResolvedAt(Instant instant) {
        return new Alert(id, severity, category, message, metric, value, threshold,
            raisedAt, acknowledged, instant, metadata);
    }
}
