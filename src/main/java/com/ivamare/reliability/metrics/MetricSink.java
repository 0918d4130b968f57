package com.ivamare.reliability.metrics;

import java.util.Map;

/**
 * Receiver for the metric stream produced by the reliability core.
 *
 * <p>The breaker registry, audit ledger, batching engine and job manager only
 * ever write to this interface. Implementations must be thread-safe and must not
 * call back into the core.
 */
public interface MetricSink {

    /**
     * Record a fully formed sample.
     *
     * @param sample the sample
     */
    void record(MetricSample sample);

    /**
     * Record a sample stamped with the sink's own clock.
     *
     * @param category Metric category
     * @param name Metric name
     * @param value Value
     * @param unit Unit
     * @param tags Tags (nullable)
     */
    void recordMetric(String category, String name, double value, String unit, Map<String, Object> tags);

    /**
     * Record a business metric under {@code business.<category>.<name>}.
     */
    void recordBusinessMetric(MetricCategory category, String name, double value, String unit,
                              Map<String, Object> tags);

    /**
     * Record an SLA metric under {@code sla.<name>} and evaluate it against the
     * configured thresholds for that name.
     *
     * @param target Target value the caller aims for
     */
    void recordSlaMetric(String name, double value, String unit, double target, Map<String, Object> tags);

    /**
     * Raise an alert.
     *
     * @param alert the alert; an unset {@code raisedAt} is stamped by the sink
     */
    void raiseAlert(Alert alert);
}
