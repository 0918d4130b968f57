package com.ivamare.reliability.metrics;

import java.util.Map;

/**
 * Sink that discards everything.
 */
public final class NoOpMetricSink implements MetricSink {

    public static final NoOpMetricSink INSTANCE = new NoOpMetricSink();

    private NoOpMetricSink() {
    }

    @Override
    public void record(MetricSample sample) {
    }

    @Override
    public void recordMetric(String category, String name, double value, String unit, Map<String, Object> tags) {
    }

    @Override
    public void recordBusinessMetric(MetricCategory category, String name, double value, String unit,
                                     Map<String, Object> tags) {
    }

    @Override
    public void recordSlaMetric(String name, double value, String unit, double target, Map<String, Object> tags) {
    }

    @Override
    public void raiseAlert(Alert alert) {
    }
}
