package com.ivamare.reliability.metrics;

/**
 * Business metric categories. A business metric is keyed as
 * {@code business.<category>.<name>}.
 */
public enum MetricCategory {
    TRANSACTION,
    VOLUME,
    LATENCY,
    ERROR_RATE,
    FINANCIAL;

    /**
     * Key prefix for metrics in this category, e.g. {@code business.error_rate}.
     */
    public String keyPrefix() {
        return "business." + name().toLowerCase();
    }
}
