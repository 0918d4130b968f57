package com.ivamare.reliability.metrics;

/**
 * Average, maximum and minimum of one metric key over a window.
 */
public record MetricAggregate(
    String key,
    double average,
    double maximum,
    double minimum,
    int count,
    String unit
) {
}
