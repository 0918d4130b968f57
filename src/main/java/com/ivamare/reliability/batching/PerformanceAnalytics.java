package com.ivamare.reliability.batching;

import java.util.List;

/**
 * Averages over recent sub-batches with tuning advice.
 *
 * @param sampleCount Sub-batches considered
 * @param averageThroughput Items per second, 2 decimals
 * @param averageProcessingTimeMs Milliseconds, rounded
 * @param averageErrorRate 0..1, 4 decimals
 * @param memoryUsage Heap usage ratio at the time of the call
 * @param cpuUsage CPU usage ratio at the time of the call
 * @param recommendations Human-readable advice
 */
public record PerformanceAnalytics(
    int sampleCount,
    double averageThroughput,
    long averageProcessingTimeMs,
    double averageErrorRate,
    double memoryUsage,
    double cpuUsage,
    List<String> recommendations
) {
    public PerformanceAnalytics {
        recommendations = List.copyOf(recommendations);
    }

    public static PerformanceAnalytics empty() {
        return new PerformanceAnalytics(0, 0, 0, 0, 0, 0, List.of("No performance data available"));
    }
}
