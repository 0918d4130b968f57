package com.ivamare.reliability.batching;

import java.time.Instant;

/**
 * Point-in-time reading of process resources.
 *
 * @param memoryUsage Heap used / heap max, 0..1
 * @param cpuUsage Process or system CPU load, 0..1
 * @param systemLoad Load average per processor, 0..1
 * @param heapUsedBytes Heap in use
 * @param heapMaxBytes Heap ceiling
 * @param errorRate Share of circuit breakers that are not CLOSED
 * @param sampledAt When the reading was taken
 */
public record SystemStatus(
    double memoryUsage,
    double cpuUsage,
    double systemLoad,
    long heapUsedBytes,
    long heapMaxBytes,
    double errorRate,
    Instant sampledAt
) {
    public long availableHeapBytes() {
        return Math.max(0, heapMaxBytes - heapUsedBytes);
    }
}
