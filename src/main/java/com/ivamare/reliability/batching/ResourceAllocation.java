package com.ivamare.reliability.batching;

/**
 * Resource envelope derived for one batch call.
 *
 * @param maxMemoryMb Heap ceiling in MB; above it memory is reclaimed before a sub-batch
 * @param maxCpuPercent Estimated CPU share; above 90% sub-batches yield briefly
 * @param maxConcurrency Concurrency granted to the processor
 * @param ioLimit Sub-batch dispatches allowed per second
 * @param networkBandwidth Advisory network bandwidth in MB/s
 * @param dbConnections Advisory database connection count
 */
public record ResourceAllocation(
    long maxMemoryMb,
    double maxCpuPercent,
    int maxConcurrency,
    int ioLimit,
    int networkBandwidth,
    int dbConnections
) {
}
