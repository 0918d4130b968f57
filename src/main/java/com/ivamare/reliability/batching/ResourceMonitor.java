package com.ivamare.reliability.batching;

import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.metrics.MetricSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Samples heap, CPU and breaker health for the batching engine.
 *
 * <p>A background sampler refreshes {@link #current()}; readers tolerate a
 * reading that is up to one interval old. When the sampler is not running,
 * {@link #current()} samples synchronously once the latest reading is older
 * than the refresh interval.
 */
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(5);

    private final MemoryMXBean memoryBean;
    private final OperatingSystemMXBean osBean;
    private final CircuitBreakerRegistry breakerRegistry;
    private final MetricSink metricSink;
    private final Clock clock;
    private final Duration refreshInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile SystemStatus latest;
    private ScheduledExecutorService scheduler;

    public ResourceMonitor(CircuitBreakerRegistry breakerRegistry, MetricSink metricSink, Clock clock) {
        this(breakerRegistry, metricSink, clock, DEFAULT_REFRESH_INTERVAL);
    }

    public ResourceMonitor(
            CircuitBreakerRegistry breakerRegistry,
            MetricSink metricSink,
            Clock clock,
            Duration refreshInterval) {
        this(ManagementFactory.getMemoryMXBean(), ManagementFactory.getOperatingSystemMXBean(),
            breakerRegistry, metricSink, clock, refreshInterval);
    }

    public ResourceMonitor(
            MemoryMXBean memoryBean,
            OperatingSystemMXBean osBean,
            CircuitBreakerRegistry breakerRegistry,
            MetricSink metricSink,
            Clock clock) {
        this(memoryBean, osBean, breakerRegistry, metricSink, clock, DEFAULT_REFRESH_INTERVAL);
    }

    public ResourceMonitor(
            MemoryMXBean memoryBean,
            OperatingSystemMXBean osBean,
            CircuitBreakerRegistry breakerRegistry,
            MetricSink metricSink,
            Clock clock,
            Duration refreshInterval) {
        this.memoryBean = memoryBean;
        this.osBean = osBean;
        this.breakerRegistry = breakerRegistry;
        this.metricSink = metricSink;
        this.clock = clock;
        this.refreshInterval = refreshInterval;
    }

    /**
     * Latest reading. Samples now if none exists yet, or if the sampler is
     * stopped and the reading is older than the refresh interval.
     */
    public SystemStatus current() {
        SystemStatus status = latest;
        if (status == null || (!running.get() && isStale(status))) {
            return sample();
        }
        return status;
    }

    private boolean isStale(SystemStatus status) {
        return !status.sampledAt().plus(refreshInterval).isAfter(clock.instant());
    }

    /**
     * Take a fresh reading and make it the latest.
     */
    public SystemStatus sample() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double memoryUsage = max > 0 ? (double) heap.getUsed() / max : 0.0;

        int processors = Math.max(1, osBean.getAvailableProcessors());
        double loadAverage = osBean.getSystemLoadAverage();
        double systemLoad = loadAverage >= 0 ? clamp(loadAverage / processors) : 0.0;
        double cpuUsage = systemLoad;
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            double processLoad = sunBean.getProcessCpuLoad();
            if (processLoad >= 0) {
                cpuUsage = clamp(processLoad);
            }
        }

        SystemStatus status = new SystemStatus(memoryUsage, cpuUsage, systemLoad,
            heap.getUsed(), max, breakerRegistry.unhealthyRatio(), clock.instant());
        latest = status;
        return status;
    }

    /**
     * Ask the JVM to collect garbage and report how much heap was freed.
     *
     * @return bytes freed, zero if usage did not drop
     */
    public long reclaimMemory() {
        long before = memoryBean.getHeapMemoryUsage().getUsed();
        memoryBean.gc();
        long after = memoryBean.getHeapMemoryUsage().getUsed();
        long freed = Math.max(0, before - after);
        log.info("Forced garbage collection freed {} bytes", freed);
        metricSink.recordMetric("memory", "forced_gc", freed, "bytes",
            Map.of("heapUsedBefore", before, "heapUsedAfter", after));
        return freed;
    }

    /**
     * Start the background sampler.
     */
    public void start(Duration interval) {
        if (running.getAndSet(true)) {
            log.warn("Resource monitor already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "resource-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::sampleQuietly, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Started resource monitor (interval={})", interval);
    }

    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Stopped resource monitor");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void sampleQuietly() {
        try {
            sample();
        } catch (RuntimeException e) {
            log.warn("Resource sampling failed", e);
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
