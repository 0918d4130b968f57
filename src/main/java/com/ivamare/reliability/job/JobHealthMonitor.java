package com.ivamare.reliability.job;

import com.ivamare.reliability.metrics.Alert;
import com.ivamare.reliability.metrics.AlertCategory;
import com.ivamare.reliability.metrics.AlertSeverity;
import com.ivamare.reliability.metrics.MetricCategory;
import com.ivamare.reliability.metrics.MetricSink;
import com.ivamare.reliability.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic health checks for monitored jobs.
 *
 * <p>Each job gets its own fixed-rate timer. A CRITICAL job raises an alert; a
 * CRITICAL job with CRITICAL risk gets a recovery strategy, which is executed
 * after a short delay unless its own risk is HIGH. At most one recovery is
 * pending per job; stopping a job or shutting down cancels it.
 */
public class JobHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(JobHealthMonitor.class);

    private final JobStateManager stateManager;
    private final MetricSink metricSink;
    private final JobSettings settings;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Map<String, ScheduledFuture<?>> monitored = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pendingRecoveries = new ConcurrentHashMap<>();

    public JobHealthMonitor(JobStateManager stateManager, MetricSink metricSink, JobSettings settings) {
        this.stateManager = stateManager;
        this.metricSink = metricSink;
        this.settings = settings;
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = new ScheduledThreadPoolExecutor(2, r -> {
            Thread thread = new Thread(r, "job-health-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    /**
     * Start checking a job every heartbeat interval, replacing any existing timer.
     * The first check runs immediately.
     *
     * @param executionId Execution to check; null follows the latest RUNNING execution
     */
    public void startMonitoring(String jobId, String executionId) {
        stopMonitoring(jobId);
        long interval = settings.heartbeatInterval().toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
            () -> tick(jobId, executionId), 0, interval, TimeUnit.MILLISECONDS);
        monitored.put(jobId, future);
        log.info("Started health monitoring for job {} (interval={})", jobId, settings.heartbeatInterval());
    }

    /**
     * Stop checking a job and cancel its pending recovery, if any.
     */
    public void stopMonitoring(String jobId) {
        ScheduledFuture<?> future = monitored.remove(jobId);
        if (future != null) {
            future.cancel(false);
            log.info("Stopped health monitoring for job {}", jobId);
        }
        cancelPendingRecovery(jobId);
    }

    public boolean isRecoveryPending(String jobId) {
        return pendingRecoveries.containsKey(jobId);
    }

    public boolean isMonitoring(String jobId) {
        return monitored.containsKey(jobId);
    }

    public Set<String> getMonitoredJobs() {
        return Set.copyOf(monitored.keySet());
    }

    /**
     * Cancel every timer and pending recovery. Delayed recoveries never run after this.
     */
    public void shutdown() {
        monitored.values().forEach(f -> f.cancel(false));
        monitored.clear();
        pendingRecoveries.values().forEach(f -> f.cancel(false));
        pendingRecoveries.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Job health monitor shut down");
    }

    /**
     * One health check. Errors are logged so the timer keeps running.
     */
    void tick(String jobId, String executionId) {
        try {
            JobHealthStatus health = stateManager.checkJobHealth(jobId, executionId);
            handle(jobId, health);
        } catch (RuntimeException e) {
            log.error("Health check tick failed for job {}", jobId, e);
        }
    }

    private void handle(String jobId, JobHealthStatus health) {
        if (health.status() != HealthStatus.CRITICAL) {
            return;
        }
        metricSink.recordBusinessMetric(MetricCategory.ERROR_RATE, "critical_job_status", 1, "alert",
            Map.of("jobId", jobId, "riskLevel", health.riskLevel().name()));
        metricSink.raiseAlert(Alert.of(AlertSeverity.CRITICAL, AlertCategory.BUSINESS,
            "Job " + jobId + " is CRITICAL: " + String.join("; ", health.recommendations()),
            Map.of("jobId", jobId, "riskLevel", health.riskLevel().name())));

        if (health.riskLevel() != RiskLevel.CRITICAL) {
            return;
        }
        Optional<RecoveryStrategy> strategy = stateManager.generateRecoveryStrategy(jobId, health.executionId());
        if (strategy.isEmpty() || strategy.get().riskLevel() == RiskLevel.HIGH) {
            return;
        }
        RecoveryStrategy planned = strategy.get();
        if (scheduler.isShutdown()) {
            return;
        }
        pendingRecoveries.computeIfAbsent(jobId, id -> {
            log.info("Scheduling automatic {} recovery for job {} in {}", planned.strategy(), id,
                settings.autoRecoveryDelay());
            return scheduler.schedule(() -> executeRecovery(id, planned), settings.autoRecoveryDelay().toMillis(),
                TimeUnit.MILLISECONDS);
        });
    }

    private void cancelPendingRecovery(String jobId) {
        ScheduledFuture<?> pending = pendingRecoveries.remove(jobId);
        if (pending != null) {
            pending.cancel(false);
            log.info("Cancelled pending recovery for job {}", jobId);
        }
    }

    private void executeRecovery(String jobId, RecoveryStrategy strategy) {
        try {
            boolean recovered = stateManager.executeRecoveryStrategy(strategy);
            log.info("Automatic {} recovery for job {} finished (recovered={})",
                strategy.strategy(), strategy.jobId(), recovered);
        } catch (RuntimeException e) {
            log.error("Automatic recovery failed for job {}", strategy.jobId(), e);
        } finally {
            pendingRecoveries.remove(jobId);
        }
    }
}
