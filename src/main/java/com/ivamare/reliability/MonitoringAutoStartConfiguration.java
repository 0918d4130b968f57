package com.ivamare.reliability;

import com.ivamare.reliability.batching.ResourceMonitor;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.job.JobHealthMonitor;
import com.ivamare.reliability.metrics.ReliabilityMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;

/**
 * Start-up and shut-down of the background parts of the reliability core.
 *
 * <p>Stored breaker states are restored on start unless
 * {@code reliability.breaker.load-on-start} is false. The samplers start with:
 * <pre>
 * reliability:
 *   metrics:
 *     auto-start: true
 * </pre>
 *
 * <p>On shutdown the job health timers, the resource sampler and the SLA cycle are stopped
 * whether or not they were started here.
 */
@AutoConfiguration(after = ReliabilityAutoConfiguration.class)
@ConditionalOnBean(CircuitBreakerRegistry.class)
@ConditionalOnProperty(prefix = "reliability", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MonitoringAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MonitoringAutoStartConfiguration.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ReliabilityMonitor reliabilityMonitor;
    private final ResourceMonitor resourceMonitor;
    private final ObjectProvider<JobHealthMonitor> jobHealthMonitor;
    private final ReliabilityProperties properties;

    public MonitoringAutoStartConfiguration(
            CircuitBreakerRegistry circuitBreakerRegistry,
            ReliabilityMonitor reliabilityMonitor,
            ResourceMonitor resourceMonitor,
            ObjectProvider<JobHealthMonitor> jobHealthMonitor,
            ReliabilityProperties properties) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.reliabilityMonitor = reliabilityMonitor;
        this.resourceMonitor = resourceMonitor;
        this.jobHealthMonitor = jobHealthMonitor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startMonitoring() {
        if (properties.getBreaker().isLoadOnStart()) {
            int restored = circuitBreakerRegistry.loadPersistedStates();
            log.info("Restored {} circuit breakers on start", restored);
        }
        if (properties.getMetrics().isAutoStart()) {
            resourceMonitor.start(properties.getBatching().getResourceSampleInterval());
            reliabilityMonitor.start(properties.getMetrics().getMonitoringInterval());
        }
    }

    @PreDestroy
    public void stopMonitoring() {
        log.info("Stopping reliability monitoring...");

        jobHealthMonitor.ifAvailable(JobHealthMonitor::shutdown);
        resourceMonitor.stop();
        reliabilityMonitor.stop();

        log.info("Reliability monitoring stopped");
    }
}
