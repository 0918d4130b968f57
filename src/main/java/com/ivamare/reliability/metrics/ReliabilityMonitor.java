package com.ivamare.reliability.metrics;

import com.ivamare.reliability.repository.MetricSampleRepository;
import com.ivamare.reliability.support.BoundedHistory;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process metric sink with bounded per-key buffers, SLA evaluation and alerting.
 *
 * <p>Every sample is buffered under its {@code category.name} key, mirrored into a
 * Micrometer {@link DistributionSummary} named {@code reliability.<key>}, and
 * written to the {@link MetricSampleRepository} when one is configured. A failed
 * repository write is logged and does not reach the emitting component.
 *
 * <p>At most {@code alertCapacity} alerts are retained. When the limit is passed
 * the oldest resolved alert is evicted first, then the oldest alert of any state.
 *
 * <p>An optional background cycle ({@link #start(Duration)}) re-evaluates SLA
 * compliance over each threshold's window and resolves alerts whose metric has
 * recovered.
 */
public class ReliabilityMonitor implements MetricSink {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityMonitor.class);

    public static final int DEFAULT_BUFFER_SIZE = 1000;
    public static final int DEFAULT_ALERT_CAPACITY = 1000;
    private static final Duration AGGREGATION_WINDOW = Duration.ofMinutes(5);
    private static final Duration BUSINESS_METRIC_WINDOW = Duration.ofHours(1);
    private static final Duration RESOLUTION_WINDOW = Duration.ofMinutes(1);
    private static final double COMPLIANCE_TARGET = 0.95;
    private static final double COMPLIANCE_WARNING = 0.90;

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final MetricSampleRepository repository;
    private final int bufferSize;
    private final int alertCapacity;
    private final Map<String, SlaThreshold> slaThresholds;

    private final Map<String, BoundedHistory<MetricSample>> buffers = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaries = new ConcurrentHashMap<>();
    private final Map<String, ComplianceMetric> complianceMetrics = new ConcurrentHashMap<>();
    private final Map<String, Alert> alerts = new LinkedHashMap<>();
    private final Object alertLock = new Object();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public ReliabilityMonitor(MeterRegistry meterRegistry, Clock clock) {
        this(meterRegistry, clock, null, DEFAULT_BUFFER_SIZE, defaultSlaThresholds());
    }

    /**
     * @param meterRegistry Micrometer registry samples are mirrored into
     * @param clock Time source
     * @param repository Durable sample store (nullable)
     * @param bufferSize Points kept per metric key
     * @param slaThresholds Thresholds keyed by metric name
     */
    public ReliabilityMonitor(
            MeterRegistry meterRegistry,
            Clock clock,
            MetricSampleRepository repository,
            int bufferSize,
            Map<String, SlaThreshold> slaThresholds) {
        this(meterRegistry, clock, repository, bufferSize, DEFAULT_ALERT_CAPACITY, slaThresholds);
    }

    /**
     * @param alertCapacity Alerts retained before eviction
     */
    public ReliabilityMonitor(
            MeterRegistry meterRegistry,
            Clock clock,
            MetricSampleRepository repository,
            int bufferSize,
            int alertCapacity,
            Map<String, SlaThreshold> slaThresholds) {
        if (alertCapacity <= 0) {
            throw new IllegalArgumentException("alertCapacity must be positive");
        }
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.repository = repository;
        this.bufferSize = bufferSize;
        this.alertCapacity = alertCapacity;
        this.slaThresholds = Map.copyOf(slaThresholds);

        Gauge.builder("reliability.alerts.active", this, monitor -> monitor.getAlertSummary().active())
            .description("Unresolved reliability alerts")
            .register(meterRegistry);
    }

    /**
     * SLA thresholds for latency, error rate, integrity, memory and batch time.
     */
    public static Map<String, SlaThreshold> defaultSlaThresholds() {
        Map<String, SlaThreshold> thresholds = new LinkedHashMap<>();
        thresholds.put("processing_latency",
            new SlaThreshold("processing_latency", 500, 1000, Duration.ofMinutes(5), false));
        thresholds.put("transaction_error_rate",
            new SlaThreshold("transaction_error_rate", 0.01, 0.05, Duration.ofMinutes(1), false));
        thresholds.put("data_integrity_score",
            new SlaThreshold("data_integrity_score", 0.95, 0.90, Duration.ofMinutes(5), true));
        thresholds.put("memory_usage",
            new SlaThreshold("memory_usage", 0.80, 0.90, Duration.ofMinutes(3), false));
        thresholds.put("batch_processing_time",
            new SlaThreshold("batch_processing_time", 7500, 15000, Duration.ofMinutes(5), false));
        return thresholds;
    }

    // --- MetricSink ---

    @Override
    public void record(MetricSample sample) {
        String key = sample.key();
        buffers.computeIfAbsent(key, k -> new BoundedHistory<>(bufferSize)).add(sample);

        summaries.computeIfAbsent(key, k -> DistributionSummary.builder("reliability." + k)
                .baseUnit(sample.unit())
                .tag("category", sample.category())
                .register(meterRegistry))
            .record(sample.value());

        if (repository != null) {
            try {
                repository.save(sample);
            } catch (DataAccessException e) {
                log.warn("Failed to persist metric sample {}: {}", key, e.getMessage());
            }
        }

        checkMetricThreshold(sample);
    }

    @Override
    public void recordMetric(String category, String name, double value, String unit, Map<String, Object> tags) {
        record(new MetricSample(category, name, value, unit, clock.instant(), tags));
    }

    @Override
    public void recordBusinessMetric(MetricCategory category, String name, double value, String unit,
                                     Map<String, Object> tags) {
        Map<String, Object> merged = new HashMap<>();
        if (tags != null) {
            merged.putAll(tags);
        }
        merged.put("category", category.name());
        merged.put("isBusinessMetric", true);
        recordMetric(category.keyPrefix(), name, value, unit, merged);

        if (name.contains("compliance") || name.contains("sla")) {
            updateComplianceMetric(name, value);
        }
    }

    @Override
    public void recordSlaMetric(String name, double value, String unit, double target, Map<String, Object> tags) {
        Map<String, Object> merged = new HashMap<>();
        if (tags != null) {
            merged.putAll(tags);
        }
        merged.put("target", target);
        recordMetric("sla", name, value, unit, merged);
        updateComplianceMetric(name, value);

        SlaThreshold threshold = slaThresholds.get(name);
        if (threshold == null) {
            return;
        }
        SlaStatus status = threshold.evaluate(value);
        if (status != SlaStatus.COMPLIANT) {
            raiseAlert(Alert.forMetric(
                status == SlaStatus.CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                AlertCategory.COMPLIANCE,
                "SLA violation for " + name + ": " + value + unit + " (target: " + target + unit + ")",
                name, value, target,
                Map.of("target", target, "status", status.name(), "unit", unit)));
        }
    }

    @Override
    public void raiseAlert(Alert alert) {
        Alert stamped = alert.raisedAt() != null ? alert : alert.withRaisedAt(clock.instant());
        synchronized (alertLock) {
            alerts.put(stamped.id(), stamped);
            evictAlerts();
        }
        log.warn("ALERT [{}] {}: {}", stamped.severity(), stamped.category(), stamped.message());
    }

    // --- Alerts ---

    /**
     * Mark an alert acknowledged.
     *
     * @return true if the alert exists
     */
    public boolean acknowledge(String alertId) {
        synchronized (alertLock) {
            Alert alert = alerts.get(alertId);
            if (alert == null) {
                return false;
            }
            alerts.put(alertId, alert.withAcknowledged());
            return true;
        }
    }

    /**
     * Mark an alert resolved.
     *
     * @return true if the alert exists and was not already resolved
     */
    public boolean resolve(String alertId) {
        synchronized (alertLock) {
            Alert alert = alerts.get(alertId);
            if (alert == null || !alert.isActive()) {
                return false;
            }
            alerts.put(alertId, alert.withResolvedAt(clock.instant()));
        }
        log.info("Resolved alert {}", alertId);
        return true;
    }

    public List<Alert> getAlerts() {
        synchronized (alertLock) {
            return List.copyOf(alerts.values());
        }
    }

    public List<Alert> getActiveAlerts() {
        synchronized (alertLock) {
            return alerts.values().stream().filter(Alert::isActive).toList();
        }
    }

    private void evictAlerts() {
        while (alerts.size() > alertCapacity) {
            String victim = alerts.values().stream()
                .filter(alert -> !alert.isActive())
                .map(Alert::id)
                .findFirst()
                .orElseGet(() -> alerts.keySet().iterator().next());
            alerts.remove(victim);
        }
    }

    public AlertSummary getAlertSummary() {
        List<Alert> active = getActiveAlerts();
        int critical = (int) active.stream()
            .filter(a -> a.severity() == AlertSeverity.CRITICAL || a.severity() == AlertSeverity.EMERGENCY)
            .count();
        int warning = (int) active.stream()
            .filter(a -> a.severity() == AlertSeverity.WARNING)
            .count();
        return new AlertSummary(active.size(), critical, warning);
    }

    // --- Queries ---

    /**
     * Buffered samples for a key newer than {@code window}, oldest first.
     */
    public List<MetricSample> getRecentSamples(String key, Duration window) {
        BoundedHistory<MetricSample> buffer = buffers.get(key);
        if (buffer == null) {
            return Collections.emptyList();
        }
        Instant cutoff = clock.instant().minus(window);
        return buffer.filter(s -> !s.timestamp().isBefore(cutoff));
    }

    /**
     * Latest buffered sample for a key.
     */
    public Optional<MetricSample> getLatest(String key) {
        BoundedHistory<MetricSample> buffer = buffers.get(key);
        return buffer == null ? Optional.empty() : Optional.ofNullable(buffer.latest());
    }

    /**
     * Average, maximum and minimum per key over the last five minutes.
     * Keys without samples in the window are omitted.
     */
    public Map<String, MetricAggregate> aggregate() {
        Map<String, MetricAggregate> result = new TreeMap<>();
        for (String key : buffers.keySet()) {
            List<MetricSample> recent = getRecentSamples(key, AGGREGATION_WINDOW);
            if (recent.isEmpty()) {
                continue;
            }
            double sum = 0;
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            for (MetricSample sample : recent) {
                sum += sample.value();
                max = Math.max(max, sample.value());
                min = Math.min(min, sample.value());
            }
            result.put(key, new MetricAggregate(key, sum / recent.size(), max, min,
                recent.size(), recent.get(0).unit()));
        }
        return result;
    }

    /**
     * Latest sample of every business metric seen in the last hour.
     */
    public List<MetricSample> getLatestBusinessMetrics() {
        List<MetricSample> result = new ArrayList<>();
        Instant cutoff = clock.instant().minus(BUSINESS_METRIC_WINDOW);
        new TreeMap<>(buffers).forEach((key, buffer) -> {
            if (key.startsWith("business.")) {
                MetricSample latest = buffer.latest();
                if (latest != null && !latest.timestamp().isBefore(cutoff)) {
                    result.add(latest);
                }
            }
        });
        return result;
    }

    public List<ComplianceMetric> getComplianceStatus() {
        return new TreeMap<>(complianceMetrics).values().stream().toList();
    }

    public Map<String, SlaThreshold> getSlaThresholds() {
        return slaThresholds;
    }

    /**
     * Current SLA status per threshold, from the latest compliance evaluation.
     * A threshold that has not been evaluated in the last five minutes is COMPLIANT.
     */
    public Map<String, SlaStatus> getSlaStatus() {
        Map<String, SlaStatus> result = new LinkedHashMap<>();
        for (String metric : slaThresholds.keySet()) {
            List<MetricSample> recent = getRecentSamples("sla_compliance." + metric, AGGREGATION_WINDOW);
            result.put(metric, recent.isEmpty()
                ? SlaStatus.COMPLIANT
                : SlaStatus.fromScore(recent.get(recent.size() - 1).value()));
        }
        return result;
    }

    // --- Periodic evaluation ---

    /**
     * Evaluate every SLA threshold over its window. The worst value in the window
     * decides the status, which is recorded as {@code sla_compliance.<metric>}.
     *
     * @return status per evaluated metric (metrics without samples are skipped)
     */
    public Map<String, SlaStatus> checkSlaCompliance() {
        Map<String, SlaStatus> result = new LinkedHashMap<>();
        for (SlaThreshold threshold : slaThresholds.values()) {
            List<MetricSample> recent = getRecentSamples("sla." + threshold.metric(), threshold.window());
            if (recent.isEmpty()) {
                continue;
            }
            double sum = 0;
            double worst = threshold.lowerIsWorse() ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
            for (MetricSample sample : recent) {
                sum += sample.value();
                worst = threshold.lowerIsWorse()
                    ? Math.min(worst, sample.value())
                    : Math.max(worst, sample.value());
            }
            double average = sum / recent.size();
            SlaStatus status = threshold.evaluate(worst);
            result.put(threshold.metric(), status);

            recordMetric("sla_compliance", threshold.metric(), status.score(), "compliance",
                Map.of("average", average, "worst", worst, "status", status.name()));

            if (status != SlaStatus.COMPLIANT) {
                raiseAlert(Alert.forMetric(
                    status == SlaStatus.CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                    AlertCategory.COMPLIANCE,
                    "SLA compliance violation for " + threshold.metric() + ": " + status,
                    threshold.metric(), average, threshold.warning(),
                    Map.of("average", average, "worst", worst, "status", status.name())));
            }
        }
        return result;
    }

    /**
     * Resolve unacknowledged alerts whose SLA metric has been compliant for the
     * last minute.
     *
     * @return number of alerts resolved
     */
    public int resolveRecoveredAlerts() {
        int resolved = 0;
        for (Alert alert : getActiveAlerts()) {
            if (alert.acknowledged() || alert.metric() == null) {
                continue;
            }
            SlaThreshold threshold = slaThresholds.get(alert.metric());
            if (threshold == null) {
                continue;
            }
            List<MetricSample> recent = getRecentSamples("sla." + alert.metric(), RESOLUTION_WINDOW);
            if (recent.isEmpty()) {
                continue;
            }
            boolean recovered = recent.stream()
                .allMatch(s -> threshold.evaluate(s.value()) == SlaStatus.COMPLIANT);
            if (recovered && resolve(alert.id())) {
                resolved++;
            }
        }
        return resolved;
    }

    /**
     * Start the periodic evaluation cycle.
     */
    public void start(Duration interval) {
        if (running.getAndSet(true)) {
            log.warn("Reliability monitor already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "reliability-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::runCycle, interval.toMillis(), interval.toMillis(),
            TimeUnit.MILLISECONDS);
        log.info("Started reliability monitor (interval={})", interval);
    }

    /**
     * Stop the periodic evaluation cycle.
     */
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
        log.info("Stopped reliability monitor");
    }

    public boolean isRunning() {
        return running.get();
    }

    void runCycle() {
        try {
            checkSlaCompliance();
            resolveRecoveredAlerts();
        } catch (RuntimeException e) {
            log.error("Monitoring cycle failed", e);
            raiseAlert(Alert.of(AlertSeverity.WARNING, AlertCategory.SYSTEM,
                "Monitoring cycle failed: " + e.getMessage(), Map.of()));
        }
    }

    // --- Internal ---

    private void checkMetricThreshold(MetricSample sample) {
        if (sample.category().equals("circuit_breaker") && sample.name().startsWith("state_")
                && sample.value() < 1.0) {
            Object service = sample.tags().getOrDefault("serviceName", sample.name().substring(6));
            boolean open = sample.value() == 0.0;
            raiseAlert(Alert.forMetric(
                open ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                AlertCategory.SYSTEM,
                "Circuit breaker " + service + " is " + (open ? "OPEN" : "HALF_OPEN"),
                sample.name(), sample.value(), 1.0, sample.tags()));
        }
    }

    private void updateComplianceMetric(String name, double value) {
        SlaStatus status = value >= COMPLIANCE_TARGET
            ? SlaStatus.COMPLIANT
            : value >= COMPLIANCE_WARNING ? SlaStatus.WARNING : SlaStatus.CRITICAL;
        complianceMetrics.put(name, new ComplianceMetric(name, value, COMPLIANCE_TARGET, status,
            clock.instant(), "Compliance metric for " + name));
    }
}
