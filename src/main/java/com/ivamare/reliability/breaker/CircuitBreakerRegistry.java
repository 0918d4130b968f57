package com.ivamare.reliability.breaker;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.metrics.MetricSink;
import com.ivamare.reliability.model.AuditOutcome;
import com.ivamare.reliability.repository.CircuitBreakerStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named circuit breakers, created lazily per service.
 *
 * <p>Every state change is stored through the {@link CircuitBreakerStateRepository}
 * and audited as {@code CIRCUIT_BREAKER_STATE_CHANGED} on a chain named after the
 * service. A store failure is logged and does not hide the result of the
 * protected call; an audit failure propagates.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    public static final String STATE_CHANGED = "CIRCUIT_BREAKER_STATE_CHANGED";
    public static final String RESET = "CIRCUIT_BREAKER_RESET";
    private static final String ACTOR = "circuit-breaker-system";

    private final CircuitBreakerConfig defaultConfig;
    private final CircuitBreakerStateRepository repository;
    private final AuditLedger auditLedger;
    private final MetricSink metricSink;
    private final Clock clock;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(
            CircuitBreakerConfig defaultConfig,
            CircuitBreakerStateRepository repository,
            AuditLedger auditLedger,
            MetricSink metricSink,
            Clock clock) {
        this(defaultConfig, repository, auditLedger, metricSink, clock, newExecutor(), true);
    }

    /**
     * @param executor Executor protected operations run on; owned by the caller
     */
    public CircuitBreakerRegistry(
            CircuitBreakerConfig defaultConfig,
            CircuitBreakerStateRepository repository,
            AuditLedger auditLedger,
            MetricSink metricSink,
            Clock clock,
            ExecutorService executor) {
        this(defaultConfig, repository, auditLedger, metricSink, clock, executor, false);
    }

    private CircuitBreakerRegistry(
            CircuitBreakerConfig defaultConfig,
            CircuitBreakerStateRepository repository,
            AuditLedger auditLedger,
            MetricSink metricSink,
            Clock clock,
            ExecutorService executor,
            boolean ownsExecutor) {
        this.defaultConfig = defaultConfig;
        this.repository = repository;
        this.auditLedger = auditLedger;
        this.metricSink = metricSink;
        this.clock = clock;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    private static ExecutorService newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "circuit-breaker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Breaker for a service, created with the default config on first use.
     */
    public CircuitBreaker getOrCreate(String serviceName) {
        return getOrCreate(serviceName, defaultConfig);
    }

    /**
     * Breaker for a service. The config only applies when the breaker is created.
     */
    public CircuitBreaker getOrCreate(String serviceName, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(serviceName, name -> {
            log.debug("Creating circuit breaker for {} ({})", name, config);
            return new CircuitBreaker(name, config, clock, executor, metricSink, this::onTransition);
        });
    }

    public Optional<CircuitBreaker> find(String serviceName) {
        return Optional.ofNullable(breakers.get(serviceName));
    }

    /**
     * Run an operation under the named service's breaker.
     *
     * @see CircuitBreaker#execute(Callable)
     */
    public <T> T execute(String serviceName, Callable<T> operation) {
        return getOrCreate(serviceName).execute(operation);
    }

    /**
     * Snapshots of every breaker, ordered by service name.
     */
    public List<CircuitBreakerSnapshot> getAllStates() {
        return breakers.values().stream()
            .map(CircuitBreaker::snapshot)
            .sorted(Comparator.comparing(CircuitBreakerSnapshot::serviceName))
            .toList();
    }

    /**
     * Force a breaker CLOSED with zeroed counters. Creates the breaker if needed.
     *
     * @throws com.ivamare.reliability.exception.AuditWriteException if the reset could not be audited
     */
    public CircuitBreakerSnapshot reset(String serviceName) {
        CircuitBreaker breaker = getOrCreate(serviceName);
        CircuitState previous = breaker.reset();
        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        persist(snapshot);
        auditLedger.append(AuditRecord.builder(RESET, serviceName)
            .chainId(serviceName)
            .entityType("CIRCUIT_BREAKER")
            .actor(ACTOR)
            .action(RESET)
            .resource("circuit_breaker:" + serviceName)
            .outcome(AuditOutcome.SUCCESS)
            .detail("serviceName", serviceName)
            .detail("previousState", previous.name())
            .build());
        recordState(snapshot);
        return snapshot;
    }

    /**
     * Reset every OPEN breaker.
     *
     * @return names of the services that were reset
     */
    public List<String> resetOpenBreakers() {
        List<String> open = getAllStates().stream()
            .filter(s -> s.state() == CircuitState.OPEN)
            .map(CircuitBreakerSnapshot::serviceName)
            .toList();
        open.forEach(this::reset);
        return open;
    }

    /**
     * Aggregate health: healthy when no breaker is OPEN. Emits
     * {@code circuit_breaker.overall_health} as 1 or 0.
     */
    public BreakerHealth healthCheck() {
        List<BreakerHealth.ServiceHealth> services = getAllStates().stream()
            .map(s -> new BreakerHealth.ServiceHealth(s.serviceName(), s.state(), s.failureCount(), s.isHealthy()))
            .toList();
        boolean healthy = services.stream().allMatch(BreakerHealth.ServiceHealth::healthy);
        metricSink.recordMetric("circuit_breaker", "overall_health", healthy ? 1 : 0, "boolean",
            Map.of("circuitBreakers", services.size()));
        return new BreakerHealth(healthy, services);
    }

    public boolean isAnyOpen() {
        return breakers.values().stream().anyMatch(b -> b.getState() == CircuitState.OPEN);
    }

    /**
     * Share of breakers that are not CLOSED, 0 when there are none.
     */
    public double unhealthyRatio() {
        int total = breakers.size();
        if (total == 0) {
            return 0.0;
        }
        long notClosed = breakers.values().stream().filter(b -> b.getState() != CircuitState.CLOSED).count();
        return (double) notClosed / total;
    }

    /**
     * Restore state, failure count and last failure time of every stored breaker.
     *
     * @return number of breakers restored; 0 when the store cannot be read
     */
    public int loadPersistedStates() {
        List<CircuitBreakerSnapshot> stored;
        try {
            stored = repository.findAll();
        } catch (DataAccessException e) {
            log.error("Failed to load circuit breaker states", e);
            return 0;
        }
        for (CircuitBreakerSnapshot snapshot : stored) {
            getOrCreate(snapshot.serviceName()).restore(snapshot);
        }
        log.info("Loaded {} circuit breaker states", stored.size());
        return stored.size();
    }

    /**
     * Stop the executor if the registry created it.
     */
    public void shutdown() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void onTransition(CircuitBreakerSnapshot snapshot, CircuitState previous) {
        persist(snapshot);
        auditLedger.append(AuditRecord.builder(STATE_CHANGED, snapshot.serviceName())
            .chainId(snapshot.serviceName())
            .entityType("CIRCUIT_BREAKER")
            .actor(ACTOR)
            .action("STATE_CHANGE")
            .resource("circuit_breaker:" + snapshot.serviceName())
            .outcome(outcomeOf(snapshot.state()))
            .detail("serviceName", snapshot.serviceName())
            .detail("previousState", previous.name())
            .detail("newState", snapshot.state().name())
            .detail("failureCount", snapshot.failureCount())
            .detail("lastFailureTime", snapshot.lastFailureTime() != null
                ? snapshot.lastFailureTime().toString() : null)
            .build());
        recordState(snapshot);
    }

    private void persist(CircuitBreakerSnapshot snapshot) {
        try {
            repository.save(snapshot);
        } catch (DataAccessException e) {
            log.error("Failed to persist circuit breaker state for {}", snapshot.serviceName(), e);
        }
    }

    private void recordState(CircuitBreakerSnapshot snapshot) {
        metricSink.recordMetric("circuit_breaker", "state_" + snapshot.serviceName(),
            snapshot.state().healthScore(), "state",
            Map.of("serviceName", snapshot.serviceName(), "failures", snapshot.failureCount()));
    }

    private static AuditOutcome outcomeOf(CircuitState state) {
        return switch (state) {
            case CLOSED -> AuditOutcome.SUCCESS;
            case HALF_OPEN -> AuditOutcome.WARNING;
            case OPEN -> AuditOutcome.FAILURE;
        };
    }
}
