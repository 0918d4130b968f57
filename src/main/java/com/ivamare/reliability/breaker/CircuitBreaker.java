package com.ivamare.reliability.breaker;

import com.ivamare.reliability.exception.CircuitBreakerOpenException;
import com.ivamare.reliability.exception.OperationTimeoutException;
import com.ivamare.reliability.exception.ProtectedOperationException;
import com.ivamare.reliability.metrics.MetricSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Failure counter and state machine guarding calls to one named service.
 *
 * <p>State transitions:
 * <ul>
 *   <li>CLOSED to OPEN after {@code failureThreshold} consecutive failures</li>
 *   <li>OPEN to HALF_OPEN on the first call after {@code recoveryTimeout} has
 *       elapsed since the last failure; earlier calls are rejected without
 *       invoking the operation</li>
 *   <li>HALF_OPEN to CLOSED after {@code successThreshold} consecutive successes</li>
 *   <li>HALF_OPEN to OPEN on any failure, timeouts included</li>
 * </ul>
 *
 * <p>The operation runs on the supplied executor so the caller can stop waiting
 * after {@code operationTimeout}. A timed-out operation is cancelled with
 * interruption but is not otherwise stopped.
 *
 * <p>Counters and state are guarded by the breaker's monitor. Instances are
 * created by {@link CircuitBreakerRegistry}.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String serviceName;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ExecutorService executor;
    private final MetricSink metricSink;
    private final StateTransitionListener listener;

    private volatile CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;

    public CircuitBreaker(
            String serviceName,
            CircuitBreakerConfig config,
            Clock clock,
            ExecutorService executor,
            MetricSink metricSink,
            StateTransitionListener listener) {
        this.serviceName = serviceName;
        this.config = config;
        this.clock = clock;
        this.executor = executor;
        this.metricSink = metricSink;
        this.listener = listener;
    }

    /**
     * Run an operation under protection.
     *
     * <p>An {@link Error} thrown by the operation counts as a failure and is rethrown.
     * Every call records an {@code operation_duration} sample whatever its outcome.
     *
     * @param operation the protected call
     * @return the operation's result
     * @throws CircuitBreakerOpenException if the breaker is OPEN; not counted as a failure
     * @throws OperationTimeoutException if the operation exceeds the timeout
     * @throws ProtectedOperationException if the operation throws a checked exception
     */
    public <T> T execute(Callable<T> operation) {
        long startNanos = System.nanoTime();
        try {
            acquirePermission();
        } catch (CircuitBreakerOpenException e) {
            recordDuration(startNanos, "REJECTED");
            throw e;
        }

        T result;
        try {
            result = invoke(operation);
        } catch (RuntimeException | Error e) {
            try {
                onFailure();
            } catch (RuntimeException listenerFailure) {
                listenerFailure.addSuppressed(e);
                throw listenerFailure;
            } finally {
                recordDuration(startNanos, "FAILURE");
            }
            throw e;
        }

        try {
            onSuccess();
        } finally {
            recordDuration(startNanos, "SUCCESS");
        }
        return result;
    }

    /**
     * Run an operation that returns nothing.
     */
    public void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public String getServiceName() {
        return serviceName;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized int getSuccessCount() {
        return successCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(serviceName, state, failureCount, successCount,
            lastFailureTime, clock.instant());
    }

    // --- Registry hooks ---

    /**
     * Force CLOSED and zero all counters. Does not notify the listener.
     *
     * @return state before the reset
     */
    synchronized CircuitState reset() {
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        failureCount = 0;
        successCount = 0;
        lastFailureTime = null;
        log.info("Circuit breaker {} reset from {} to CLOSED", serviceName, previous);
        return previous;
    }

    /**
     * Restore persisted state. Does not notify the listener.
     */
    synchronized void restore(CircuitBreakerSnapshot persisted) {
        state = persisted.state();
        failureCount = persisted.failureCount();
        successCount = 0;
        lastFailureTime = persisted.lastFailureTime();
        log.debug("Restored circuit breaker {} as {} (failures={})", serviceName, state, failureCount);
    }

    // --- State machine ---

    private synchronized void acquirePermission() {
        if (state != CircuitState.OPEN) {
            return;
        }
        Instant now = clock.instant();
        Instant retryAt = lastFailureTime != null ? lastFailureTime.plus(config.recoveryTimeout()) : now;
        if (now.isBefore(retryAt)) {
            throw new CircuitBreakerOpenException(serviceName, retryAt);
        }
        transitionTo(CircuitState.HALF_OPEN);
    }

    private synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            successCount++;
            if (successCount >= config.successThreshold()) {
                transitionTo(CircuitState.CLOSED);
            }
        } else if (state == CircuitState.CLOSED) {
            failureCount = 0;
        }
    }

    private synchronized void onFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN
                || (state == CircuitState.CLOSED && failureCount >= config.failureThreshold())) {
            transitionTo(CircuitState.OPEN);
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.HALF_OPEN) {
            successCount = 0;
        } else if (next == CircuitState.CLOSED) {
            successCount = 0;
            failureCount = 0;
        }
        log.info("Circuit breaker {} transitioned {} -> {} (failures={})",
            serviceName, previous, next, failureCount);
        listener.onTransition(snapshot(), previous);
    }

    private <T> T invoke(Callable<T> operation) {
        Future<T> future;
        try {
            future = executor.submit(operation);
        } catch (RejectedExecutionException e) {
            throw new ProtectedOperationException(serviceName, e);
        }
        try {
            return future.get(config.operationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OperationTimeoutException(serviceName, config.operationTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ProtectedOperationException(serviceName, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProtectedOperationException(serviceName, e);
        }
    }

    private void recordDuration(long startNanos, String outcome) {
        double millis = (System.nanoTime() - startNanos) / 1_000_000.0;
        metricSink.recordMetric("circuit_breaker", "operation_duration", millis, "ms",
            Map.of("serviceName", serviceName, "state", state.name(), "outcome", outcome));
    }
}
