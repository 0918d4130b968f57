package com.ivamare.reliability.breaker;

/**
 * Callback for breaker state changes.
 *
 * <p>Invoked while the breaker holds its lock, so transitions of one breaker are
 * observed in order. An exception thrown here propagates to the caller of
 * {@link CircuitBreaker#execute}.
 */
@FunctionalInterface
public interface StateTransitionListener {

    /**
     * @param snapshot State after the transition
     * @param previous State before the transition
     */
    void onTransition(CircuitBreakerSnapshot snapshot, CircuitState previous);
}
