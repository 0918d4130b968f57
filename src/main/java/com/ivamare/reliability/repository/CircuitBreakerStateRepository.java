package com.ivamare.reliability.repository;

import com.ivamare.reliability.breaker.CircuitBreakerSnapshot;

import java.util.List;

/**
 * Keyed upsert store for circuit breaker state.
 */
public interface CircuitBreakerStateRepository {

    /**
     * Insert or replace the state of one breaker, keyed by service name.
     *
     * @param snapshot the state to store
     */
    void save(CircuitBreakerSnapshot snapshot);

    /**
     * All stored breaker states.
     *
     * @return states ordered by service name
     */
    List<CircuitBreakerSnapshot> findAll();
}
