package com.ivamare.reliability.support;

import com.ivamare.reliability.breaker.CircuitBreakerSnapshot;
import com.ivamare.reliability.repository.CircuitBreakerStateRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Breaker state store backed by a map.
 */
public class InMemoryCircuitBreakerStateRepository implements CircuitBreakerStateRepository {

    private final Map<String, CircuitBreakerSnapshot> states = new TreeMap<>();

    @Override
    public synchronized void save(CircuitBreakerSnapshot snapshot) {
        states.put(snapshot.serviceName(), snapshot);
    }

    @Override
    public synchronized List<CircuitBreakerSnapshot> findAll() {
        return new ArrayList<>(states.values());
    }

    public synchronized CircuitBreakerSnapshot get(String serviceName) {
        return states.get(serviceName);
    }
}
