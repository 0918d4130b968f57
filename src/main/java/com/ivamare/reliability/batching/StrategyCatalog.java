package com.ivamare.reliability.batching;

import com.ivamare.reliability.model.DataType;
import com.ivamare.reliability.model.Sensitivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntUnaryOperator;

/**
 * The batching strategies known to a {@link BatchingEngine}.
 *
 * <p>Adaptive resizing rewrites every strategy at once under the write lock;
 * selection reads under the read lock. The default strategy is never resized.
 */
public class StrategyCatalog {

    private static final Logger log = LoggerFactory.getLogger(StrategyCatalog.class);

    public static final String DEFAULT_STRATEGY = "default_strategy";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, BatchingStrategy> strategies = new LinkedHashMap<>();
    private final BatchingStrategy defaultStrategy;

    public StrategyCatalog(Collection<BatchingStrategy> strategies, BatchingStrategy defaultStrategy) {
        for (BatchingStrategy strategy : strategies) {
            this.strategies.put(strategy.name(), strategy);
        }
        this.defaultStrategy = defaultStrategy;
    }

    /**
     * Catalog seeded with the four built-in strategies.
     */
    public static StrategyCatalog defaults() {
        return new StrategyCatalog(List.of(
            new BatchingStrategy("high_value_transactions",
                new StrategyConditions(0.7, 0.6, 0.6, 1000, new BigDecimal("100000"),
                    DataType.TRANSACTION, Sensitivity.CONFIDENTIAL, List.of("PCI-DSS", "SOX"), 0.01),
                100, 4, 10),
            new BatchingStrategy("account_data_processing",
                new StrategyConditions(0.8, 0.7, 0.7, 2000, new BigDecimal("50000"),
                    DataType.ACCOUNT, Sensitivity.CONFIDENTIAL, List.of("KYC", "AML"), 0.02),
                500, 6, 8),
            new BatchingStrategy("reference_data_bulk",
                new StrategyConditions(0.85, 0.8, 0.8, 500, new BigDecimal("1000"),
                    DataType.REFERENCE, Sensitivity.INTERNAL, List.of(), 0.05),
                5000, 8, 5),
            new BatchingStrategy("audit_log_processing",
                new StrategyConditions(0.9, 0.9, 0.9, 200, BigDecimal.ZERO,
                    DataType.AUDIT, Sensitivity.RESTRICTED, List.of("SOX", "GDPR"), 0.03),
                10000, 10, 6)
        ), defaultStrategy());
    }

    /**
     * Fallback used when no catalog strategy scores above zero.
     */
    public static BatchingStrategy defaultStrategy() {
        return new BatchingStrategy(DEFAULT_STRATEGY,
            new StrategyConditions(0.8, 0.7, 0.7, 1000, new BigDecimal("1000"),
                DataType.REFERENCE, Sensitivity.INTERNAL, List.of(), 0.05),
            1000, 8, 1);
    }

    /**
     * Highest-scoring strategy for the current status and data, or the default.
     */
    public BatchingStrategy select(SystemStatus status, DataCharacteristics data) {
        lock.readLock().lock();
        try {
            BatchingStrategy best = defaultStrategy;
            double bestScore = 0;
            for (BatchingStrategy strategy : strategies.values()) {
                double score = strategy.score(status, data);
                if (score > bestScore) {
                    bestScore = score;
                    best = strategy;
                }
            }
            log.debug("Selected batching strategy {} (score={})", best.name(), bestScore);
            return best;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<BatchingStrategy> find(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(strategies.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<BatchingStrategy> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(strategies.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public BatchingStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    /**
     * Rewrite the batch size of every catalog strategy.
     *
     * @param resize maps the current batch size to the new one
     */
    public void resizeAll(IntUnaryOperator resize) {
        lock.writeLock().lock();
        try {
            List<BatchingStrategy> resized = new ArrayList<>(strategies.size());
            for (BatchingStrategy strategy : strategies.values()) {
                resized.add(strategy.withBatchSize(Math.max(1, resize.applyAsInt(strategy.batchSize()))));
            }
            resized.forEach(s -> strategies.put(s.name(), s));
        } finally {
            lock.writeLock().unlock();
        }
    }
}
