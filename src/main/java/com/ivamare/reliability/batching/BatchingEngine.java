package com.ivamare.reliability.batching;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.exception.AuditWriteException;
import com.ivamare.reliability.exception.BatchAbortedException;
import com.ivamare.reliability.exception.FinancialLimitExceededException;
import com.ivamare.reliability.exception.ReliabilityException;
import com.ivamare.reliability.metrics.MetricCategory;
import com.ivamare.reliability.metrics.MetricSink;
import com.ivamare.reliability.model.AuditOutcome;
import com.ivamare.reliability.model.DataType;
import com.ivamare.reliability.model.Sensitivity;
import com.ivamare.reliability.repository.DeadLetterQueue;
import com.ivamare.reliability.support.BoundedHistory;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a batch call into sub-batches sized for the data and the current
 * system status, and runs them one after another.
 *
 * <p>Per call:
 * <ol>
 *   <li>select a strategy from the {@link StrategyCatalog}</li>
 *   <li>reject the call if its financial value exceeds the configured ceiling</li>
 *   <li>compute the sub-batch size and the {@link ResourceAllocation}</li>
 *   <li>run each sub-batch under the {@code batch_processing} circuit breaker; a failed
 *       sub-batch is dead-lettered and the call moves on</li>
 *   <li>abort with {@link BatchAbortedException} once failed items exceed the abort ratio
 *       of the items attempted so far</li>
 *   <li>audit the call as {@code BATCH_PROCESSED} or {@code BATCH_FAILED}</li>
 * </ol>
 *
 * <p>Sub-batches of one call never run in parallel. Independent calls may run
 * concurrently; they share the catalog and the metrics history.
 */
public class BatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(BatchingEngine.class);

    public static final String DEFAULT_JOB_ID = "batching-engine";
    public static final String BATCH_PROCESSED = "BATCH_PROCESSED";
    public static final String BATCH_FAILED = "BATCH_FAILED";

    private static final int DEAD_LETTER_SAMPLE = 3;
    private static final int ADAPTIVE_WINDOW = 5;
    private static final int ADAPTIVE_MIN_SAMPLES = 3;
    private static final int ANALYTICS_WINDOW = 50;
    private static final BigDecimal HIGH_VALUE_RECORD = new BigDecimal("50000");

    private final StrategyCatalog catalog;
    private final ResourceMonitor resourceMonitor;
    private final CircuitBreakerRegistry breakerRegistry;
    private final AuditLedger auditLedger;
    private final DeadLetterQueue deadLetterQueue;
    private final MetricSink metricSink;
    private final Clock clock;
    private final BatchingSettings settings;
    private final FinancialValueExtractor valueExtractor;
    private final BoundedHistory<BatchMetrics> history;

    public BatchingEngine(
            StrategyCatalog catalog,
            ResourceMonitor resourceMonitor,
            CircuitBreakerRegistry breakerRegistry,
            AuditLedger auditLedger,
            DeadLetterQueue deadLetterQueue,
            MetricSink metricSink,
            Clock clock,
            BatchingSettings settings) {
        this(catalog, resourceMonitor, breakerRegistry, auditLedger, deadLetterQueue, metricSink, clock,
            settings, FinancialValueExtractor.defaultExtractor());
    }

    public BatchingEngine(
            StrategyCatalog catalog,
            ResourceMonitor resourceMonitor,
            CircuitBreakerRegistry breakerRegistry,
            AuditLedger auditLedger,
            DeadLetterQueue deadLetterQueue,
            MetricSink metricSink,
            Clock clock,
            BatchingSettings settings,
            FinancialValueExtractor valueExtractor) {
        this.catalog = catalog;
        this.resourceMonitor = resourceMonitor;
        this.breakerRegistry = breakerRegistry;
        this.auditLedger = auditLedger;
        this.deadLetterQueue = deadLetterQueue;
        this.metricSink = metricSink;
        this.clock = clock;
        this.settings = settings;
        this.valueExtractor = valueExtractor;
        this.history = new BoundedHistory<>(settings.historyCapacity());
    }

    /**
     * Process items under the default job id.
     *
     * @see #processBatch(List, DataCharacteristics, BatchProcessor, String)
     */
    public <T> BatchResult processBatch(List<T> items, DataCharacteristics characteristics,
                                        BatchProcessor<T> processor) {
        return processBatch(items, characteristics, processor, DEFAULT_JOB_ID);
    }

    /**
     * Process items in sub-batches.
     *
     * @param items Items to process, in order
     * @param characteristics Description of the items
     * @param processor Work applied to each sub-batch
     * @param jobId Job the call belongs to; names the audit chain and tags dead letters
     * @return aggregated result of the call
     * @throws FinancialLimitExceededException if the items' total value exceeds the ceiling;
     *         the processor is not invoked
     * @throws BatchAbortedException if failed items exceed the abort ratio
     * @throws AuditWriteException if the call could not be audited
     */
    public <T> BatchResult processBatch(List<T> items, DataCharacteristics characteristics,
                                        BatchProcessor<T> processor, String jobId) {
        String job = jobId != null ? jobId : DEFAULT_JOB_ID;
        long startNanos = System.nanoTime();

        SystemStatus status = resourceMonitor.current();
        BatchingStrategy strategy = catalog.select(status, characteristics);
        BigDecimal financialValue = calculateFinancialValue(items, characteristics);

        if (financialValue.compareTo(settings.maxFinancialBatchValue()) > 0) {
            log.warn("Rejecting batch for job {}: financial value {} exceeds limit {}",
                job, financialValue.toPlainString(), settings.maxFinancialBatchValue().toPlainString());
            auditLedger.append(batchAudit(BATCH_FAILED, job, strategy, AuditOutcome.FAILURE)
                .detail("reason", "FINANCIAL_LIMIT_EXCEEDED")
                .detail("itemCount", items.size())
                .detail("financialValue", financialValue)
                .detail("limit", settings.maxFinancialBatchValue())
                .build());
            throw new FinancialLimitExceededException(financialValue, settings.maxFinancialBatchValue());
        }

        int batchSize = calculateBatchSize(strategy, characteristics, status, items.size());
        ResourceAllocation allocation = calculateResourceAllocation(strategy, characteristics, batchSize);
        Bucket ioBucket = Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(allocation.ioLimit())
                .refillGreedy(allocation.ioLimit(), Duration.ofSeconds(1))
                .build())
            .build();

        log.debug("Processing {} items for job {} with strategy {} (batchSize={}, allocation={})",
            items.size(), job, strategy.name(), batchSize, allocation);

        List<SubBatchOutcome> outcomes = new ArrayList<>();
        List<String> deadLetterIds = new ArrayList<>();
        long totalProcessed = 0;
        long totalErrors = 0;
        long attempted = 0;
        long totalSubBatchMillis = 0;
        int totalBatches = 0;
        int failedBatches = 0;

        for (int start = 0; start < items.size(); start += batchSize) {
            List<T> batch = new ArrayList<>(items.subList(start, Math.min(start + batchSize, items.size())));
            applyResourceConstraints(allocation);
            awaitIoCapacity(ioBucket);

            long subStart = System.nanoTime();
            long processed;
            long errors;
            try {
                SubBatchOutcome outcome = breakerRegistry.execute(settings.serviceName(),
                    () -> processor.process(batch, characteristics));
                if (outcome == null) {
                    outcome = SubBatchOutcome.processed(batch.size());
                }
                processed = Math.min(outcome.processed(), batch.size());
                errors = Math.min(outcome.errors(), batch.size() - processed);
                outcomes.add(outcome);
            } catch (AuditWriteException e) {
                throw e;
            } catch (RuntimeException e) {
                processed = 0;
                errors = batch.size();
                failedBatches++;
                log.warn("Sub-batch at offset {} for job {} failed: {}", start, job, e.getMessage());
                deadLetterIds.add(deadLetter(job, start, batch, characteristics, e));
            }
            long subMillis = elapsedMillis(subStart);
            totalBatches++;
            totalSubBatchMillis += subMillis;
            totalProcessed += processed;
            totalErrors += errors;
            attempted += batch.size();

            recordSubBatch(batch.size(), processed, errors, subMillis, characteristics);
            if (settings.adaptive()) {
                adapt();
            }

            if (totalErrors > attempted * settings.abortErrorRatio()) {
                log.error("Aborting batch for job {}: {} of {} attempted items failed", job, totalErrors, attempted);
                auditLedger.append(batchAudit(BATCH_FAILED, job, strategy, AuditOutcome.FAILURE)
                    .detail("reason", "ERROR_THRESHOLD_EXCEEDED")
                    .detail("itemCount", items.size())
                    .detail("itemsAttempted", attempted)
                    .detail("totalErrors", totalErrors)
                    .detail("deadLetters", deadLetterIds.size())
                    .build());
                throw new BatchAbortedException(attempted, totalErrors);
            }
        }

        long elapsed = elapsedMillis(startNanos);
        int itemCount = items.size();
        BatchMetrics metrics = new BatchMetrics(
            itemCount,
            elapsed,
            resourceMonitor.current().heapUsedBytes(),
            throughput(totalProcessed, elapsed),
            itemCount == 0 ? 0.0 : (double) totalErrors / itemCount,
            itemCount == 0 ? 1.0 : (double) totalProcessed / itemCount,
            financialValue,
            true,
            clock.instant());

        AuditOutcome outcome = totalErrors == 0 ? AuditOutcome.SUCCESS : AuditOutcome.WARNING;
        auditLedger.append(batchAudit(BATCH_PROCESSED, job, strategy, outcome)
            .detail("itemCount", itemCount)
            .detail("batchSize", batchSize)
            .detail("totalBatches", totalBatches)
            .detail("failedBatches", failedBatches)
            .detail("totalProcessed", totalProcessed)
            .detail("totalErrors", totalErrors)
            .detail("errorRate", metrics.errorRate())
            .detail("financialValue", financialValue)
            .detail("dataType", characteristics.dataType().name())
            .detail("sensitivity", characteristics.sensitivity().name())
            .detail("processingTimeMs", elapsed)
            .build());

        log.info("Processed {} items for job {} in {} sub-batches ({} errors, {} ms)",
            totalProcessed, job, totalBatches, totalErrors, elapsed);

        return new BatchResult(strategy, batchSize, outcomes, totalBatches, failedBatches,
            totalProcessed, totalErrors,
            totalBatches == 0 ? 0.0 : (double) totalSubBatchMillis / totalBatches,
            metrics, allocation, deadLetterIds, clock.instant());
    }

    /**
     * Total value of the items. TRANSACTION items are summed through the
     * {@link FinancialValueExtractor}; other data is the per-record value times the count.
     */
    public BigDecimal calculateFinancialValue(List<?> items, DataCharacteristics characteristics) {
        if (characteristics.dataType() != DataType.TRANSACTION) {
            return characteristics.financialValue().multiply(BigDecimal.valueOf(items.size()));
        }
        BigDecimal total = BigDecimal.ZERO;
        for (Object item : items) {
            BigDecimal amount = valueExtractor.amountOf(item);
            if (amount != null) {
                total = total.add(amount);
            }
        }
        return total;
    }

    /**
     * Sub-batch size for a call.
     *
     * <p>The strategy's size is scaled by sensitivity (RESTRICTED x0.5, CONFIDENTIAL x0.7)
     * and data type (TRANSACTION x0.8, REFERENCE x1.5), capped by a tenth of the free heap
     * divided by the estimated record size, then clamped to the configured bounds. It never
     * exceeds {@code totalItems}, even when that is below the minimum.
     *
     * @return the size, or 0 when there are no items
     */
    public int calculateBatchSize(BatchingStrategy strategy, DataCharacteristics characteristics,
                                  SystemStatus status, int totalItems) {
        if (totalItems <= 0) {
            return 0;
        }
        double memoryLimited = Math.floor(status.availableHeapBytes() * 0.1 / estimateRecordSize(characteristics));
        double scaled = strategy.batchSize()
            * sensitivityMultiplier(characteristics.sensitivity())
            * typeMultiplier(characteristics.dataType());
        int size = (int) Math.floor(Math.min(Math.min(scaled, memoryLimited), settings.maxBatchSize()));
        size = Math.max(settings.minBatchSize(), size);
        return Math.min(size, totalItems);
    }

    /**
     * Resource envelope for a call.
     */
    public ResourceAllocation calculateResourceAllocation(BatchingStrategy strategy,
                                                          DataCharacteristics characteristics,
                                                          int batchSize) {
        double maxMemoryMb = Math.min((long) batchSize * 10, 2048);
        int concurrency = strategy.concurrency();
        int dbConnections = strategy.concurrency();

        if (characteristics.sensitivity() == Sensitivity.RESTRICTED) {
            maxMemoryMb *= 0.8;
            concurrency = Math.max(1, (int) Math.floor(concurrency * 0.7));
        }
        if (characteristics.financialValue().compareTo(HIGH_VALUE_RECORD) > 0) {
            dbConnections = Math.min(dbConnections, 4);
            concurrency = Math.min(concurrency, 6);
        }
        return new ResourceAllocation((long) maxMemoryMb, strategy.concurrency() * 12.5, concurrency,
            1000, 100, dbConnections);
    }

    /**
     * Averages over the last 50 sub-batches.
     */
    public PerformanceAnalytics getPerformanceAnalytics() {
        List<BatchMetrics> recent = history.lastN(ANALYTICS_WINDOW);
        if (recent.isEmpty()) {
            return PerformanceAnalytics.empty();
        }
        double throughput = recent.stream().mapToDouble(BatchMetrics::throughput).average().orElse(0);
        double processingTime = recent.stream().mapToLong(BatchMetrics::processingTimeMs).average().orElse(0);
        double errorRate = recent.stream().mapToDouble(BatchMetrics::errorRate).average().orElse(0);
        SystemStatus status = resourceMonitor.current();

        List<String> recommendations = new ArrayList<>();
        if (errorRate > 0.05) {
            recommendations.add("High error rate detected - consider reducing batch sizes");
        }
        if (status.memoryUsage() > 0.8) {
            recommendations.add("High memory usage - consider optimizing batch sizes");
        }
        if (processingTime > settings.targetProcessingTime().toMillis() * 1.5) {
            recommendations.add("Processing time exceeds targets - consider increasing resources");
        }
        if (throughput < 100) {
            recommendations.add("Low throughput - consider optimizing batching strategy");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Performance metrics are within acceptable ranges");
        }

        return new PerformanceAnalytics(
            recent.size(),
            round(throughput, 2),
            Math.round(processingTime),
            round(errorRate, 4),
            status.memoryUsage(),
            status.cpuUsage(),
            recommendations);
    }

    /**
     * Sub-batch metrics, oldest first.
     */
    public List<BatchMetrics> getHistory() {
        return history.snapshot();
    }

    public StrategyCatalog getCatalog() {
        return catalog;
    }

    public BatchingSettings getSettings() {
        return settings;
    }

    // --- Sub-batch plumbing ---

    private void applyResourceConstraints(ResourceAllocation allocation) {
        SystemStatus status = resourceMonitor.current();
        if (status.heapUsedBytes() > allocation.maxMemoryMb() * 1024 * 1024) {
            resourceMonitor.reclaimMemory();
        }
        if (allocation.maxCpuPercent() / 100 > 0.9 && !settings.cpuYieldDelay().isZero()) {
            try {
                Thread.sleep(settings.cpuYieldDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReliabilityException("Interrupted while yielding CPU", e);
            }
        }
    }

    private void awaitIoCapacity(Bucket ioBucket) {
        try {
            ioBucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReliabilityException("Interrupted while waiting for I/O capacity", e);
        }
    }

    private <T> String deadLetter(String jobId, int batchStart, List<T> batch,
                                  DataCharacteristics characteristics, Exception failure) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("recordSize", characteristics.recordSize());
        data.put("financialValue", characteristics.financialValue());
        data.put("dataType", characteristics.dataType().name());
        data.put("sensitivity", characteristics.sensitivity().name());
        data.put("complianceRequirements", characteristics.complianceRequirements());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batchStart", batchStart);
        payload.put("batchSize", batch.size());
        payload.put("dataCharacteristics", data);
        payload.put("partialData", new ArrayList<>(batch.subList(0, Math.min(DEAD_LETTER_SAMPLE, batch.size()))));

        String reason = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        return deadLetterQueue.enqueue(DeadLetter.pending(jobId, DeadLetterFailureType.PROCESSING_ERROR,
            reason, payload, settings.deadLetterMaxRetries(), clock.instant()));
    }

    private void recordSubBatch(int size, long processed, long errors, long millis,
                                DataCharacteristics characteristics) {
        double errorRate = size == 0 ? 0.0 : (double) errors / size;
        BatchMetrics metrics = new BatchMetrics(
            size,
            millis,
            resourceMonitor.current().heapUsedBytes(),
            throughput(processed, millis),
            errorRate,
            size == 0 ? 1.0 : (double) processed / size,
            characteristics.financialValue().multiply(BigDecimal.valueOf(size)),
            true,
            clock.instant());
        history.add(metrics);

        metricSink.recordBusinessMetric(MetricCategory.VOLUME, "enhanced_batch_throughput",
            metrics.throughput(), "records/sec", Map.of(
                "batchSize", size,
                "processingTime", millis,
                "errorRate", errorRate,
                "compliancePassed", true));
        metricSink.recordSlaMetric("batch_processing_time", millis, "ms",
            settings.targetProcessingTime().toMillis(), Map.of("batchSize", size));
    }

    /**
     * Shrink or grow every catalog strategy from the last few sub-batches.
     */
    private void adapt() {
        List<BatchMetrics> recent = history.lastN(ADAPTIVE_WINDOW);
        if (recent.size() < ADAPTIVE_MIN_SAMPLES) {
            return;
        }
        double avgTime = recent.stream().mapToLong(BatchMetrics::processingTimeMs).average().orElse(0);
        double avgErrorRate = recent.stream().mapToDouble(BatchMetrics::errorRate).average().orElse(0);
        long target = settings.targetProcessingTime().toMillis();

        if (avgTime > target * 1.5 || avgErrorRate > 0.05) {
            log.debug("Shrinking batch strategies (avgTime={} ms, avgErrorRate={})", avgTime, avgErrorRate);
            catalog.resizeAll(size -> Math.max(settings.minBatchSize(), (int) Math.floor(size * 0.8)));
        } else if (avgTime < target * 0.5 && avgErrorRate < 0.01) {
            log.debug("Growing batch strategies (avgTime={} ms, avgErrorRate={})", avgTime, avgErrorRate);
            catalog.resizeAll(size -> Math.min(settings.maxBatchSize(), (int) Math.floor(size * 1.2)));
        }
    }

    private AuditRecord.Builder batchAudit(String eventType, String jobId, BatchingStrategy strategy,
                                           AuditOutcome outcome) {
        return AuditRecord.builder(eventType, jobId)
            .chainId(jobId)
            .entityType("BATCH")
            .actor(DEFAULT_JOB_ID)
            .action("PROCESS_BATCH")
            .resource("batch_strategy:" + strategy.name())
            .outcome(outcome)
            .detail("strategy", strategy.name());
    }

    private static double estimateRecordSize(DataCharacteristics characteristics) {
        double size = characteristics.recordSize();
        if (characteristics.isFinancial()) {
            size *= 1.5;
        }
        return size * (1 + characteristics.complianceRequirements().size() * 0.1);
    }

    private static double sensitivityMultiplier(Sensitivity sensitivity) {
        return switch (sensitivity) {
            case RESTRICTED -> 0.5;
            case CONFIDENTIAL -> 0.7;
            default -> 1.0;
        };
    }

    private static double typeMultiplier(DataType dataType) {
        return switch (dataType) {
            case TRANSACTION -> 0.8;
            case REFERENCE -> 1.5;
            default -> 1.0;
        };
    }

    private static double throughput(long processed, long millis) {
        return processed / (Math.max(millis, 1) / 1000.0);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
