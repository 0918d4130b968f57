package com.ivamare.reliability.batching;

import com.ivamare.reliability.model.DataType;
import com.ivamare.reliability.model.Sensitivity;

import java.math.BigDecimal;
import java.util.List;

/**
 * The system state and data shape a {@link BatchingStrategy} is tuned for.
 *
 * @param maxMemoryUsage Heap usage ratio below which the strategy is comfortable
 * @param maxCpuUsage CPU usage ratio below which the strategy is comfortable
 * @param maxSystemLoad System load ratio below which the strategy is comfortable
 * @param recordSize Typical record size in bytes
 * @param financialValue Typical value per record
 * @param dataType Data type the strategy targets
 * @param sensitivity Sensitivity the strategy targets
 * @param complianceRequirements Compliance regimes the strategy expects
 * @param maxFailureRate Error rate below which the strategy is comfortable
 */
public record StrategyConditions(
    double maxMemoryUsage,
    double maxCpuUsage,
    double maxSystemLoad,
    long recordSize,
    BigDecimal financialValue,
    DataType dataType,
    Sensitivity sensitivity,
    List<String> complianceRequirements,
    double maxFailureRate
) {
    public StrategyConditions {
        complianceRequirements = complianceRequirements != null ? List.copyOf(complianceRequirements) : List.of();
        financialValue = financialValue != null ? financialValue : BigDecimal.ZERO;
    }
}
