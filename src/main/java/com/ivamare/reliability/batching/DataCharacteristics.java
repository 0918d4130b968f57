package com.ivamare.reliability.batching;

import com.ivamare.reliability.model.DataType;
import com.ivamare.reliability.model.Sensitivity;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Describes the items passed to one {@link BatchingEngine#processBatch} call.
 *
 * @param recordSize Approximate size of one record in bytes
 * @param financialValue Value carried by one record; zero for non-financial data
 * @param dataType Kind of data
 * @param sensitivity Classification of the data
 * @param complianceRequirements Compliance regimes the data falls under (e.g. "PCI-DSS", "GDPR")
 */
public record DataCharacteristics(
    long recordSize,
    BigDecimal financialValue,
    DataType dataType,
    Sensitivity sensitivity,
    List<String> complianceRequirements
) {
    public DataCharacteristics {
        if (recordSize <= 0) {
            throw new IllegalArgumentException("recordSize must be positive");
        }
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(sensitivity, "sensitivity");
        financialValue = financialValue != null ? financialValue : BigDecimal.ZERO;
        complianceRequirements = complianceRequirements != null ? List.copyOf(complianceRequirements) : List.of();
    }

    /**
     * Characteristics with no financial value and no compliance requirements.
     */
    public static DataCharacteristics of(long recordSize, DataType dataType, Sensitivity sensitivity) {
        return new DataCharacteristics(recordSize, BigDecimal.ZERO, dataType, sensitivity, List.of());
    }

    public boolean isFinancial() {
        return financialValue.signum() > 0;
    }
}
