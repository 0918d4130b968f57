package com.ivamare.reliability.exception;

import java.math.BigDecimal;

/**
 * Raised by the batching pre-flight gate when the aggregate financial value
 * of a call is above the configured ceiling. No sub-batch has run.
 */
public class FinancialLimitExceededException extends ReliabilityException {

    private final BigDecimal financialValue;
    private final BigDecimal limit;

    public FinancialLimitExceededException(BigDecimal financialValue, BigDecimal limit) {
        super("Batch financial value " + financialValue.toPlainString()
            + " exceeds maximum of " + limit.toPlainString());
        this.financialValue = financialValue;
        this.limit = limit;
    }

    public BigDecimal getFinancialValue() {
        return financialValue;
    }

    public BigDecimal getLimit() {
        return limit;
    }
}
