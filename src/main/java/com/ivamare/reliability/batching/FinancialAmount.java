package com.ivamare.reliability.batching;

import java.math.BigDecimal;

/**
 * Implemented by items that carry a monetary amount.
 */
public interface FinancialAmount {

    BigDecimal amount();
}
