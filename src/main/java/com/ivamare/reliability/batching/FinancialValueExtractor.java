package com.ivamare.reliability.batching;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Reads the monetary amount of one TRANSACTION item.
 */
@FunctionalInterface
public interface FinancialValueExtractor {

    /**
     * @return the item's amount, or zero when it carries none
     */
    BigDecimal amountOf(Object item);

    /**
     * Reads {@link FinancialAmount#amount()}, or the {@code amount} key of a {@link Map}.
     * Numbers and numeric strings are accepted; anything else counts as zero.
     */
    static FinancialValueExtractor defaultExtractor() {
        return item -> {
            Object raw;
            if (item instanceof FinancialAmount financial) {
                raw = financial.amount();
            } else if (item instanceof Map<?, ?> map) {
                raw = map.get("amount");
            } else {
                return BigDecimal.ZERO;
            }
            if (raw instanceof BigDecimal decimal) {
                return decimal;
            }
            if (raw instanceof Number number) {
                return new BigDecimal(number.toString());
            }
            if (raw instanceof String text && !text.isBlank()) {
                try {
                    return new BigDecimal(text.trim());
                } catch (NumberFormatException e) {
                    return BigDecimal.ZERO;
                }
            }
            return BigDecimal.ZERO;
        };
    }
}
