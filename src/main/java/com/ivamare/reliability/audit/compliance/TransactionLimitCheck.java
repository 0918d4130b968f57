package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.FinancialEvent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily and monthly limit check. Limits come from event metadata
 * ({@code dailyLimit}, {@code monthlyLimit}) with configured fallbacks.
 */
public class TransactionLimitCheck implements ComplianceCheck {

    private final BigDecimal defaultDailyLimit;
    private final BigDecimal defaultMonthlyLimit;

    public TransactionLimitCheck(BigDecimal defaultDailyLimit, BigDecimal defaultMonthlyLimit) {
        this.defaultDailyLimit = defaultDailyLimit;
        this.defaultMonthlyLimit = defaultMonthlyLimit;
    }

    @Override
    public String name() {
        return "TRANSACTION_LIMITS";
    }

    @Override
    public ComplianceCheckResult evaluate(FinancialEvent event) {
        List<String> violations = new ArrayList<>();
        if (event.hasAmount()) {
            BigDecimal daily = MetadataValues.decimal(event.metadata(), "dailyLimit", defaultDailyLimit);
            if (event.amount().compareTo(daily) > 0) {
                violations.add("Transaction amount exceeds daily limit of $" + daily.toPlainString());
            }
            BigDecimal monthly = MetadataValues.decimal(event.metadata(), "monthlyLimit", defaultMonthlyLimit);
            if (event.amount().compareTo(monthly) > 0) {
                violations.add("Transaction amount exceeds monthly limit of $" + monthly.toPlainString());
            }
        }
        return ComplianceCheckResult.of(name(), violations);
    }
}
