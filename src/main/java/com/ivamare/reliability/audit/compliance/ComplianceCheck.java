package com.ivamare.reliability.audit.compliance;

import com.ivamare.reliability.audit.FinancialEvent;

/**
 * A real-time compliance check run on every recorded financial event.
 *
 * <p>Implementations must depend only on the event's fields, so the same event
 * always yields the same result.
 */
public interface ComplianceCheck {

    /**
     * Name recorded on violation entries.
     */
    String name();

    ComplianceCheckResult evaluate(FinancialEvent event);
}
