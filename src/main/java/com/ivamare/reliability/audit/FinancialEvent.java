package com.ivamare.reliability.audit;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A financial event to be recorded and compliance-checked.
 *
 * @param eventId Event id
 * @param transactionId Transaction id (nullable)
 * @param accountId Account id (nullable)
 * @param userId Acting user (nullable; SYSTEM when absent)
 * @param amount Amount (nullable)
 * @param currency ISO currency code
 * @param eventType Kind of event
 * @param timestamp When the event happened
 * @param metadata Compliance hints such as {@code customerVerified} or {@code crossBorder}
 * @param riskScore Risk score in [0, 1] (nullable)
 * @param complianceFlags Flags attached by upstream systems
 */
public record FinancialEvent(
    String eventId,
    String transactionId,
    String accountId,
    String userId,
    BigDecimal amount,
    String currency,
    FinancialEventType eventType,
    Instant timestamp,
    Map<String, Object> metadata,
    Double riskScore,
    List<String> complianceFlags
) {
    public FinancialEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        complianceFlags = complianceFlags != null ? List.copyOf(complianceFlags) : List.of();
    }

    /**
     * Entity the event is recorded against: transaction, then account, then event id.
     */
    public String entityId() {
        if (transactionId != null) {
            return transactionId;
        }
        return accountId != null ? accountId : eventId;
    }

    public boolean hasAmount() {
        return amount != null && amount.signum() != 0;
    }
}
