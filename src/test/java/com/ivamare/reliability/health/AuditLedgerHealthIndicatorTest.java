package com.ivamare.reliability.health;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.ChainVerification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("AuditLedgerHealthIndicator")
class AuditLedgerHealthIndicatorTest {

    @Test
    @DisplayName("should return UP before any verification")
    void shouldReturnUpBeforeVerification() {
        AuditLedger ledger = mock(AuditLedger.class);
        when(ledger.chainIds()).thenReturn(Set.of());

        Health health = new AuditLedgerHealthIndicator(ledger).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("none", health.getDetails().get("lastVerification"));
        assertEquals(0, health.getDetails().get("chains"));
    }

    @Test
    @DisplayName("should return UP after a valid verification")
    void shouldReturnUpAfterValidVerification() {
        AuditLedger ledger = mock(AuditLedger.class);
        when(ledger.chainIds()).thenReturn(Set.of("job-7", "job-8"));
        when(ledger.getLastVerification()).thenReturn(new ChainVerification(true, 1.0, 5, List.of(), List.of()));

        Health health = new AuditLedgerHealthIndicator(ledger).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("valid", health.getDetails().get("lastVerification"));
        assertEquals(2, health.getDetails().get("chains"));
        assertEquals(5, health.getDetails().get("chainLength"));
    }

    @Test
    @DisplayName("should return DOWN after a failed verification")
    void shouldReturnDownAfterFailedVerification() {
        AuditLedger ledger = mock(AuditLedger.class);
        when(ledger.chainIds()).thenReturn(Set.of("job-7"));
        when(ledger.getLastVerification())
            .thenReturn(new ChainVerification(false, 0.8, 5, List.of("e-3"), List.of()));

        Health health = new AuditLedgerHealthIndicator(ledger).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("invalid", health.getDetails().get("lastVerification"));
        assertEquals(0.8, health.getDetails().get("integrityScore"));
        assertEquals(1, health.getDetails().get("corruptedEntries"));
    }
}
