package com.ivamare.reliability.job.recovery;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.job.RecoveryStrategy;
import com.ivamare.reliability.job.RecoveryStrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resets every OPEN circuit breaker so a degraded job can make progress again.
 */
public class CircuitBreakerBypassExecutor implements RecoveryExecutor {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerBypassExecutor.class);

    public static final String EXECUTED = "CIRCUIT_BREAKER_BYPASS_EXECUTED";

    private final CircuitBreakerRegistry breakerRegistry;
    private final AuditLedger auditLedger;

    public CircuitBreakerBypassExecutor(CircuitBreakerRegistry breakerRegistry, AuditLedger auditLedger) {
        this.breakerRegistry = breakerRegistry;
        this.auditLedger = auditLedger;
    }

    @Override
    public RecoveryStrategyType type() {
        return RecoveryStrategyType.CIRCUIT_BREAKER_BYPASS;
    }

    @Override
    public boolean execute(RecoveryStrategy strategy) {
        List<String> reset = breakerRegistry.resetOpenBreakers();
        log.info("Circuit breaker bypass for job {} reset {} breakers {}", strategy.jobId(), reset.size(), reset);
        auditLedger.append(AuditRecord.builder(EXECUTED, strategy.jobId())
            .entityType("JOB")
            .actor("job-state-manager")
            .action("CIRCUIT_BREAKER_BYPASS")
            .resource("job:" + strategy.jobId())
            .detail("strategy", strategy.strategy().name())
            .detail("resetServices", reset)
            .build());
        return true;
    }
}
