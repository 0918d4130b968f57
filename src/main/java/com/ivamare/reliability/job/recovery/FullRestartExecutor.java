package com.ivamare.reliability.job.recovery;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.job.JobRestarter;
import com.ivamare.reliability.job.RecoveryStrategy;
import com.ivamare.reliability.job.RecoveryStrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restarts a job from the beginning.
 */
public class FullRestartExecutor implements RecoveryExecutor {

    private static final Logger log = LoggerFactory.getLogger(FullRestartExecutor.class);

    public static final String EXECUTED = "FULL_RESTART_EXECUTED";

    private final JobRestarter restarter;
    private final AuditLedger auditLedger;

    public FullRestartExecutor(JobRestarter restarter, AuditLedger auditLedger) {
        this.restarter = restarter;
        this.auditLedger = auditLedger;
    }

    @Override
    public RecoveryStrategyType type() {
        return RecoveryStrategyType.FULL_RESTART;
    }

    @Override
    public boolean execute(RecoveryStrategy strategy) {
        log.info("Fully restarting job {}", strategy.jobId());
        restarter.restartFull(strategy.jobId(), strategy.executionId());
        auditLedger.append(AuditRecord.builder(EXECUTED, strategy.jobId())
            .entityType("JOB")
            .actor("job-state-manager")
            .action("FULL_RESTART")
            .resource("job:" + strategy.jobId())
            .detail("strategy", strategy.strategy().name())
            .detail("executionId", strategy.executionId())
            .build());
        return true;
    }
}
