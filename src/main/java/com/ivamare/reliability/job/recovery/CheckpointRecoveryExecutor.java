package com.ivamare.reliability.job.recovery;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.exception.InvalidOperationException;
import com.ivamare.reliability.job.CheckpointChecksums;
import com.ivamare.reliability.job.JobCheckpoint;
import com.ivamare.reliability.job.JobRestarter;
import com.ivamare.reliability.job.RecoveryStrategy;
import com.ivamare.reliability.job.RecoveryStrategyType;
import com.ivamare.reliability.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resumes a job after the strategy's checkpoint, once its checksum verifies.
 */
public class CheckpointRecoveryExecutor implements RecoveryExecutor {

    private static final Logger log = LoggerFactory.getLogger(CheckpointRecoveryExecutor.class);

    public static final String EXECUTED = "CHECKPOINT_RECOVERY_EXECUTED";

    private final CheckpointRepository checkpointRepository;
    private final CheckpointChecksums checksums;
    private final JobRestarter restarter;
    private final AuditLedger auditLedger;

    public CheckpointRecoveryExecutor(
            CheckpointRepository checkpointRepository,
            CheckpointChecksums checksums,
            JobRestarter restarter,
            AuditLedger auditLedger) {
        this.checkpointRepository = checkpointRepository;
        this.checksums = checksums;
        this.restarter = restarter;
        this.auditLedger = auditLedger;
    }

    @Override
    public RecoveryStrategyType type() {
        return RecoveryStrategyType.RESTART_FROM_CHECKPOINT;
    }

    @Override
    public boolean execute(RecoveryStrategy strategy) {
        if (strategy.checkpointIds().isEmpty()) {
            throw new InvalidOperationException("No checkpoint to restart job " + strategy.jobId() + " from");
        }
        String checkpointId = strategy.checkpointIds().get(0);
        JobCheckpoint checkpoint = checkpointRepository.findById(checkpointId)
            .orElseThrow(() -> new InvalidOperationException("Checkpoint not found: " + checkpointId));
        if (!checksums.verify(checkpoint)) {
            throw new InvalidOperationException("Checkpoint integrity check failed: " + checkpointId);
        }

        String executionId = strategy.executionId() != null ? strategy.executionId() : checkpoint.executionId();
        log.info("Restarting job {} from checkpoint {} ({})", strategy.jobId(), checkpointId, checkpoint.stepName());
        restarter.restartFromCheckpoint(strategy.jobId(), executionId, checkpoint);

        auditLedger.append(AuditRecord.builder(EXECUTED, strategy.jobId())
            .entityType("JOB")
            .actor("job-state-manager")
            .action("RESTART_FROM_CHECKPOINT")
            .resource("checkpoint:" + checkpointId)
            .detail("strategy", strategy.strategy().name())
            .detail("executionId", executionId)
            .detail("checkpointId", checkpointId)
            .detail("stepName", checkpoint.stepName())
            .detail("dataProcessed", checkpoint.dataProcessed())
            .build());
        return true;
    }
}
