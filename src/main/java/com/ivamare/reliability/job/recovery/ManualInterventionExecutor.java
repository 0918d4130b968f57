package com.ivamare.reliability.job.recovery;

import com.ivamare.reliability.audit.AuditLedger;
import com.ivamare.reliability.audit.AuditRecord;
import com.ivamare.reliability.job.RecoveryStrategy;
import com.ivamare.reliability.job.RecoveryStrategyType;
import com.ivamare.reliability.metrics.Alert;
import com.ivamare.reliability.metrics.AlertCategory;
import com.ivamare.reliability.metrics.AlertSeverity;
import com.ivamare.reliability.metrics.MetricSink;
import com.ivamare.reliability.model.AuditOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Records that a person must recover the job. Never reports success.
 */
public class ManualInterventionExecutor implements RecoveryExecutor {

    private static final Logger log = LoggerFactory.getLogger(ManualInterventionExecutor.class);

    public static final String REQUIRED = "MANUAL_INTERVENTION_REQUIRED";

    private final AuditLedger auditLedger;
    private final MetricSink metricSink;

    public ManualInterventionExecutor(AuditLedger auditLedger, MetricSink metricSink) {
        this.auditLedger = auditLedger;
        this.metricSink = metricSink;
    }

    @Override
    public RecoveryStrategyType type() {
        return RecoveryStrategyType.MANUAL_INTERVENTION;
    }

    @Override
    public boolean execute(RecoveryStrategy strategy) {
        log.warn("Manual intervention required for job {}", strategy.jobId());
        auditLedger.append(AuditRecord.builder(REQUIRED, strategy.jobId())
            .entityType("JOB")
            .actor("job-state-manager")
            .action("MANUAL_INTERVENTION")
            .resource("job:" + strategy.jobId())
            .outcome(AuditOutcome.WARNING)
            .detail("strategy", strategy.strategy().name())
            .detail("steps", strategy.steps())
            .build());
        metricSink.raiseAlert(Alert.of(AlertSeverity.CRITICAL, AlertCategory.SYSTEM,
            "Manual intervention required for job " + strategy.jobId(),
            Map.of("jobId", strategy.jobId(), "strategy", strategy.strategy().name())));
        return false;
    }
}
