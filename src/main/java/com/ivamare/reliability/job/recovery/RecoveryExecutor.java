package com.ivamare.reliability.job.recovery;

import com.ivamare.reliability.job.RecoveryStrategy;
import com.ivamare.reliability.job.RecoveryStrategyType;

/**
 * Carries out one kind of {@link RecoveryStrategy}.
 *
 * <p>Executors audit their own outcome. A thrown exception is audited as
 * {@code RECOVERY_FAILED} by the caller.
 */
public interface RecoveryExecutor {

    RecoveryStrategyType type();

    /**
     * @return true if the job was recovered, false if human action is still required
     */
    boolean execute(RecoveryStrategy strategy);
}
