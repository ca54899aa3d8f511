package com.rentnest.tm30.executor;

import com.rentnest.tm30.domain.ExecutorResult;
import com.rentnest.tm30.domain.SubmissionBatch;
import lombok.extern.slf4j.Slf4j;

/**
 * Used when no workflow credential is configured. Every batch goes back to the caller for filing by hand
 */
@Slf4j
public class ManualHandoffExecutor implements AutomationExecutor {

    @Override
    public ExecutorResult trigger(SubmissionBatch batch) {
        log.info("No automation executor configured, handing booking {} back for manual filing", batch.getBookingId());
        return ExecutorResult.unavailable("tm30.executor.token is not set");
    }

    @Override
    public String name() {
        return "manual-handoff";
    }
}
