package com.rentnest.tm30.executor;

import com.rentnest.tm30.domain.ExecutorResult;
import com.rentnest.tm30.domain.SubmissionBatch;

/**
 * Hands a TM30 filing batch to whatever performs the filing with the immigration portal
 * Implementations report failures through {@link ExecutorResult}, they do not throw
 */
public interface AutomationExecutor {

    ExecutorResult trigger(SubmissionBatch batch);

    /**
     * Short name for logs
     */
    String name();
}
