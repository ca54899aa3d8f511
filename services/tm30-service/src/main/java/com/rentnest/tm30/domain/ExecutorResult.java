package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer of the automation executor to a trigger request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutorResult {

    private Status status;

    private String detail;

    public enum Status {
        /**
         * The executor took the batch and will report back asynchronously
         */
        ACCEPTED,

        /**
         * The executor refused the batch, or the call failed or timed out
         */
        REJECTED,

        /**
         * No automated executor is configured. The batch must be filed by hand
         */
        UNAVAILABLE
    }

    public static ExecutorResult accepted(String detail) {
        return new ExecutorResult(Status.ACCEPTED, detail);
    }

    public static ExecutorResult rejected(String detail) {
        return new ExecutorResult(Status.REJECTED, detail);
    }

    public static ExecutorResult unavailable(String detail) {
        return new ExecutorResult(Status.UNAVAILABLE, detail);
    }
}
