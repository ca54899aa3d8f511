package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A booking's filing batch handed to the automation executor
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionBatch {

    private UUID bookingId;

    private List<Tm30Submission> submissions;

    private boolean dryRun;

    private DispatchTrigger triggeredBy;

    private Instant triggeredAt;
}
