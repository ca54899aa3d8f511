package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Typed result of a dispatch. Upstream failures are reported here, never thrown
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchResult {

    private DispatchOutcome outcome;

    private UUID bookingId;

    private int guestsTriggered;

    private boolean dryRun;

    private String message;

    private String error;

    /**
     * Populated only in manual mode
     */
    private List<Tm30Submission> submissions;

    public boolean isSuccess() {
        return outcome == DispatchOutcome.DISPATCHED || outcome == DispatchOutcome.MANUAL_MODE;
    }

    public static DispatchResult dispatched(UUID bookingId, int guests, boolean dryRun) {
        return DispatchResult.builder()
                .outcome(DispatchOutcome.DISPATCHED)
                .bookingId(bookingId)
                .guestsTriggered(guests)
                .dryRun(dryRun)
                .message(String.format("TM30 %s triggered for %d guest(s)", dryRun ? "dry run" : "submission", guests))
                .build();
    }

    public static DispatchResult manualMode(UUID bookingId, List<Tm30Submission> submissions, boolean dryRun, String reason) {
        return DispatchResult.builder()
                .outcome(DispatchOutcome.MANUAL_MODE)
                .bookingId(bookingId)
                .guestsTriggered(submissions.size())
                .dryRun(dryRun)
                .submissions(submissions)
                .message("Automation executor not configured. Submit manually: " + reason)
                .build();
    }

    public static DispatchResult nothingEligible(UUID bookingId) {
        return DispatchResult.builder()
                .outcome(DispatchOutcome.NOTHING_ELIGIBLE)
                .bookingId(bookingId)
                .message("No guests to submit (all already submitted or missing passport data)")
                .build();
    }

    public static DispatchResult inFlight(UUID bookingId) {
        return DispatchResult.builder()
                .outcome(DispatchOutcome.IN_FLIGHT)
                .bookingId(bookingId)
                .message("A TM30 submission is already in progress for this booking")
                .build();
    }

    public static DispatchResult failed(UUID bookingId, int guests, boolean dryRun, String error) {
        return DispatchResult.builder()
                .outcome(DispatchOutcome.DISPATCH_FAILED)
                .bookingId(bookingId)
                .guestsTriggered(guests)
                .dryRun(dryRun)
                .error(error)
                .message("Failed to trigger TM30 submission")
                .build();
    }
}
