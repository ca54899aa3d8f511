package com.rentnest.tm30.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rentnest.tm30.domain.DispatchOutcome;
import com.rentnest.tm30.domain.DispatchResult;
import com.rentnest.tm30.domain.Tm30Submission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResponse {

    private boolean success;
    private DispatchOutcome outcome;
    private UUID bookingId;
    private String message;
    private Integer guestsTriggered;
    private Boolean dryRun;
    private Boolean manualMode;
    private List<Tm30Submission> submissions;
    private String error;

    public static DispatchResponse from(DispatchResult result) {
        boolean manual = result.getOutcome() == DispatchOutcome.MANUAL_MODE;
        return DispatchResponse.builder()
                .success(result.isSuccess())
                .outcome(result.getOutcome())
                .bookingId(result.getBookingId())
                .message(result.getMessage())
                .guestsTriggered(result.getGuestsTriggered())
                .dryRun(result.isDryRun())
                .manualMode(manual ? Boolean.TRUE : null)
                .submissions(result.getSubmissions())
                .error(result.getError())
                .build();
    }
}
