package com.rentnest.tm30.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request DTO for an operator-triggered TM30 submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tm30SubmitRequest {

    @NotNull(message = "Booking ID is required")
    private UUID bookingId;

    /**
     * Submit only this guest when set
     */
    private UUID guestId;

    /**
     * Defaults to true: a test filing unless explicitly turned off
     */
    private Boolean dryRun;

    public boolean isDryRunRequested() {
        return dryRun == null || dryRun;
    }
}
