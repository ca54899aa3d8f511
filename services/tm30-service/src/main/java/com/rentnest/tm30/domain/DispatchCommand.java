package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Scope of a dispatch: one guest or the whole booking, test or live filing
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchCommand {

    /**
     * Restricts the batch to one guest when set
     */
    private UUID guestId;

    private boolean dryRun;

    /**
     * Whole booking, live filing. Used by the daily job
     */
    public static DispatchCommand live() {
        return new DispatchCommand(null, false);
    }
}
