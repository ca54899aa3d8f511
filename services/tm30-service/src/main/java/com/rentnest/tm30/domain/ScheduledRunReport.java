package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one run of the daily submission job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledRunReport {

    /**
     * Thailand calendar date the run covered
     */
    private LocalDate date;

    private String message;

    @Builder.Default
    private List<BookingRunOutcome> results = new ArrayList<>();

    public int getProcessed() {
        return results.size();
    }
}
