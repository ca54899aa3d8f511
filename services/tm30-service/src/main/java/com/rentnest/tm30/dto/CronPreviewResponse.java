package com.rentnest.tm30.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Read-only view of what the daily job would pick up right now
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronPreviewResponse {

    private String schedule;
    private Instant now;
    private LocalDate thailandDate;
    private Instant windowStart;
    private Instant windowEnd;
    private long bookingsToSubmitToday;
}
