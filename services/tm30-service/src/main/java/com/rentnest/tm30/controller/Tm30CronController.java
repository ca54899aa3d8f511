package com.rentnest.tm30.controller;

import com.rentnest.tm30.domain.ScheduledRunReport;
import com.rentnest.tm30.dto.CronPreviewResponse;
import com.rentnest.tm30.service.Tm30AccessPolicy;
import com.rentnest.tm30.service.Tm30DailySubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * On-demand trigger for the daily TM30 submission job, for external cron runners
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tm30/cron/submit")
@RequiredArgsConstructor
@Tag(name = "TM30 Cron", description = "Daily TM30 submission trigger")
public class Tm30CronController {

    private final Tm30DailySubmissionService dailySubmissionService;
    private final Tm30AccessPolicy accessPolicy;

    @PostMapping
    @Operation(summary = "Run the daily TM30 submission now")
    public ResponseEntity<ScheduledRunReport> run(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        accessPolicy.checkCronAuthorization(authorization);
        log.info("TM30 daily submission triggered through cron endpoint");
        return ResponseEntity.ok(dailySubmissionService.runDailySubmission());
    }

    @GetMapping
    @Operation(summary = "Preview how many bookings today's run would submit")
    public ResponseEntity<CronPreviewResponse> preview(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        accessPolicy.checkCronAuthorization(authorization);
        return ResponseEntity.ok(dailySubmissionService.preview());
    }
}
