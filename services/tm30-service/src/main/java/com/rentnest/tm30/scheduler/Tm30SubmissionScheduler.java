package com.rentnest.tm30.scheduler;

import com.rentnest.tm30.domain.ScheduledRunReport;
import com.rentnest.tm30.service.Tm30DailySubmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs for the TM30 service
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "tm30.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class Tm30SubmissionScheduler {

    private final Tm30DailySubmissionService dailySubmissionService;

    /**
     * Submit TM30 for today's check-ins
     * Runs daily at 06:00 Thailand time
     */
    @Scheduled(cron = "${tm30.scheduler.cron:0 0 6 * * *}", zone = "${tm30.zone:Asia/Bangkok}")
    public void submitTodaysCheckIns() {
        log.info("=== Scheduled Job: TM30 Daily Submission ===");
        try {
            ScheduledRunReport report = dailySubmissionService.runDailySubmission();
            log.info("TM30 daily submission for {}: {}", report.getDate(), report.getMessage());
        } catch (Exception e) {
            log.error("Error running TM30 daily submission", e);
        }
    }
}
