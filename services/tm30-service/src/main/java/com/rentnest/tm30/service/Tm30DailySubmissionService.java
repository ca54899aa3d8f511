package com.rentnest.tm30.service;

import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.BookingRunOutcome;
import com.rentnest.tm30.domain.DispatchCommand;
import com.rentnest.tm30.domain.DispatchResult;
import com.rentnest.tm30.domain.DispatchTrigger;
import com.rentnest.tm30.domain.ScheduledRunReport;
import com.rentnest.tm30.domain.SubmissionWindow;
import com.rentnest.tm30.dto.CronPreviewResponse;
import com.rentnest.tm30.entity.BookingGuest;
import com.rentnest.tm30.entity.BookingStatus;
import com.rentnest.tm30.entity.BookingTm30Status;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.repository.RentalBookingRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Files TM30 for every booking checking in today (Thailand time) whose passports are all in
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Tm30DailySubmissionService {

    private final RentalBookingRepository bookingRepository;
    private final Tm30SubmissionDispatcher dispatcher;
    private final Tm30Properties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter bookingsProcessedCounter;

    @PostConstruct
    public void initMetrics() {
        bookingsProcessedCounter = Counter.builder("tm30.scheduler.bookings")
                .description("Bookings handled by the daily TM30 submission job")
                .register(meterRegistry);
    }

    /**
     * Dispatch every due booking, one at a time. A failure on one booking is
     * recorded in its outcome and the run carries on.
     */
    public ScheduledRunReport runDailySubmission() {
        SubmissionWindow window = SubmissionWindow.today(clock, properties.getZone());
        log.info("TM30 daily submission for {} (window {} - {})", window.date(), window.start(), window.end());

        List<RentalBooking> due = bookingRepository.findDueForSubmission(
                window.start(), window.end(), BookingTm30Status.PASSPORT_RECEIVED, BookingStatus.CONFIRMED);
        if (due.isEmpty()) {
            log.info("No bookings need TM30 submission today");
            return ScheduledRunReport.builder()
                    .date(window.date())
                    .message("No bookings to process today")
                    .build();
        }

        List<BookingRunOutcome> results = new ArrayList<>();
        for (RentalBooking booking : due) {
            results.add(processBooking(booking));
            bookingsProcessedCounter.increment();
        }

        long triggered = results.stream().filter(r -> r.getStatus() == BookingRunOutcome.Status.TRIGGERED).count();
        log.info("TM30 daily submission finished: {} booking(s), {} triggered", results.size(), triggered);
        return ScheduledRunReport.builder()
                .date(window.date())
                .message(String.format("Processed %d booking(s)", results.size()))
                .results(results)
                .build();
    }

    /**
     * How many bookings the job would pick up if it ran now.
     */
    public CronPreviewResponse preview() {
        SubmissionWindow window = SubmissionWindow.today(clock, properties.getZone());
        long count = bookingRepository.countDueForSubmission(
                window.start(), window.end(), BookingTm30Status.PASSPORT_RECEIVED, BookingStatus.CONFIRMED);
        return CronPreviewResponse.builder()
                .schedule(properties.getScheduler().getCron() + " " + properties.getZone())
                .now(clock.instant())
                .thailandDate(window.date())
                .windowStart(window.start())
                .windowEnd(window.end())
                .bookingsToSubmitToday(count)
                .build();
    }

    private BookingRunOutcome processBooking(RentalBooking booking) {
        String property = booking.getProperty().getTitle();
        int eligible = (int) booking.getGuests().stream()
                .filter(BookingGuest::isEligibleForSubmission)
                .count();
        BookingRunOutcome.BookingRunOutcomeBuilder outcome = BookingRunOutcome.builder()
                .bookingId(booking.getId())
                .property(property)
                .guests(eligible);

        if (eligible == 0) {
            log.info("Skipping booking {}: no guests with passport data left to submit", booking.getId());
            return outcome.status(BookingRunOutcome.Status.SKIPPED).build();
        }

        try {
            DispatchResult result = dispatcher.dispatch(booking.getId(), DispatchCommand.live(), DispatchTrigger.SCHEDULER);
            switch (result.getOutcome()) {
                case DISPATCHED:
                    log.info("TM30 triggered for booking {} ({} guests)", booking.getId(), result.getGuestsTriggered());
                    return outcome.status(BookingRunOutcome.Status.TRIGGERED).build();
                case MANUAL_MODE:
                    return outcome.status(BookingRunOutcome.Status.MANUAL).error(result.getMessage()).build();
                case NOTHING_ELIGIBLE:
                    return outcome.status(BookingRunOutcome.Status.SKIPPED).build();
                case IN_FLIGHT:
                    return outcome.status(BookingRunOutcome.Status.CONFLICT).error(result.getMessage()).build();
                case DISPATCH_FAILED:
                default:
                    return outcome.status(BookingRunOutcome.Status.FAILED).error(result.getError()).build();
            }
        } catch (Exception e) {
            log.error("TM30 daily submission failed for booking {}", booking.getId(), e);
            return outcome.status(BookingRunOutcome.Status.FAILED).error(e.getMessage()).build();
        }
    }
}
