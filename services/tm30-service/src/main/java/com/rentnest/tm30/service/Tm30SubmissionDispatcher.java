package com.rentnest.tm30.service;

import com.rentnest.tm30.domain.DispatchCommand;
import com.rentnest.tm30.domain.DispatchResult;
import com.rentnest.tm30.domain.DispatchTrigger;
import com.rentnest.tm30.domain.ExecutorResult;
import com.rentnest.tm30.domain.SubmissionBatch;
import com.rentnest.tm30.domain.Tm30Submission;
import com.rentnest.tm30.entity.BookingGuest;
import com.rentnest.tm30.entity.BookingTm30Status;
import com.rentnest.tm30.entity.GuestTm30Status;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.exception.AccommodationNotConfiguredException;
import com.rentnest.tm30.exception.BookingNotFoundException;
import com.rentnest.tm30.executor.AutomationExecutor;
import com.rentnest.tm30.repository.BookingGuestRepository;
import com.rentnest.tm30.repository.RentalBookingRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Hands a booking's eligible guests to the automation executor.
 *
 * The booking's PROCESSING status is the dispatch lock. It is taken with a
 * compare-and-set and committed before the executor is called, so two
 * concurrent dispatches of the same booking cannot both reach the executor.
 * The executor call itself runs outside any transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Tm30SubmissionDispatcher {

    private final RentalBookingRepository bookingRepository;
    private final BookingGuestRepository guestRepository;
    private final Tm30SubmissionPayloadBuilder payloadBuilder;
    private final AutomationExecutor automationExecutor;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter dispatchTriggeredCounter;
    private Counter dispatchFailedCounter;
    private Counter dispatchManualCounter;

    @PostConstruct
    public void initMetrics() {
        dispatchTriggeredCounter = Counter.builder("tm30.dispatch.triggered")
                .description("TM30 batches accepted by the automation executor")
                .register(meterRegistry);
        dispatchFailedCounter = Counter.builder("tm30.dispatch.failed")
                .description("TM30 batches the executor rejected or could not take")
                .register(meterRegistry);
        dispatchManualCounter = Counter.builder("tm30.dispatch.manual")
                .description("TM30 batches returned for manual filing")
                .register(meterRegistry);
    }

    /**
     * Dispatch a booking's filing batch.
     *
     * @throws BookingNotFoundException when the booking does not exist
     * @throws AccommodationNotConfiguredException when the property has no TM30 accommodation ID
     */
    public DispatchResult dispatch(UUID bookingId, DispatchCommand command, DispatchTrigger trigger) {
        LockedBatch locked = transactionTemplate.execute(status -> lock(bookingId, command));
        if (locked.result() != null) {
            return locked.result();
        }

        List<Tm30Submission> submissions = locked.submissions();
        SubmissionBatch batch = SubmissionBatch.builder()
                .bookingId(bookingId)
                .submissions(submissions)
                .dryRun(command.isDryRun())
                .triggeredBy(trigger)
                .triggeredAt(clock.instant())
                .build();

        log.info("Dispatching TM30 batch for booking {}: {} guest(s), dryRun={}, trigger={}, executor={}",
                bookingId, submissions.size(), command.isDryRun(), trigger, automationExecutor.name());

        ExecutorResult executorResult;
        try {
            executorResult = automationExecutor.trigger(batch);
        } catch (RuntimeException e) {
            log.error("Automation executor threw for booking {}", bookingId, e);
            executorResult = ExecutorResult.rejected(e.getMessage());
        }

        switch (executorResult.getStatus()) {
            case ACCEPTED:
                dispatchTriggeredCounter.increment();
                return DispatchResult.dispatched(bookingId, submissions.size(), command.isDryRun());
            case UNAVAILABLE:
                release(bookingId, locked.previousStatus(), null);
                dispatchManualCounter.increment();
                return DispatchResult.manualMode(bookingId, submissions, command.isDryRun(), executorResult.getDetail());
            case REJECTED:
            default:
                String error = executorResult.getDetail() != null
                        ? executorResult.getDetail()
                        : "Automation executor rejected the submission";
                log.error("TM30 dispatch failed for booking {} ({} guests) at executor stage: {}",
                        bookingId, submissions.size(), error);
                release(bookingId, locked.previousStatus(), error);
                dispatchFailedCounter.increment();
                return DispatchResult.failed(bookingId, submissions.size(), command.isDryRun(), error);
        }
    }

    private LockedBatch lock(UUID bookingId, DispatchCommand command) {
        RentalBooking booking = bookingRepository.findWithPropertyById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        if (!booking.getProperty().hasTm30Accommodation()) {
            throw new AccommodationNotConfiguredException(booking.getProperty().getId());
        }

        List<BookingGuest> eligible = booking.getGuests().stream()
                .filter(g -> command.getGuestId() == null || command.getGuestId().equals(g.getId()))
                .filter(BookingGuest::isEligibleForSubmission)
                .collect(Collectors.toList());
        if (eligible.isEmpty()) {
            log.info("Booking {} has no guests eligible for TM30 submission", bookingId);
            return LockedBatch.finished(DispatchResult.nothingEligible(bookingId));
        }

        BookingTm30Status previous = booking.getTm30Status();
        if (previous.isInFlight()) {
            log.warn("Booking {} already has a TM30 submission in progress", bookingId);
            return LockedBatch.finished(DispatchResult.inFlight(bookingId));
        }
        previous.transitionTo(BookingTm30Status.PROCESSING, false);
        eligible.forEach(g -> g.getTm30Status().transitionTo(GuestTm30Status.SUBMITTING, false));

        List<Tm30Submission> submissions = payloadBuilder.build(booking, eligible, command.isDryRun());
        List<UUID> guestIds = eligible.stream().map(BookingGuest::getId).collect(Collectors.toList());

        int updated = bookingRepository.compareAndSetTm30Status(bookingId, previous, BookingTm30Status.PROCESSING, null);
        if (updated == 0) {
            log.warn("Lost TM30 dispatch lock race for booking {}", bookingId);
            return LockedBatch.finished(DispatchResult.inFlight(bookingId));
        }
        guestRepository.updateTm30Status(guestIds, GuestTm30Status.SUBMITTING, GuestTm30Status.SUBMITTED);
        return new LockedBatch(previous, submissions, null);
    }

    /**
     * Put the booking back to its pre-dispatch status. Guests stay SUBMITTING.
     */
    private void release(UUID bookingId, BookingTm30Status previous, String error) {
        Integer reverted = transactionTemplate.execute(status ->
                bookingRepository.compareAndSetTm30Status(bookingId, BookingTm30Status.PROCESSING, previous, error));
        if (reverted == null || reverted == 0) {
            log.warn("Booking {} left PROCESSING before it could be reverted to {}", bookingId, previous);
        }
    }

    private record LockedBatch(BookingTm30Status previousStatus, List<Tm30Submission> submissions, DispatchResult result) {

        static LockedBatch finished(DispatchResult result) {
            return new LockedBatch(null, List.of(), result);
        }
    }
}
