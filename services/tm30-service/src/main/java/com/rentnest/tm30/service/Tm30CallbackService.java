package com.rentnest.tm30.service;

import com.rentnest.tm30.domain.AccommodationSyncResult;
import com.rentnest.tm30.domain.ExecutorReport;
import com.rentnest.tm30.domain.SyncedAccommodation;
import com.rentnest.tm30.dto.Tm30CallbackRequest;
import com.rentnest.tm30.dto.Tm30CallbackResponse;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.events.Tm30EventPublisher;
import com.rentnest.tm30.events.Tm30SubmissionCompletedEvent;
import com.rentnest.tm30.exception.InvalidCallbackException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Handles status callbacks from the automation executor
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Tm30CallbackService {

    private final Tm30AccessPolicy accessPolicy;
    private final Tm30StatusAggregator aggregator;
    private final Tm30EventPublisher eventPublisher;
    private final Tm30AccommodationService accommodationService;
    private final Clock clock;

    public Tm30CallbackResponse handleCallback(String secret, Tm30CallbackRequest request) {
        accessPolicy.checkCallbackSecret(secret);
        String action = request.getAction() == null ? "" : request.getAction().toLowerCase(Locale.ROOT);
        log.info("TM30 callback received: action={}, success={}", action, request.isSuccess());

        switch (action) {
            case "submit_tm30":
            case "tm30_result":
                return applySubmissionResult(request);
            case "fetch_accommodations":
            case "sync_accommodations":
                return syncAccommodations(request);
            case "test":
            case "login":
                log.info("TM30 {} callback: {}", action, request.isSuccess() ? "ok" : request.getError());
                return Tm30CallbackResponse.builder()
                        .success(true)
                        .message("Callback acknowledged: " + action)
                        .build();
            default:
                throw new InvalidCallbackException("Unknown callback action: " + request.getAction());
        }
    }

    private Tm30CallbackResponse applySubmissionResult(Tm30CallbackRequest request) {
        Tm30CallbackRequest.ResultData data = request.getData();
        if (data == null || data.getBookingId() == null) {
            throw new InvalidCallbackException("Callback data with bookingId is required");
        }

        ExecutorReport report = toReport(request, data);
        RentalBooking booking = aggregator.applyExecutorReport(report);

        eventPublisher.publishSubmissionCompleted(Tm30SubmissionCompletedEvent.builder()
                .eventId(UUID.randomUUID())
                .bookingId(booking.getId())
                .tm30Status(booking.getTm30Status())
                .referenceNumber(report.getReferenceNumber())
                .successCount(report.getSuccessCount())
                .totalGuests(report.getTotalGuests())
                .error(booking.getTm30Error())
                .dryRun(report.isDryRun())
                .guestPhone(booking.getGuestPhone())
                .occurredAt(clock.instant())
                .build());

        return Tm30CallbackResponse.builder()
                .success(true)
                .message("TM30 result applied")
                .bookingId(booking.getId())
                .newStatus(booking.getTm30Status())
                .build();
    }

    private Tm30CallbackResponse syncAccommodations(Tm30CallbackRequest request) {
        if (!request.isSuccess()) {
            log.warn("TM30 accommodation fetch failed: {}", request.getError());
            return Tm30CallbackResponse.builder()
                    .success(false)
                    .message("Accommodation fetch failed: " + request.getError())
                    .build();
        }

        List<Tm30CallbackRequest.AccommodationData> listed = request.getData() != null
                && request.getData().getAccommodations() != null
                ? request.getData().getAccommodations()
                : Collections.emptyList();
        if (listed.isEmpty()) {
            return Tm30CallbackResponse.builder()
                    .success(true)
                    .message("No accommodations to sync")
                    .build();
        }

        AccommodationSyncResult result = accommodationService.syncAccommodations(listed.stream()
                .map(a -> SyncedAccommodation.builder()
                        .portalId(a.getId())
                        .name(a.getName())
                        .address(a.getAddress())
                        .status(a.getStatus())
                        .build())
                .collect(Collectors.toList()));

        return Tm30CallbackResponse.builder()
                .success(true)
                .message("Accommodations synced")
                .created(result.getCreated())
                .updated(result.getUpdated())
                .total(result.getTotal())
                .build();
    }

    private ExecutorReport toReport(Tm30CallbackRequest request, Tm30CallbackRequest.ResultData data) {
        List<Tm30CallbackRequest.GuestResult> results =
                data.getResults() != null ? data.getResults() : Collections.emptyList();
        int total = data.getTotalGuests() != null ? data.getTotalGuests() : results.size();
        int successCount = data.getSuccessCount() != null
                ? data.getSuccessCount()
                : (int) results.stream().filter(Tm30CallbackRequest.GuestResult::isSuccess).count();

        return ExecutorReport.builder()
                .bookingId(data.getBookingId())
                .success(request.isSuccess())
                .totalGuests(total)
                .successCount(successCount)
                .referenceNumber(data.getReferenceNumber())
                .error(request.getError())
                .dryRun(data.isDryRun())
                .guests(results.stream()
                        .filter(r -> r.getGuestId() != null)
                        .map(r -> ExecutorReport.GuestReport.builder()
                                .guestId(r.getGuestId())
                                .success(r.isSuccess())
                                .error(r.getError())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
