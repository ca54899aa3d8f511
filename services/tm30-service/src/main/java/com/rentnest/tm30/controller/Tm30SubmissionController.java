package com.rentnest.tm30.controller;

import com.rentnest.tm30.domain.DispatchCommand;
import com.rentnest.tm30.domain.DispatchResult;
import com.rentnest.tm30.domain.DispatchTrigger;
import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.dto.DispatchResponse;
import com.rentnest.tm30.dto.PendingSubmissionResponse;
import com.rentnest.tm30.dto.Tm30SubmitRequest;
import com.rentnest.tm30.service.BookingTm30Service;
import com.rentnest.tm30.service.Tm30AccessPolicy;
import com.rentnest.tm30.service.Tm30SubmissionDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for operator-triggered TM30 submissions
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tm30/submit")
@RequiredArgsConstructor
@Validated
@Tag(name = "TM30 Submission", description = "Dispatch TM30 filings to the automation executor")
@SecurityRequirement(name = "bearer-jwt")
public class Tm30SubmissionController {

    private final Tm30SubmissionDispatcher dispatcher;
    private final BookingTm30Service bookingTm30Service;
    private final Tm30AccessPolicy accessPolicy;

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    @Operation(summary = "Submit a booking's guests to TM30 (dry run unless dryRun=false)")
    public ResponseEntity<DispatchResponse> submit(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody Tm30SubmitRequest request) {

        Tm30Caller caller = Tm30Caller.from(jwt, null);
        accessPolicy.checkOperator(caller);
        log.info("TM30 submission requested by {} for booking {} (guest {}, dryRun={})",
                caller.getUserId(), request.getBookingId(), request.getGuestId(), request.isDryRunRequested());

        DispatchResult result = dispatcher.dispatch(
                request.getBookingId(),
                DispatchCommand.builder()
                        .guestId(request.getGuestId())
                        .dryRun(request.isDryRunRequested())
                        .build(),
                DispatchTrigger.MANUAL);
        return ResponseEntity.status(statusFor(result)).body(DispatchResponse.from(result));
    }

    @GetMapping("/pending")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    @Operation(summary = "List bookings checking in soon that still need a TM30 filing")
    public ResponseEntity<PendingSubmissionResponse> pending(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(defaultValue = "1") @Min(0) @Max(30) int days) {

        return ResponseEntity.ok(bookingTm30Service.pendingSubmissions(days, Tm30Caller.from(jwt, null)));
    }

    static HttpStatus statusFor(DispatchResult result) {
        switch (result.getOutcome()) {
            case DISPATCHED:
            case MANUAL_MODE:
                return HttpStatus.OK;
            case NOTHING_ELIGIBLE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case IN_FLIGHT:
                return HttpStatus.CONFLICT;
            case DISPATCH_FAILED:
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
