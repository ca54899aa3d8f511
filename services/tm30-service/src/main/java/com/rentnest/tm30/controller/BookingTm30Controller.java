package com.rentnest.tm30.controller;

import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.dto.BookingTm30StatusResponse;
import com.rentnest.tm30.dto.RegisterGuestsRequest;
import com.rentnest.tm30.service.BookingTm30Service;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST controller for booking-level TM30 state
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tm30/bookings")
@RequiredArgsConstructor
@Validated
@Tag(name = "TM30 Bookings", description = "Booking TM30 status and guest roster")
@SecurityRequirement(name = "bearer-jwt")
public class BookingTm30Controller {

    private final BookingTm30Service bookingTm30Service;

    @GetMapping("/{bookingId}/status")
    @Operation(summary = "Get the TM30 status of a booking and its guests")
    public ResponseEntity<BookingTm30StatusResponse> getBookingStatus(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID bookingId) {

        return ResponseEntity.ok(bookingTm30Service.getBookingStatus(bookingId, Tm30Caller.from(jwt, null)));
    }

    @PostMapping("/{bookingId}/guests")
    @Operation(summary = "Create guest rows for the expected number of occupants")
    public ResponseEntity<BookingTm30StatusResponse> registerGuests(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID bookingId,
            @Valid @RequestBody RegisterGuestsRequest request) {

        log.info("Registering {} guest(s) for booking {}", request.getExpectedGuests(), bookingId);
        return ResponseEntity.ok(bookingTm30Service.registerGuests(
                bookingId, request.getExpectedGuests(), Tm30Caller.from(jwt, null)));
    }

    @PostMapping("/{bookingId}/retry")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    @Operation(summary = "Clear a failed TM30 submission so it can be dispatched again")
    public ResponseEntity<BookingTm30StatusResponse> retryFailed(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID bookingId) {

        log.info("Retrying failed TM30 submission for booking {}", bookingId);
        return ResponseEntity.ok(bookingTm30Service.retryFailed(bookingId, Tm30Caller.from(jwt, null)));
    }
}
