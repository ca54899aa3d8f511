package com.rentnest.tm30.controller;

import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.dto.GuestPassportResponse;
import com.rentnest.tm30.dto.PassportCorrectionRequest;
import com.rentnest.tm30.dto.PassportIntakeResponse;
import com.rentnest.tm30.dto.PassportSubmissionRequest;
import com.rentnest.tm30.service.PassportIntakeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST controller for guest passport intake and correction
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tm30")
@RequiredArgsConstructor
@Validated
@Tag(name = "TM30 Passports", description = "Guest passport intake for TM30 registration")
@SecurityRequirement(name = "bearer-jwt")
public class PassportController {

    static final String API_KEY_HEADER = "X-API-Key";

    private final PassportIntakeService intakeService;

    @PostMapping("/guests/{guestId}/passport")
    @Operation(summary = "Upload a guest passport image and run OCR")
    public ResponseEntity<PassportIntakeResponse> submitPassport(
            @AuthenticationPrincipal Jwt jwt,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @PathVariable UUID guestId,
            @Valid @RequestBody PassportSubmissionRequest request) {

        log.info("Passport submission for guest {}", guestId);
        return ResponseEntity.ok(intakeService.submitPassport(guestId, request, Tm30Caller.from(jwt, apiKey)));
    }

    @PostMapping("/bookings/{bookingId}/guests/{guestNumber}/passport")
    @Operation(summary = "Upload a passport by booking and guest number, creating the guest if needed")
    public ResponseEntity<PassportIntakeResponse> submitPassportForBooking(
            @AuthenticationPrincipal Jwt jwt,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @PathVariable UUID bookingId,
            @PathVariable @Min(1) int guestNumber,
            @Valid @RequestBody PassportSubmissionRequest request) {

        log.info("Passport submission for guest #{} of booking {}", guestNumber, bookingId);
        return ResponseEntity.ok(intakeService.submitPassportForBooking(
                bookingId, guestNumber, request, Tm30Caller.from(jwt, apiKey)));
    }

    @PutMapping("/guests/{guestId}/passport")
    @Operation(summary = "Correct passport data by hand")
    public ResponseEntity<GuestPassportResponse> correctPassport(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID guestId,
            @Valid @RequestBody PassportCorrectionRequest request) {

        log.info("Passport correction for guest {}", guestId);
        return ResponseEntity.ok(intakeService.correctPassport(guestId, request, Tm30Caller.from(jwt, null)));
    }

    @GetMapping("/guests/{guestId}/passport")
    @Operation(summary = "Get a guest's passport and TM30 status")
    public ResponseEntity<GuestPassportResponse> getGuestPassport(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID guestId) {

        return ResponseEntity.ok(intakeService.getGuestPassport(guestId, Tm30Caller.from(jwt, null)));
    }
}
