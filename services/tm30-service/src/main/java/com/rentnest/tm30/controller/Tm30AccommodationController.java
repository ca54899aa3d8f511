package com.rentnest.tm30.controller;

import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.dto.AccommodationLinkResponse;
import com.rentnest.tm30.dto.AccommodationListResponse;
import com.rentnest.tm30.dto.LinkAccommodationRequest;
import com.rentnest.tm30.service.Tm30AccommodationService;
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
 * REST controller for binding properties to TM30 accommodations
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tm30/accommodations")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
@Tag(name = "TM30 Accommodations", description = "Portal accommodations and their property bindings")
@SecurityRequirement(name = "bearer-jwt")
public class Tm30AccommodationController {

    private final Tm30AccommodationService accommodationService;

    @GetMapping
    @Operation(summary = "List synced TM30 accommodations, optionally filtered by name/address and status")
    public ResponseEntity<AccommodationListResponse> listAccommodations(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String status) {

        return ResponseEntity.ok(accommodationService.listAccommodations(search, status, Tm30Caller.from(jwt, null)));
    }

    @PostMapping("/links")
    @Operation(summary = "Link a property to a TM30 accommodation")
    public ResponseEntity<AccommodationLinkResponse> linkProperty(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody LinkAccommodationRequest request) {

        log.info("Linking property {} to accommodation {}", request.getPropertyId(), request.getAccommodationId());
        return ResponseEntity.ok(accommodationService.linkProperty(
                request.getPropertyId(), request.getAccommodationId(), Tm30Caller.from(jwt, null)));
    }

    @DeleteMapping("/links/{propertyId}")
    @Operation(summary = "Remove the TM30 accommodation binding of a property")
    public ResponseEntity<AccommodationLinkResponse> unlinkProperty(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID propertyId) {

        return ResponseEntity.ok(accommodationService.unlinkProperty(propertyId, Tm30Caller.from(jwt, null)));
    }
}
