package com.rentnest.tm30.controller;

import com.rentnest.tm30.dto.Tm30CallbackRequest;
import com.rentnest.tm30.dto.Tm30CallbackResponse;
import com.rentnest.tm30.service.Tm30CallbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Receives filing results from the automation executor
 */
@RestController
@RequestMapping("/api/v1/tm30/callback")
@RequiredArgsConstructor
@Tag(name = "TM30 Callback", description = "Automation executor status callbacks")
public class Tm30CallbackController {

    static final String CALLBACK_SECRET_HEADER = "X-TM30-Callback-Secret";
    static final String LEGACY_CALLBACK_SECRET_HEADER = "X-Callback-Secret";

    private final Tm30CallbackService callbackService;

    @PostMapping
    @Operation(summary = "Apply a TM30 filing result")
    public ResponseEntity<Tm30CallbackResponse> callback(
            @RequestHeader(value = CALLBACK_SECRET_HEADER, required = false) String secret,
            @RequestHeader(value = LEGACY_CALLBACK_SECRET_HEADER, required = false) String legacySecret,
            @Valid @RequestBody Tm30CallbackRequest request) {

        String presented = secret != null ? secret : legacySecret;
        return ResponseEntity.ok(callbackService.handleCallback(presented, request));
    }
}
