package com.rentnest.tm30.controller;

import com.rentnest.tm30.domain.DispatchResult;
import com.rentnest.tm30.dto.DispatchResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class Tm30SubmissionControllerTest {

    private final UUID bookingId = UUID.randomUUID();

    @Test
    void shouldMapDispatchOutcomesToHttpStatus() {
        assertThat(Tm30SubmissionController.statusFor(DispatchResult.dispatched(bookingId, 2, true)))
                .isEqualTo(HttpStatus.OK);
        assertThat(Tm30SubmissionController.statusFor(DispatchResult.manualMode(bookingId, List.of(), false, "no token")))
                .isEqualTo(HttpStatus.OK);
        assertThat(Tm30SubmissionController.statusFor(DispatchResult.nothingEligible(bookingId)))
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(Tm30SubmissionController.statusFor(DispatchResult.inFlight(bookingId)))
                .isEqualTo(HttpStatus.CONFLICT);
        assertThat(Tm30SubmissionController.statusFor(DispatchResult.failed(bookingId, 1, false, "HTTP 500")))
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void manualModeResponseCarriesSubmissions() {
        DispatchResponse response = DispatchResponse.from(DispatchResult.manualMode(bookingId, List.of(), false, "no token"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getManualMode()).isTrue();
        assertThat(response.getSubmissions()).isEmpty();
    }

    @Test
    void failedResponseCarriesError() {
        DispatchResponse response = DispatchResponse.from(DispatchResult.failed(bookingId, 1, false, "HTTP 500"));

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getManualMode()).isNull();
        assertThat(response.getError()).isEqualTo("HTTP 500");
    }
}
