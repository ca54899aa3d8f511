package com.rentnest.tm30.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/tm30/submit");

    @Test
    void shouldMapNotFoundErrors() {
        ResponseEntity<ErrorResponse> response = handler.handleBookingNotFound(
                new BookingNotFoundException(UUID.randomUUID()), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getPath()).isEqualTo("/api/v1/tm30/submit");
        assertThat(response.getBody().getStatus()).isEqualTo(404);
    }

    @Test
    void shouldMapStateConflictTo409() {
        ResponseEntity<ErrorResponse> response = handler.handleInvalidTm30State(
                new InvalidTm30StateException("SUBMITTED", "PENDING"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getErrorCode()).isNotBlank();
    }

    @Test
    void shouldMapSharedSecretFailureTo401() {
        ResponseEntity<ErrorResponse> response = handler.handleInvalidSharedSecret(
                new InvalidSharedSecretException("cron trigger"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void shouldMapMissingAccommodationTo422() {
        ResponseEntity<ErrorResponse> response = handler.handleAccommodationNotConfigured(
                new AccommodationNotConfiguredException(UUID.randomUUID()), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void shouldHideUnexpectedErrorDetails() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(
                new NullPointerException("secret internals"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
    }
}
