package com.rentnest.tm30.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Standard error response format for API errors
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code for programmatic error handling
     */
    private String errorCode;

    private String message;

    private String details;

    private int status;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    private String path;

    /**
     * Validation errors (for 400 Bad Request)
     */
    private List<FieldError> fieldErrors;

    private String traceId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String rejectedValue;
        private String message;
    }
}
