package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of checking extracted passport data for completeness and plausibility
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassportValidationResult {

    private boolean valid;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static PassportValidationResult of(List<String> errors) {
        return PassportValidationResult.builder()
                .valid(errors.isEmpty())
                .errors(List.copyOf(errors))
                .build();
    }
}
