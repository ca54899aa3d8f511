package com.rentnest.tm30.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterGuestsRequest {

    @NotNull(message = "Expected guest count is required")
    @Min(value = 1, message = "A booking has at least one guest")
    @Max(value = 50, message = "Expected guest count must not exceed 50")
    private Integer expectedGuests;
}
