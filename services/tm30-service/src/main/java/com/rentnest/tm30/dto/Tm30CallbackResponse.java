package com.rentnest.tm30.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rentnest.tm30.entity.BookingTm30Status;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Tm30CallbackResponse {

    private boolean success;
    private String message;
    private UUID bookingId;
    private BookingTm30Status newStatus;

    // accommodation sync counts
    private Integer created;
    private Integer updated;
    private Integer total;
}
