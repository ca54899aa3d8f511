package com.rentnest.tm30.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rentnest.tm30.entity.BookingTm30Status;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BookingTm30StatusResponse {

    private UUID bookingId;
    private String propertyTitle;
    private Instant checkIn;
    private Instant checkOut;
    private BookingTm30Status tm30Status;
    private Integer passportsReceived;
    private Integer totalGuests;
    private String tm30Reference;
    private String tm30Error;
    private LocalDateTime tm30SubmittedAt;
    private List<GuestPassportResponse> guests;
}
