package com.rentnest.tm30.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rentnest.tm30.entity.GuestTm30Status;
import com.rentnest.tm30.entity.GuestType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GuestPassportResponse {

    private UUID id;
    private UUID bookingId;
    private Integer guestNumber;
    private GuestType guestType;
    private String firstName;
    private String lastName;
    private String fullName;
    private LocalDate dateOfBirth;
    private String nationality;
    private String gender;
    private String passportNumber;
    private LocalDate passportIssueDate;
    private LocalDate passportExpiry;
    private String passportCountry;
    private String passportImageUrl;
    private Double ocrConfidence;
    private LocalDateTime ocrProcessedAt;
    private Boolean passportVerified;
    private GuestTm30Status tm30Status;
    private LocalDateTime tm30SubmittedAt;
    private String tm30Error;
}
