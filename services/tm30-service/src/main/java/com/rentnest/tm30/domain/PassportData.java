package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Passport fields as read from a passport image
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassportData {

    private String firstName;

    private String lastName;

    private String fullName;

    private LocalDate dateOfBirth;

    private String nationality;

    private String gender;

    private String passportNumber;

    private LocalDate passportExpiry;

    private LocalDate passportIssueDate;

    private String passportCountry;
}
