package com.rentnest.tm30.dto;

import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for a manual passport correction. Null fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassportCorrectionRequest {

    @Size(max = 100, message = "First name must not exceed 100 characters")
    private String firstName;

    @Size(max = 100, message = "Last name must not exceed 100 characters")
    private String lastName;

    @Size(max = 50, message = "Passport number must not exceed 50 characters")
    private String passportNumber;

    @Size(max = 100, message = "Nationality must not exceed 100 characters")
    private String nationality;

    @Past(message = "Date of birth must be in the past")
    private LocalDate dateOfBirth;

    @Size(max = 20, message = "Gender must not exceed 20 characters")
    private String gender;

    private LocalDate passportExpiry;

    /**
     * True moves the guest to VERIFIED, anything else to SCANNED
     */
    private Boolean passportVerified;
}
