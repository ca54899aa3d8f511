package com.rentnest.tm30.service;

import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.PassportData;
import com.rentnest.tm30.domain.PassportValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Completeness and plausibility checks on extracted passport data.
 * Works on plain values only, so it can run before anything is stored.
 */
@Service
@RequiredArgsConstructor
public class PassportValidationService {

    private static final Pattern PASSPORT_NUMBER = Pattern.compile("^[A-Z0-9]{5,20}$");
    private static final LocalDate EARLIEST_BIRTH_DATE = LocalDate.of(1900, 1, 1);

    private final Clock clock;
    private final Tm30Properties properties;

    public PassportValidationResult validate(PassportData data) {
        List<String> errors = new ArrayList<>();
        if (data == null) {
            errors.add("No data extracted");
            return PassportValidationResult.of(errors);
        }

        LocalDate today = LocalDate.now(clock.withZone(properties.getZone()));

        if (isBlank(data.getFirstName()) || isBlank(data.getLastName())) {
            errors.add("Name is missing or incomplete");
        }

        if (isBlank(data.getPassportNumber())) {
            errors.add("Passport number is missing");
        } else if (!PASSPORT_NUMBER.matcher(normalizePassportNumber(data.getPassportNumber())).matches()) {
            errors.add("Passport number format is invalid");
        }

        if (data.getDateOfBirth() == null) {
            errors.add("Date of birth is missing");
        } else if (data.getDateOfBirth().isAfter(today) || data.getDateOfBirth().isBefore(EARLIEST_BIRTH_DATE)) {
            errors.add("Date of birth is not plausible");
        }

        if (data.getPassportExpiry() == null) {
            errors.add("Passport expiry date is missing");
        } else if (data.getPassportExpiry().isBefore(today)) {
            errors.add("Passport is expired");
        }

        if (data.getPassportIssueDate() != null && data.getPassportExpiry() != null
                && !data.getPassportIssueDate().isBefore(data.getPassportExpiry())) {
            errors.add("Passport issue date must be before expiry date");
        }

        if (isBlank(data.getNationality())) {
            errors.add("Nationality is missing");
        }

        return PassportValidationResult.of(errors);
    }

    static String normalizePassportNumber(String passportNumber) {
        return passportNumber.replaceAll("\\s", "").toUpperCase();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
