package com.rentnest.tm30.provider;

import com.rentnest.tm30.client.PassportOcrClient;
import com.rentnest.tm30.client.dto.OcrScanRequest;
import com.rentnest.tm30.client.dto.OcrScanResponse;
import com.rentnest.tm30.domain.PassportData;
import com.rentnest.tm30.domain.PassportOcrResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * OCR provider backed by the passport OCR engine over HTTP
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultPassportOcrProvider implements PassportOcrProvider {

    private final PassportOcrClient ocrClient;

    @Override
    public PassportOcrResult scan(String imageUrl) {
        OcrScanResponse response;
        try {
            response = ocrClient.scan(OcrScanRequest.builder().imageUrl(imageUrl).build());
        } catch (Exception e) {
            log.warn("Passport OCR call failed: {}", e.getMessage());
            return PassportOcrResult.failure("OCR service unavailable: " + e.getMessage());
        }

        if (response == null) {
            return PassportOcrResult.failure("OCR service returned an empty response");
        }
        String raw = response.getRawResponse() != null ? response.getRawResponse().toString() : null;
        if (!response.isSuccess() || response.getData() == null) {
            String error = response.getError() != null ? response.getError() : "No data extracted";
            return PassportOcrResult.builder()
                    .success(false)
                    .confidence(response.getConfidence() != null ? response.getConfidence() : 0.0)
                    .rawResponse(raw)
                    .error(error)
                    .build();
        }

        return PassportOcrResult.success(toPassportData(response.getData()), response.getConfidence(), raw);
    }

    private PassportData toPassportData(OcrScanResponse.Fields fields) {
        return PassportData.builder()
                .firstName(fields.getFirstName())
                .lastName(fields.getLastName())
                .fullName(fields.getFullName())
                .dateOfBirth(parseDate(fields.getDateOfBirth()))
                .nationality(fields.getNationality())
                .gender(fields.getGender())
                .passportNumber(fields.getPassportNumber())
                .passportExpiry(parseDate(fields.getPassportExpiry()))
                .passportIssueDate(parseDate(fields.getPassportIssueDate()))
                .passportCountry(fields.getPassportCountry())
                .build();
    }

    /**
     * Accepts ISO dates, optionally followed by a time part. Anything else is treated as missing.
     */
    static LocalDate parseDate(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable OCR date: {}", value);
            return null;
        }
    }
}
