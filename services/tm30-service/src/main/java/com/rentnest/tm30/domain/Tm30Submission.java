package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One guest's entry in a TM30 filing batch, in the shape the automation executor reads
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tm30Submission {

    private UUID guestId;

    private Foreigner foreigner;

    private Accommodation accommodation;

    /**
     * Check-in date, DD/MM/YYYY
     */
    private String checkInDate;

    private String checkOutDate;

    private boolean dryRun;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Foreigner {
        private String passportNumber;
        private String nationality;
        private String firstName;
        private String lastName;
        private String dateOfBirth;
        private String gender;
        private String arrivalDate;
        private String stayUntil;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Accommodation {
        private String name;
    }
}
