package com.rentnest.tm30.service;

import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.Tm30Submission;
import com.rentnest.tm30.entity.BookingGuest;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.util.GenderCode;
import com.rentnest.tm30.util.Tm30DateFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the per-guest filing entries for a booking
 */
@Component
@RequiredArgsConstructor
public class Tm30SubmissionPayloadBuilder {

    static final String UNKNOWN = "Unknown";

    private final Tm30Properties properties;

    public List<Tm30Submission> build(RentalBooking booking, List<BookingGuest> guests, boolean dryRun) {
        ZoneId zone = properties.getZone();
        String checkIn = Tm30DateFormat.format(booking.getCheckIn(), zone);
        String checkOut = Tm30DateFormat.format(booking.getCheckOut(), zone);
        Tm30Submission.Accommodation accommodation = Tm30Submission.Accommodation.builder()
                .name(booking.getProperty().tm30AccommodationLabel())
                .build();

        return guests.stream()
                .map(guest -> Tm30Submission.builder()
                        .guestId(guest.getId())
                        .foreigner(Tm30Submission.Foreigner.builder()
                                .passportNumber(guest.getPassportNumber())
                                .nationality(orDefault(guest.getNationality(), UNKNOWN))
                                .firstName(orDefault(guest.getFirstName(), UNKNOWN))
                                .lastName(orDefault(guest.getLastName(), ""))
                                .dateOfBirth(Tm30DateFormat.format(guest.getDateOfBirth()))
                                .gender(GenderCode.normalize(guest.getGender()))
                                .arrivalDate(checkIn)
                                .stayUntil(checkOut)
                                .build())
                        .accommodation(accommodation)
                        .checkInDate(checkIn)
                        .checkOutDate(checkOut)
                        .dryRun(dryRun)
                        .build())
                .collect(Collectors.toList());
    }

    private static String orDefault(String value, String fallback) {
        return StringUtils.hasText(value) ? value : fallback;
    }
}
