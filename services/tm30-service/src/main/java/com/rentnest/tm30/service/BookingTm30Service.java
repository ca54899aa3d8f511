package com.rentnest.tm30.service;

import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.dto.BookingTm30StatusResponse;
import com.rentnest.tm30.dto.PendingSubmissionResponse;
import com.rentnest.tm30.entity.BookingGuest;
import com.rentnest.tm30.entity.BookingTm30Status;
import com.rentnest.tm30.entity.GuestType;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.exception.BookingNotFoundException;
import com.rentnest.tm30.mapper.RentalBookingMapper;
import com.rentnest.tm30.repository.RentalBookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Booking-level TM30 operations: guest roster, status view, operator retry
 * and the overview of bookings still waiting for a filing
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingTm30Service {

    private final RentalBookingRepository bookingRepository;
    private final Tm30StatusAggregator aggregator;
    private final Tm30AccessPolicy accessPolicy;
    private final RentalBookingMapper bookingMapper;
    private final Tm30Properties properties;
    private final Clock clock;

    /**
     * Make sure guest rows 1..expectedGuests exist. Existing rows are kept as
     * they are, so calling this again is harmless.
     */
    @Transactional
    public BookingTm30StatusResponse registerGuests(UUID bookingId, int expectedGuests, Tm30Caller caller) {
        RentalBooking booking = loadBooking(bookingId);
        accessPolicy.checkOwnerOrOperator(booking, caller);

        int created = 0;
        for (int guestNumber = 1; guestNumber <= expectedGuests; guestNumber++) {
            if (booking.findGuest(guestNumber).isEmpty()) {
                booking.addGuest(BookingGuest.builder()
                        .guestNumber(guestNumber)
                        .guestType(GuestType.forGuestNumber(guestNumber))
                        .build());
                created++;
            }
        }
        aggregator.refresh(booking);
        RentalBooking saved = bookingRepository.save(booking);
        log.info("Guest roster for booking {}: {} expected, {} created", bookingId, expectedGuests, created);
        return bookingMapper.toStatusResponse(saved);
    }

    @Transactional(readOnly = true)
    public BookingTm30StatusResponse getBookingStatus(UUID bookingId, Tm30Caller caller) {
        RentalBooking booking = loadBooking(bookingId);
        accessPolicy.checkOwnerOrOperator(booking, caller);
        return bookingMapper.toStatusResponse(booking);
    }

    @Transactional
    public BookingTm30StatusResponse retryFailed(UUID bookingId, Tm30Caller caller) {
        accessPolicy.checkOperator(caller);
        RentalBooking booking = aggregator.retryFailed(bookingId);
        log.info("Operator {} cleared failed TM30 status on booking {}", caller.getUserId(), bookingId);
        return bookingMapper.toStatusResponse(booking);
    }

    /**
     * Bookings checking in within the next {@code days} days that are PENDING or
     * FAILED, have at least one passport and a property registered for TM30.
     */
    @Transactional(readOnly = true)
    public PendingSubmissionResponse pendingSubmissions(int days, Tm30Caller caller) {
        accessPolicy.checkOperator(caller);
        Instant now = clock.instant();
        LocalDate lastDay = LocalDate.now(clock.withZone(properties.getZone())).plusDays(days);
        Instant until = lastDay.plusDays(1).atStartOfDay(properties.getZone()).toInstant().minusMillis(1);

        List<PendingSubmissionResponse.PendingBooking> bookings = bookingRepository
                .findPendingSubmissions(now, until, EnumSet.of(BookingTm30Status.PENDING, BookingTm30Status.FAILED))
                .stream()
                .map(bookingMapper::toPendingBooking)
                .collect(Collectors.toList());
        return PendingSubmissionResponse.builder()
                .total(bookings.size())
                .bookings(bookings)
                .build();
    }

    private RentalBooking loadBooking(UUID bookingId) {
        return bookingRepository.findWithPropertyById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }
}
