package com.rentnest.tm30.service;

import com.rentnest.tm30.domain.ExecutorReport;
import com.rentnest.tm30.entity.BookingGuest;
import com.rentnest.tm30.entity.BookingTm30Status;
import com.rentnest.tm30.entity.GuestTm30Status;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.exception.BookingNotFoundException;
import com.rentnest.tm30.exception.InvalidTm30StateException;
import com.rentnest.tm30.repository.RentalBookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps the booking-level TM30 status in line with its guests
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Tm30StatusAggregator {

    private final RentalBookingRepository bookingRepository;
    private final Clock clock;

    /**
     * Reload the booking and recompute passportsReceived and, while the booking
     * is PENDING or PASSPORT_RECEIVED, its TM30 status.
     */
    @Transactional
    public RentalBooking recompute(UUID bookingId) {
        RentalBooking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        refresh(booking);
        return bookingRepository.save(booking);
    }

    /**
     * Recompute on an already loaded booking, without saving.
     */
    public void refresh(RentalBooking booking) {
        List<BookingGuest> guests = booking.getGuests();
        int received = (int) guests.stream().filter(BookingGuest::hasPassportImage).count();
        booking.setPassportsReceived(received);

        BookingTm30Status current = booking.getTm30Status();
        if (!current.isAggregatable()) {
            return;
        }
        BookingTm30Status derived = deriveStatus(guests);
        if (derived != current) {
            log.info("Booking {} TM30 status {} -> {} ({}/{} passports)",
                    booking.getId(), current, derived, received, guests.size());
            booking.moveTm30StatusTo(derived, false);
        }
    }

    /**
     * PASSPORT_RECEIVED iff there is at least one guest and every guest has an
     * image, a passport number and complete passport data. A guest without a
     * passport number is never filed, so it keeps the booking PENDING.
     */
    public static BookingTm30Status deriveStatus(List<BookingGuest> guests) {
        if (guests.isEmpty()) {
            return BookingTm30Status.PENDING;
        }
        boolean ready = guests.stream().allMatch(g ->
                g.hasPassportImage() && g.hasPassportNumber() && g.getTm30Status().isPassportComplete());
        return ready ? BookingTm30Status.PASSPORT_RECEIVED : BookingTm30Status.PENDING;
    }

    /**
     * Apply the executor's filing result to the booking and its guests.
     */
    @Transactional
    public RentalBooking applyExecutorReport(ExecutorReport report) {
        RentalBooking booking = bookingRepository.findById(report.getBookingId())
                .orElseThrow(() -> new BookingNotFoundException(report.getBookingId()));
        LocalDateTime now = LocalDateTime.now(clock);
        Map<UUID, BookingGuest> guestsById = booking.getGuests().stream()
                .collect(Collectors.toMap(BookingGuest::getId, Function.identity()));

        if (report.isDryRun()) {
            applyDryRun(booking, report);
            return bookingRepository.save(booking);
        }

        for (ExecutorReport.GuestReport guestReport : report.getGuests()) {
            BookingGuest guest = guestsById.get(guestReport.getGuestId());
            if (guest == null) {
                log.warn("Callback for booking {} names unknown guest {}", booking.getId(), guestReport.getGuestId());
                continue;
            }
            applyGuestResult(guest, guestReport, now);
        }

        if (report.isFullySuccessful()) {
            booking.markTm30Submitted(report.getReferenceNumber(), now);
            log.info("Booking {} TM30 submitted, reference {}", booking.getId(), report.getReferenceNumber());
        } else {
            booking.markTm30Failed(report.failureReason());
            log.warn("Booking {} TM30 failed: {}/{} guests submitted - {}",
                    booking.getId(), report.getSuccessCount(), report.getTotalGuests(), booking.getTm30Error());
        }
        booking.setPassportsReceived((int) booking.getGuests().stream().filter(BookingGuest::hasPassportImage).count());
        return bookingRepository.save(booking);
    }

    /**
     * Clear a FAILED booking so it can be dispatched again. Guests the executor
     * rejected but which still hold passport data go back to SCANNED or VERIFIED.
     */
    @Transactional
    public RentalBooking retryFailed(UUID bookingId) {
        RentalBooking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        if (booking.getTm30Status() != BookingTm30Status.FAILED) {
            throw new InvalidTm30StateException(booking.getTm30Status().name(), BookingTm30Status.FAILED.name());
        }

        for (BookingGuest guest : booking.getGuests()) {
            if (guest.getTm30Status() == GuestTm30Status.PENDING && guest.getTm30Error() != null
                    && guest.hasPassportNumber() && guest.hasPassportImage()) {
                guest.moveTm30StatusTo(passportCompleteStatus(guest), false);
                guest.setTm30Error(null);
            }
        }
        booking.setTm30Error(null);
        BookingTm30Status derived = deriveStatus(booking.getGuests());
        booking.moveTm30StatusTo(derived, false);
        booking.setPassportsReceived((int) booking.getGuests().stream().filter(BookingGuest::hasPassportImage).count());
        log.info("Booking {} TM30 retry: FAILED -> {}", bookingId, derived);
        return bookingRepository.save(booking);
    }

    private void applyGuestResult(BookingGuest guest, ExecutorReport.GuestReport guestReport, LocalDateTime now) {
        if (guest.isSubmitted()) {
            log.debug("Guest {} already submitted, ignoring callback result", guest.getId());
            return;
        }
        if (guestReport.isSuccess()) {
            if (guest.getTm30Status() != GuestTm30Status.SUBMITTING) {
                log.warn("Guest {} reported submitted while {}, not part of a dispatched batch",
                        guest.getId(), guest.getTm30Status());
                return;
            }
            guest.markTm30Submitted(now);
        } else {
            guest.markTm30Rejected(guestReport.getError());
        }
    }

    private void applyDryRun(RentalBooking booking, ExecutorReport report) {
        for (BookingGuest guest : booking.getGuests()) {
            if (guest.getTm30Status() == GuestTm30Status.SUBMITTING) {
                guest.moveTm30StatusTo(passportCompleteStatus(guest), false);
            }
        }
        if (booking.getTm30Status() == BookingTm30Status.PROCESSING) {
            booking.moveTm30StatusTo(deriveStatus(booking.getGuests()), false);
        }
        booking.setTm30Error(report.isFullySuccessful() ? null : report.failureReason());
        log.info("Booking {} TM30 dry run finished: {}/{} guests passed",
                booking.getId(), report.getSuccessCount(), report.getTotalGuests());
    }

    private static GuestTm30Status passportCompleteStatus(BookingGuest guest) {
        return Boolean.TRUE.equals(guest.getPassportVerified()) ? GuestTm30Status.VERIFIED : GuestTm30Status.SCANNED;
    }
}
