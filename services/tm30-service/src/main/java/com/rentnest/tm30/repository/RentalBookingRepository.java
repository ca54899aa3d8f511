package com.rentnest.tm30.repository;

import com.rentnest.tm30.entity.BookingStatus;
import com.rentnest.tm30.entity.BookingTm30Status;
import com.rentnest.tm30.entity.RentalBooking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for rental bookings and their TM30 status
 */
@Repository
public interface RentalBookingRepository extends JpaRepository<RentalBooking, UUID> {

    @Query("SELECT b FROM RentalBooking b JOIN FETCH b.property WHERE b.id = :id")
    Optional<RentalBooking> findWithPropertyById(@Param("id") UUID id);

    /**
     * Bookings the daily job should file: check-in inside the window, passports
     * received, booking confirmed and the property registered for TM30.
     */
    @Query("SELECT DISTINCT b FROM RentalBooking b JOIN FETCH b.property p LEFT JOIN FETCH b.guests " +
           "WHERE b.checkIn >= :from AND b.checkIn <= :to " +
           "AND b.tm30Status = :tm30Status AND b.status = :status " +
           "AND p.tm30AccommodationId IS NOT NULL AND TRIM(p.tm30AccommodationId) <> '' " +
           "ORDER BY b.checkIn ASC")
    List<RentalBooking> findDueForSubmission(@Param("from") Instant from,
                                             @Param("to") Instant to,
                                             @Param("tm30Status") BookingTm30Status tm30Status,
                                             @Param("status") BookingStatus status);

    @Query("SELECT COUNT(b) FROM RentalBooking b JOIN b.property p " +
           "WHERE b.checkIn >= :from AND b.checkIn <= :to " +
           "AND b.tm30Status = :tm30Status AND b.status = :status " +
           "AND p.tm30AccommodationId IS NOT NULL AND TRIM(p.tm30AccommodationId) <> ''")
    long countDueForSubmission(@Param("from") Instant from,
                               @Param("to") Instant to,
                               @Param("tm30Status") BookingTm30Status tm30Status,
                               @Param("status") BookingStatus status);

    /**
     * Bookings checking in soon that still need a filing.
     */
    @Query("SELECT b FROM RentalBooking b JOIN FETCH b.property p " +
           "WHERE b.checkIn >= :from AND b.checkIn <= :to " +
           "AND b.tm30Status IN :statuses AND b.passportsReceived > 0 " +
           "AND p.tm30AccommodationId IS NOT NULL AND TRIM(p.tm30AccommodationId) <> '' " +
           "ORDER BY b.checkIn ASC")
    List<RentalBooking> findPendingSubmissions(@Param("from") Instant from,
                                               @Param("to") Instant to,
                                               @Param("statuses") Collection<BookingTm30Status> statuses);

    /**
     * Compare-and-set on the booking TM30 status. Returns the number of rows
     * changed: 1 when {@code expected} still held, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RentalBooking b SET b.tm30Status = :next, b.tm30Error = :error " +
           "WHERE b.id = :id AND b.tm30Status = :expected")
    int compareAndSetTm30Status(@Param("id") UUID id,
                                @Param("expected") BookingTm30Status expected,
                                @Param("next") BookingTm30Status next,
                                @Param("error") String error);
}
