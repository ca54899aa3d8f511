package com.rentnest.tm30.repository;

import com.rentnest.tm30.entity.BookingGuest;
import com.rentnest.tm30.entity.GuestTm30Status;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for booking guests
 */
@Repository
public interface BookingGuestRepository extends JpaRepository<BookingGuest, UUID> {

    @Query("SELECT g FROM BookingGuest g JOIN FETCH g.booking b JOIN FETCH b.property WHERE g.id = :id")
    Optional<BookingGuest> findWithBookingById(@Param("id") UUID id);

    @Query("SELECT g FROM BookingGuest g WHERE g.booking.id = :bookingId AND g.guestNumber = :guestNumber")
    Optional<BookingGuest> findByBookingIdAndGuestNumber(@Param("bookingId") UUID bookingId,
                                                         @Param("guestNumber") Integer guestNumber);

    @Query("SELECT g FROM BookingGuest g WHERE g.booking.id = :bookingId ORDER BY g.guestNumber ASC")
    List<BookingGuest> findByBookingId(@Param("bookingId") UUID bookingId);

    /**
     * Move the given guests to {@code status}, leaving already filed guests untouched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BookingGuest g SET g.tm30Status = :status, g.tm30Error = NULL " +
           "WHERE g.id IN :ids AND g.tm30Status <> :filed")
    int updateTm30Status(@Param("ids") Collection<UUID> ids,
                         @Param("status") GuestTm30Status status,
                         @Param("filed") GuestTm30Status filed);
}
