package com.rentnest.tm30.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A confirmed or pending stay at a rental property
 * Owns its guests and carries the aggregated TM30 filing status
 */
@Entity
@Table(name = "rental_bookings", indexes = {
        @Index(name = "idx_booking_user_id", columnList = "user_id"),
        @Index(name = "idx_booking_check_in", columnList = "check_in"),
        @Index(name = "idx_booking_tm30_status", columnList = "tm30_status"),
        @Index(name = "idx_booking_checkin_tm30", columnList = "check_in, tm30_status, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RentalBooking {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "property_id", nullable = false)
    private RentalProperty property;

    @Column(name = "check_in", nullable = false)
    private Instant checkIn;

    @Column(name = "check_out", nullable = false)
    private Instant checkOut;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private BookingStatus status = BookingStatus.PENDING;

    @Column(name = "passports_received", nullable = false)
    @Builder.Default
    private Integer passportsReceived = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "tm30_status", nullable = false, length = 30)
    @Builder.Default
    private BookingTm30Status tm30Status = BookingTm30Status.PENDING;

    @Column(name = "tm30_reference", length = 100)
    private String tm30Reference;

    @Column(name = "tm30_error", length = 1000)
    private String tm30Error;

    @Column(name = "tm30_submitted_at")
    private LocalDateTime tm30SubmittedAt;

    @Column(name = "guest_phone", length = 30)
    private String guestPhone;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("guestNumber ASC")
    @Builder.Default
    private List<BookingGuest> guests = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void addGuest(BookingGuest guest) {
        guests.add(guest);
        guest.setBooking(this);
    }

    public Optional<BookingGuest> findGuest(int guestNumber) {
        return guests.stream()
                .filter(g -> g.getGuestNumber() != null && g.getGuestNumber() == guestNumber)
                .findFirst();
    }

    public int getTotalGuests() {
        return guests.size();
    }

    public boolean isOwnedBy(String candidateUserId) {
        return candidateUserId != null && candidateUserId.equals(userId);
    }

    public void moveTm30StatusTo(BookingTm30Status next, boolean administrative) {
        this.tm30Status = tm30Status.transitionTo(next, administrative);
    }

    /**
     * Record the executor's confirmation that the whole booking was filed.
     */
    public void markTm30Submitted(String reference, LocalDateTime submittedAt) {
        moveTm30StatusTo(BookingTm30Status.SUBMITTED, false);
        this.tm30Reference = reference;
        this.tm30SubmittedAt = submittedAt;
        this.tm30Error = null;
    }

    public void markTm30Failed(String error) {
        moveTm30StatusTo(BookingTm30Status.FAILED, false);
        this.tm30Error = error;
    }
}
