package com.rentnest.tm30.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One occupant of a booking, holding passport data and the guest's TM30 status
 */
@Entity
@Table(name = "booking_guests",
        uniqueConstraints = @UniqueConstraint(name = "uk_guest_booking_number", columnNames = {"booking_id", "guest_number"}),
        indexes = {
                @Index(name = "idx_guest_booking_id", columnList = "booking_id"),
                @Index(name = "idx_guest_tm30_status", columnList = "tm30_status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingGuest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "booking_id", nullable = false)
    private RentalBooking booking;

    @Column(name = "guest_number", nullable = false)
    private Integer guestNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "guest_type", nullable = false, length = 20)
    @Builder.Default
    private GuestType guestType = GuestType.ADDITIONAL;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "full_name", length = 200)
    private String fullName;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "nationality", length = 100)
    private String nationality;

    @Column(name = "gender", length = 20)
    private String gender;

    @Column(name = "passport_number", length = 50)
    private String passportNumber;

    @Column(name = "passport_issue_date")
    private LocalDate passportIssueDate;

    @Column(name = "passport_expiry")
    private LocalDate passportExpiry;

    @Column(name = "passport_country", length = 100)
    private String passportCountry;

    @Column(name = "passport_image_url", length = 1000)
    private String passportImageUrl;

    @Column(name = "passport_image_path", length = 500)
    private String passportImagePath;

    @Column(name = "ocr_confidence")
    private Double ocrConfidence;

    @Column(name = "ocr_raw_data", columnDefinition = "TEXT")
    private String ocrRawData;

    @Column(name = "ocr_processed_at")
    private LocalDateTime ocrProcessedAt;

    @Column(name = "passport_verified", nullable = false)
    @Builder.Default
    private Boolean passportVerified = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "tm30_status", nullable = false, length = 30)
    @Builder.Default
    private GuestTm30Status tm30Status = GuestTm30Status.PENDING;

    @Column(name = "tm30_submitted_at")
    private LocalDateTime tm30SubmittedAt;

    @Column(name = "tm30_error", length = 1000)
    private String tm30Error;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    // Business methods

    /**
     * A guest counts as received only once a passport image is attached.
     */
    public boolean hasPassportImage() {
        return passportImageUrl != null && !passportImageUrl.isBlank();
    }

    public boolean hasPassportNumber() {
        return passportNumber != null && !passportNumber.isBlank();
    }

    public boolean isSubmitted() {
        return tm30Status == GuestTm30Status.SUBMITTED;
    }

    /**
     * Eligible for a filing batch: passport number present and not already filed.
     */
    public boolean isEligibleForSubmission() {
        return hasPassportNumber() && !isSubmitted();
    }

    public void moveTm30StatusTo(GuestTm30Status next, boolean administrative) {
        this.tm30Status = tm30Status.transitionTo(next, administrative);
    }

    /**
     * Rebuild the full name from first and last name. Left untouched unless both are present.
     */
    public void deriveFullName() {
        if (firstName != null && lastName != null) {
            this.fullName = (firstName + " " + lastName).trim();
        }
    }

    public void markTm30Submitted(LocalDateTime submittedAt) {
        moveTm30StatusTo(GuestTm30Status.SUBMITTED, false);
        this.tm30SubmittedAt = submittedAt;
        this.tm30Error = null;
    }

    public void markTm30Rejected(String error) {
        moveTm30StatusTo(GuestTm30Status.PENDING, false);
        this.tm30Error = error;
    }
}
