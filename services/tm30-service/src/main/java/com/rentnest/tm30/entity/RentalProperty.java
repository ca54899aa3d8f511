package com.rentnest.tm30.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Read side of the property catalog. Only the fields the TM30 pipeline needs
 */
@Entity
@Table(name = "rental_properties")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RentalProperty {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "tm30_accommodation_id", length = 100)
    private String tm30AccommodationId;

    @Column(name = "tm30_accommodation_name")
    private String tm30AccommodationName;

    public boolean hasTm30Accommodation() {
        return tm30AccommodationId != null && !tm30AccommodationId.isBlank();
    }

    public void linkTm30Accommodation(String accommodationId, String accommodationName) {
        this.tm30AccommodationId = accommodationId;
        this.tm30AccommodationName = accommodationName;
    }

    public void unlinkTm30Accommodation() {
        this.tm30AccommodationId = null;
        this.tm30AccommodationName = null;
    }

    /**
     * Name used on the filing. Falls back to the accommodation ID
     */
    public String tm30AccommodationLabel() {
        if (tm30AccommodationName != null && !tm30AccommodationName.isBlank()) {
            return tm30AccommodationName;
        }
        return tm30AccommodationId;
    }
}
