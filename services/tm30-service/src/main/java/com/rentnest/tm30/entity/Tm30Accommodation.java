package com.rentnest.tm30.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An accommodation registered with the immigration portal, as last synced from
 * the automation executor. At most one rental property is linked to it.
 */
@Entity
@Table(name = "tm30_accommodations", indexes = {
        @Index(name = "idx_tm30_accommodation_tm30_id", columnList = "tm30_id", unique = true),
        @Index(name = "idx_tm30_accommodation_name", columnList = "name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Tm30Accommodation {

    public static final String DEFAULT_STATUS = "Approved";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * Identifier assigned by the immigration portal
     */
    @Column(name = "tm30_id", length = 100)
    private String tm30Id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "address", length = 500)
    private String address;

    @Column(name = "status", length = 30)
    @Builder.Default
    private String status = DEFAULT_STATUS;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "property_id", unique = true)
    private RentalProperty property;

    @Column(name = "last_synced_at")
    private LocalDateTime lastSyncedAt;

    @Column(name = "sync_source", length = 50)
    private String syncSource;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isLinked() {
        return property != null;
    }

    public boolean isLinkedToAnotherProperty(UUID propertyId) {
        return property != null && !property.getId().equals(propertyId);
    }

    /**
     * Identifier written onto a linked property and used on filings.
     * Falls back to the local ID for accommodations the portal has not numbered yet.
     */
    public String filingId() {
        return tm30Id != null && !tm30Id.isBlank() ? tm30Id : String.valueOf(id);
    }

    public void linkTo(RentalProperty target) {
        this.property = target;
        target.linkTm30Accommodation(filingId(), name);
    }

    public void unlink() {
        if (property != null) {
            property.unlinkTm30Accommodation();
            property = null;
        }
    }
}
