package com.rentnest.tm30.repository;

import com.rentnest.tm30.entity.Tm30Accommodation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for synced TM30 accommodations
 */
@Repository
public interface Tm30AccommodationRepository extends JpaRepository<Tm30Accommodation, UUID> {

    Optional<Tm30Accommodation> findByTm30Id(String tm30Id);

    Optional<Tm30Accommodation> findFirstByNameAndAddress(String name, String address);

    @Query("SELECT a FROM Tm30Accommodation a WHERE a.property.id = :propertyId")
    Optional<Tm30Accommodation> findByPropertyId(@Param("propertyId") UUID propertyId);

    /**
     * Accommodations whose name or address contains {@code search}, case-insensitive.
     * An empty search matches everything.
     */
    @Query("SELECT a FROM Tm30Accommodation a LEFT JOIN FETCH a.property " +
           "WHERE LOWER(a.name) LIKE CONCAT('%', :search, '%') " +
           "OR LOWER(COALESCE(a.address, '')) LIKE CONCAT('%', :search, '%') " +
           "ORDER BY a.name ASC")
    List<Tm30Accommodation> search(@Param("search") String search);

    @Query("SELECT a FROM Tm30Accommodation a LEFT JOIN FETCH a.property " +
           "WHERE (LOWER(a.name) LIKE CONCAT('%', :search, '%') " +
           "OR LOWER(COALESCE(a.address, '')) LIKE CONCAT('%', :search, '%')) " +
           "AND a.status = :status " +
           "ORDER BY a.name ASC")
    List<Tm30Accommodation> searchByStatus(@Param("search") String search, @Param("status") String status);
}
