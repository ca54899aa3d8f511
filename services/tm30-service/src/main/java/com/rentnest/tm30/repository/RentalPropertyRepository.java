package com.rentnest.tm30.repository;

import com.rentnest.tm30.entity.RentalProperty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for the TM30 fields of rental properties
 */
@Repository
public interface RentalPropertyRepository extends JpaRepository<RentalProperty, UUID> {
}
