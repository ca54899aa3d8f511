package com.rentnest.tm30.service;

import com.rentnest.tm30.domain.AccommodationSyncResult;
import com.rentnest.tm30.domain.SyncedAccommodation;
import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.dto.AccommodationLinkResponse;
import com.rentnest.tm30.dto.AccommodationListResponse;
import com.rentnest.tm30.entity.RentalProperty;
import com.rentnest.tm30.entity.Tm30Accommodation;
import com.rentnest.tm30.exception.AccommodationAlreadyLinkedException;
import com.rentnest.tm30.exception.AccommodationNotFoundException;
import com.rentnest.tm30.exception.PropertyNotFoundException;
import com.rentnest.tm30.mapper.Tm30AccommodationMapper;
import com.rentnest.tm30.repository.RentalPropertyRepository;
import com.rentnest.tm30.repository.Tm30AccommodationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Binds rental properties to the accommodations registered on the immigration
 * portal and keeps the local accommodation list in step with the portal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Tm30AccommodationService {

    static final String SYNC_SOURCE = "automation-executor";
    private static final int GENERATED_ID_NAME_LENGTH = 20;

    private final Tm30AccommodationRepository accommodationRepository;
    private final RentalPropertyRepository propertyRepository;
    private final Tm30AccessPolicy accessPolicy;
    private final Tm30AccommodationMapper accommodationMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AccommodationListResponse listAccommodations(String search, String status, Tm30Caller caller) {
        accessPolicy.checkOperator(caller);

        String term = search == null ? "" : search.trim().toLowerCase(Locale.ROOT);
        List<Tm30Accommodation> accommodations = StringUtils.hasText(status)
                ? accommodationRepository.searchByStatus(term, status.trim())
                : accommodationRepository.search(term);

        return AccommodationListResponse.builder()
                .total(accommodations.size())
                .linkedCount((int) accommodations.stream().filter(Tm30Accommodation::isLinked).count())
                .lastUpdated(accommodations.stream()
                        .map(Tm30Accommodation::getLastSyncedAt)
                        .filter(Objects::nonNull)
                        .max(Comparator.naturalOrder())
                        .orElse(null))
                .accommodations(accommodationMapper.toViews(accommodations))
                .build();
    }

    /**
     * Bind a property to an accommodation. An accommodation serves one property;
     * a property already bound elsewhere is moved to the new accommodation.
     */
    @Transactional
    public AccommodationLinkResponse linkProperty(UUID propertyId, UUID accommodationId, Tm30Caller caller) {
        accessPolicy.checkOperator(caller);

        Tm30Accommodation accommodation = accommodationRepository.findById(accommodationId)
                .orElseThrow(() -> new AccommodationNotFoundException(accommodationId));
        RentalProperty property = propertyRepository.findById(propertyId)
                .orElseThrow(() -> new PropertyNotFoundException(propertyId));

        if (accommodation.isLinkedToAnotherProperty(propertyId)) {
            throw new AccommodationAlreadyLinkedException(accommodationId, accommodation.getProperty().getId());
        }

        // property_id is unique, so the old binding has to reach the database first
        accommodationRepository.findByPropertyId(propertyId)
                .filter(previous -> !previous.getId().equals(accommodationId))
                .ifPresent(previous -> {
                    log.info("Moving property {} from accommodation {} to {}", propertyId, previous.getId(), accommodationId);
                    previous.unlink();
                    accommodationRepository.saveAndFlush(previous);
                });

        accommodation.linkTo(property);
        accommodationRepository.save(accommodation);
        propertyRepository.save(property);

        log.info("Linked property {} to TM30 accommodation {} ({})",
                propertyId, property.getTm30AccommodationId(), property.getTm30AccommodationName());
        return toLinkResponse(property, "Property linked to TM30 accommodation");
    }

    @Transactional
    public AccommodationLinkResponse unlinkProperty(UUID propertyId, Tm30Caller caller) {
        accessPolicy.checkOperator(caller);

        RentalProperty property = propertyRepository.findById(propertyId)
                .orElseThrow(() -> new PropertyNotFoundException(propertyId));

        accommodationRepository.findByPropertyId(propertyId).ifPresent(accommodation -> {
            accommodation.unlink();
            accommodationRepository.save(accommodation);
        });
        // also covers ids entered on the property by hand
        property.unlinkTm30Accommodation();
        propertyRepository.save(property);

        log.info("Unlinked property {} from its TM30 accommodation", propertyId);
        return toLinkResponse(property, "Property unlinked from TM30 accommodation");
    }

    /**
     * Upsert the accommodation list reported by the automation executor. Entries
     * match on portal id first, then on name and address.
     */
    @Transactional
    public AccommodationSyncResult syncAccommodations(List<SyncedAccommodation> synced) {
        LocalDateTime now = LocalDateTime.now(clock);
        int created = 0;
        int updated = 0;
        int skipped = 0;

        for (SyncedAccommodation entry : synced) {
            if (!StringUtils.hasText(entry.getName())) {
                log.warn("Skipping synced accommodation without a name (portal id {})", entry.getPortalId());
                skipped++;
                continue;
            }

            Optional<Tm30Accommodation> existing = findExisting(entry);
            Tm30Accommodation accommodation = existing.orElseGet(() -> Tm30Accommodation.builder()
                    .tm30Id(StringUtils.hasText(entry.getPortalId())
                            ? entry.getPortalId().trim()
                            : generatedTm30Id(entry.getName()))
                    .build());

            accommodation.setName(entry.getName().trim());
            accommodation.setAddress(entry.getAddress());
            accommodation.setStatus(StringUtils.hasText(entry.getStatus())
                    ? entry.getStatus().trim()
                    : Tm30Accommodation.DEFAULT_STATUS);
            accommodation.setLastSyncedAt(now);
            accommodation.setSyncSource(SYNC_SOURCE);
            if (accommodation.isLinked()) {
                // keep the filing name on the bound property current
                accommodation.linkTo(accommodation.getProperty());
            }
            accommodationRepository.save(accommodation);

            if (existing.isPresent()) {
                updated++;
            } else {
                created++;
            }
        }

        log.info("TM30 accommodation sync: {} created, {} updated, {} skipped", created, updated, skipped);
        return AccommodationSyncResult.builder()
                .created(created)
                .updated(updated)
                .skipped(skipped)
                .build();
    }

    private Optional<Tm30Accommodation> findExisting(SyncedAccommodation entry) {
        if (StringUtils.hasText(entry.getPortalId())) {
            Optional<Tm30Accommodation> byPortalId = accommodationRepository.findByTm30Id(entry.getPortalId().trim());
            if (byPortalId.isPresent()) {
                return byPortalId;
            }
        }
        return accommodationRepository.findFirstByNameAndAddress(entry.getName().trim(), entry.getAddress());
    }

    private String generatedTm30Id(String name) {
        String slug = name.trim().replaceAll("\\s+", "-");
        if (slug.length() > GENERATED_ID_NAME_LENGTH) {
            slug = slug.substring(0, GENERATED_ID_NAME_LENGTH);
        }
        return "TM30-" + slug + "-" + clock.millis();
    }

    private AccommodationLinkResponse toLinkResponse(RentalProperty property, String message) {
        return AccommodationLinkResponse.builder()
                .propertyId(property.getId())
                .propertyTitle(property.getTitle())
                .tm30AccommodationId(property.getTm30AccommodationId())
                .tm30AccommodationName(property.getTm30AccommodationName())
                .message(message)
                .build();
    }
}
