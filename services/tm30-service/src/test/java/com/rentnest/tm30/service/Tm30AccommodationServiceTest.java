package com.rentnest.tm30.service;

import com.rentnest.tm30.TestDataBuilder;
import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.AccommodationSyncResult;
import com.rentnest.tm30.domain.SyncedAccommodation;
import com.rentnest.tm30.dto.AccommodationLinkResponse;
import com.rentnest.tm30.dto.AccommodationListResponse;
import com.rentnest.tm30.entity.RentalProperty;
import com.rentnest.tm30.entity.Tm30Accommodation;
import com.rentnest.tm30.exception.AccommodationAlreadyLinkedException;
import com.rentnest.tm30.exception.AccommodationNotFoundException;
import com.rentnest.tm30.exception.PropertyNotFoundException;
import com.rentnest.tm30.exception.Tm30AccessDeniedException;
import com.rentnest.tm30.mapper.Tm30AccommodationMapper;
import com.rentnest.tm30.repository.RentalPropertyRepository;
import com.rentnest.tm30.repository.Tm30AccommodationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Tm30AccommodationService Unit Tests")
class Tm30AccommodationServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-02T03:00:00Z");

    @Mock
    private Tm30AccommodationRepository accommodationRepository;

    @Mock
    private RentalPropertyRepository propertyRepository;

    @Mock
    private Tm30AccommodationMapper accommodationMapper;

    private Tm30AccommodationService accommodationService;

    private RentalProperty property;

    @BeforeEach
    void setUp() {
        accommodationService = new Tm30AccommodationService(accommodationRepository, propertyRepository,
                new Tm30AccessPolicy(new Tm30Properties()), accommodationMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        property = TestDataBuilder.createTestProperty();
        property.unlinkTm30Accommodation();
        lenient().when(propertyRepository.findById(property.getId())).thenReturn(Optional.of(property));
    }

    private Tm30Accommodation accommodation(String tm30Id, String name) {
        return Tm30Accommodation.builder()
                .id(UUID.randomUUID())
                .tm30Id(tm30Id)
                .name(name)
                .address("12 Beach Rd, Phuket")
                .build();
    }

    @Nested
    @DisplayName("Linking")
    class LinkTests {

        @Test
        @DisplayName("Should copy the portal id and name onto the property")
        void shouldLinkPropertyToAccommodation() {
            // Arrange
            Tm30Accommodation accommodation = accommodation("P-100", "Sunset Villa Phuket");
            when(accommodationRepository.findById(accommodation.getId())).thenReturn(Optional.of(accommodation));
            when(accommodationRepository.findByPropertyId(property.getId())).thenReturn(Optional.empty());

            // Act
            AccommodationLinkResponse response = accommodationService.linkProperty(
                    property.getId(), accommodation.getId(), TestDataBuilder.createOperatorCaller());

            // Assert
            assertThat(property.getTm30AccommodationId()).isEqualTo("P-100");
            assertThat(property.getTm30AccommodationName()).isEqualTo("Sunset Villa Phuket");
            assertThat(accommodation.getProperty()).isSameAs(property);
            assertThat(response.getPropertyId()).isEqualTo(property.getId());
            assertThat(response.getTm30AccommodationId()).isEqualTo("P-100");
            verify(accommodationRepository).save(accommodation);
            verify(propertyRepository).save(property);
        }

        @Test
        void shouldFallBackToLocalIdWhenPortalIdIsMissing() {
            Tm30Accommodation accommodation = accommodation(null, "Hillside Condo");
            when(accommodationRepository.findById(accommodation.getId())).thenReturn(Optional.of(accommodation));
            when(accommodationRepository.findByPropertyId(property.getId())).thenReturn(Optional.empty());

            accommodationService.linkProperty(property.getId(), accommodation.getId(), TestDataBuilder.createOperatorCaller());

            assertThat(property.getTm30AccommodationId()).isEqualTo(accommodation.getId().toString());
        }

        @Test
        @DisplayName("Should refuse an accommodation already linked to another property")
        void shouldRejectAccommodationLinkedElsewhere() {
            // Arrange
            RentalProperty other = TestDataBuilder.createTestProperty();
            Tm30Accommodation accommodation = accommodation("P-100", "Sunset Villa Phuket");
            accommodation.linkTo(other);
            when(accommodationRepository.findById(accommodation.getId())).thenReturn(Optional.of(accommodation));

            // Act & Assert
            assertThatThrownBy(() -> accommodationService.linkProperty(
                    property.getId(), accommodation.getId(), TestDataBuilder.createOperatorCaller()))
                    .isInstanceOf(AccommodationAlreadyLinkedException.class)
                    .hasMessageContaining(other.getId().toString());
            assertThat(property.getTm30AccommodationId()).isNull();
            assertThat(accommodation.getProperty()).isSameAs(other);
            verify(accommodationRepository, never()).save(any());
            verify(propertyRepository, never()).save(any());
        }

        @Test
        void relinkingTheSamePropertyIsAllowed() {
            Tm30Accommodation accommodation = accommodation("P-100", "Sunset Villa Phuket");
            accommodation.linkTo(property);
            when(accommodationRepository.findById(accommodation.getId())).thenReturn(Optional.of(accommodation));
            when(accommodationRepository.findByPropertyId(property.getId())).thenReturn(Optional.of(accommodation));

            accommodationService.linkProperty(property.getId(), accommodation.getId(), TestDataBuilder.createOperatorCaller());

            assertThat(property.getTm30AccommodationId()).isEqualTo("P-100");
            verify(accommodationRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Should release the accommodation a property was bound to before")
        void shouldMovePropertyOffItsPreviousAccommodation() {
            // Arrange
            Tm30Accommodation previous = accommodation("P-001", "Old Listing");
            previous.linkTo(property);
            Tm30Accommodation next = accommodation("P-100", "Sunset Villa Phuket");
            when(accommodationRepository.findById(next.getId())).thenReturn(Optional.of(next));
            when(accommodationRepository.findByPropertyId(property.getId())).thenReturn(Optional.of(previous));

            // Act
            accommodationService.linkProperty(property.getId(), next.getId(), TestDataBuilder.createOperatorCaller());

            // Assert
            assertThat(previous.isLinked()).isFalse();
            assertThat(next.getProperty()).isSameAs(property);
            assertThat(property.getTm30AccommodationId()).isEqualTo("P-100");
            verify(accommodationRepository).saveAndFlush(previous);
        }

        @Test
        void shouldFailForUnknownAccommodation() {
            UUID unknown = UUID.randomUUID();
            when(accommodationRepository.findById(unknown)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> accommodationService.linkProperty(
                    property.getId(), unknown, TestDataBuilder.createOperatorCaller()))
                    .isInstanceOf(AccommodationNotFoundException.class);
        }

        @Test
        void shouldFailForUnknownProperty() {
            Tm30Accommodation accommodation = accommodation("P-100", "Sunset Villa Phuket");
            UUID unknown = UUID.randomUUID();
            when(accommodationRepository.findById(accommodation.getId())).thenReturn(Optional.of(accommodation));
            when(propertyRepository.findById(unknown)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> accommodationService.linkProperty(
                    unknown, accommodation.getId(), TestDataBuilder.createOperatorCaller()))
                    .isInstanceOf(PropertyNotFoundException.class);
        }

        @Test
        void linkingIsOperatorOnly() {
            assertThatThrownBy(() -> accommodationService.linkProperty(
                    property.getId(), UUID.randomUUID(), TestDataBuilder.createOwnerCaller()))
                    .isInstanceOf(Tm30AccessDeniedException.class);
            verifyNoInteractions(accommodationRepository);
        }
    }

    @Nested
    @DisplayName("Unlinking")
    class UnlinkTests {

        @Test
        void shouldClearBothSidesOfTheBinding() {
            Tm30Accommodation accommodation = accommodation("P-100", "Sunset Villa Phuket");
            accommodation.linkTo(property);
            when(accommodationRepository.findByPropertyId(property.getId())).thenReturn(Optional.of(accommodation));

            AccommodationLinkResponse response = accommodationService.unlinkProperty(
                    property.getId(), TestDataBuilder.createOperatorCaller());

            assertThat(accommodation.isLinked()).isFalse();
            assertThat(property.getTm30AccommodationId()).isNull();
            assertThat(property.getTm30AccommodationName()).isNull();
            assertThat(response.getTm30AccommodationId()).isNull();
            verify(accommodationRepository).save(accommodation);
            verify(propertyRepository).save(property);
        }

        @Test
        void shouldClearHandEnteredAccommodationFields() {
            property.linkTm30Accommodation("ACC-MANUAL", "Typed by hand");
            when(accommodationRepository.findByPropertyId(property.getId())).thenReturn(Optional.empty());

            accommodationService.unlinkProperty(property.getId(), TestDataBuilder.createOperatorCaller());

            assertThat(property.getTm30AccommodationId()).isNull();
            verify(accommodationRepository, never()).save(any());
        }

        @Test
        void unlinkingIsOperatorOnly() {
            assertThatThrownBy(() -> accommodationService.unlinkProperty(
                    property.getId(), TestDataBuilder.createStrangerCaller()))
                    .isInstanceOf(Tm30AccessDeniedException.class);
            verifyNoInteractions(propertyRepository);
        }
    }

    @Nested
    @DisplayName("Listing")
    class ListTests {

        @Test
        void shouldSummariseLinkedAccommodationsAndLatestSync() {
            // Arrange
            Tm30Accommodation linked = accommodation("P-100", "Sunset Villa Phuket");
            linked.linkTo(property);
            linked.setLastSyncedAt(LocalDateTime.of(2025, 3, 1, 9, 0));
            Tm30Accommodation free = accommodation("P-200", "Hillside Condo");
            free.setLastSyncedAt(LocalDateTime.of(2025, 3, 2, 9, 0));
            when(accommodationRepository.search("sunset")).thenReturn(List.of(linked, free));
            when(accommodationMapper.toViews(any())).thenReturn(List.of());

            // Act
            AccommodationListResponse response = accommodationService.listAccommodations(
                    "  Sunset ", null, TestDataBuilder.createOperatorCaller());

            // Assert
            assertThat(response.getTotal()).isEqualTo(2);
            assertThat(response.getLinkedCount()).isEqualTo(1);
            assertThat(response.getLastUpdated()).isEqualTo(LocalDateTime.of(2025, 3, 2, 9, 0));
            verify(accommodationRepository, never()).searchByStatus(any(), any());
        }

        @Test
        void shouldFilterByStatusWhenGiven() {
            when(accommodationRepository.searchByStatus("", "Approved")).thenReturn(List.of());
            when(accommodationMapper.toViews(any())).thenReturn(List.of());

            AccommodationListResponse response = accommodationService.listAccommodations(
                    null, "Approved", TestDataBuilder.createOperatorCaller());

            assertThat(response.getTotal()).isZero();
            assertThat(response.getLastUpdated()).isNull();
        }
    }

    @Nested
    @DisplayName("Executor sync")
    class SyncTests {

        @Test
        @DisplayName("Should create unknown accommodations and update known ones")
        void shouldUpsertByPortalIdThenNameAndAddress() {
            // Arrange
            Tm30Accommodation known = accommodation("P-100", "Sunset Villa");
            known.setStatus("Pending");
            when(accommodationRepository.findByTm30Id("P-100")).thenReturn(Optional.of(known));
            when(accommodationRepository.findFirstByNameAndAddress("Hillside Condo", "88 Hill St"))
                    .thenReturn(Optional.empty());

            // Act
            AccommodationSyncResult result = accommodationService.syncAccommodations(List.of(
                    SyncedAccommodation.builder().portalId("P-100").name("Sunset Villa Phuket")
                            .address("12 Beach Rd").status("Approved").build(),
                    SyncedAccommodation.builder().name("Hillside Condo").address("88 Hill St").build()));

            // Assert
            assertThat(result.getCreated()).isEqualTo(1);
            assertThat(result.getUpdated()).isEqualTo(1);
            assertThat(result.getTotal()).isEqualTo(2);
            assertThat(known.getName()).isEqualTo("Sunset Villa Phuket");
            assertThat(known.getStatus()).isEqualTo("Approved");
            assertThat(known.getLastSyncedAt()).isEqualTo(LocalDateTime.of(2025, 3, 2, 3, 0));

            ArgumentCaptor<Tm30Accommodation> captor = ArgumentCaptor.forClass(Tm30Accommodation.class);
            verify(accommodationRepository, times(2)).save(captor.capture());
            Tm30Accommodation created = captor.getAllValues().get(1);
            assertThat(created.getTm30Id()).isEqualTo("TM30-Hillside-Condo-" + NOW.toEpochMilli());
            assertThat(created.getStatus()).isEqualTo(Tm30Accommodation.DEFAULT_STATUS);
            assertThat(created.getSyncSource()).isEqualTo(Tm30AccommodationService.SYNC_SOURCE);
        }

        @Test
        void shouldMatchOnNameAndAddressWhenPortalIdIsUnknown() {
            Tm30Accommodation known = accommodation("TM30-Hillside-Condo-1", "Hillside Condo");
            known.setAddress("88 Hill St");
            when(accommodationRepository.findByTm30Id("P-300")).thenReturn(Optional.empty());
            when(accommodationRepository.findFirstByNameAndAddress("Hillside Condo", "88 Hill St"))
                    .thenReturn(Optional.of(known));

            AccommodationSyncResult result = accommodationService.syncAccommodations(List.of(
                    SyncedAccommodation.builder().portalId("P-300").name("Hillside Condo").address("88 Hill St").build()));

            assertThat(result.getUpdated()).isEqualTo(1);
            assertThat(result.getCreated()).isZero();
            assertThat(known.getTm30Id()).isEqualTo("TM30-Hillside-Condo-1");
        }

        @Test
        void shouldRefreshFilingNameOnLinkedProperty() {
            Tm30Accommodation known = accommodation("P-100", "Sunset Villa");
            known.linkTo(property);
            when(accommodationRepository.findByTm30Id("P-100")).thenReturn(Optional.of(known));

            accommodationService.syncAccommodations(List.of(
                    SyncedAccommodation.builder().portalId("P-100").name("Sunset Villa Phuket").build()));

            assertThat(property.getTm30AccommodationName()).isEqualTo("Sunset Villa Phuket");
        }

        @Test
        void shouldSkipEntriesWithoutAName() {
            AccommodationSyncResult result = accommodationService.syncAccommodations(List.of(
                    SyncedAccommodation.builder().portalId("P-400").name("  ").build()));

            assertThat(result.getSkipped()).isEqualTo(1);
            assertThat(result.getTotal()).isZero();
            verifyNoInteractions(accommodationRepository);
        }
    }
}
