package com.rentnest.tm30.service;

import com.rentnest.tm30.TestDataBuilder;
import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.*;
import com.rentnest.tm30.dto.GuestPassportResponse;
import com.rentnest.tm30.dto.PassportCorrectionRequest;
import com.rentnest.tm30.dto.PassportIntakeResponse;
import com.rentnest.tm30.dto.PassportSubmissionRequest;
import com.rentnest.tm30.entity.*;
import com.rentnest.tm30.exception.ImageStorageException;
import com.rentnest.tm30.exception.InvalidPassportRequestException;
import com.rentnest.tm30.exception.InvalidTm30StateException;
import com.rentnest.tm30.exception.Tm30AccessDeniedException;
import com.rentnest.tm30.mapper.BookingGuestMapper;
import com.rentnest.tm30.provider.PassportImageStorage;
import com.rentnest.tm30.provider.PassportOcrProvider;
import com.rentnest.tm30.repository.BookingGuestRepository;
import com.rentnest.tm30.repository.RentalBookingRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PassportIntakeService Unit Tests")
class PassportIntakeServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T05:00:00Z");

    @Mock
    private BookingGuestRepository guestRepository;

    @Mock
    private RentalBookingRepository bookingRepository;

    @Mock
    private PassportImageStorage imageStorage;

    @Mock
    private PassportOcrProvider ocrProvider;

    @Mock
    private Tm30StatusAggregator aggregator;

    @Mock
    private TransactionTemplate transactionTemplate;

    private SimpleMeterRegistry meterRegistry;
    private PassportIntakeService intakeService;

    private RentalBooking booking;
    private BookingGuest guest;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        Tm30Properties properties = new Tm30Properties();
        properties.getSecurity().setInternalApiKey(TestDataBuilder.TEST_API_KEY);
        meterRegistry = new SimpleMeterRegistry();

        intakeService = new PassportIntakeService(guestRepository, bookingRepository, imageStorage, ocrProvider,
                new PassportValidationService(clock, properties), aggregator, new Tm30AccessPolicy(properties),
                Mappers.getMapper(BookingGuestMapper.class), transactionTemplate, properties, meterRegistry, clock);
        intakeService.initMetrics();

        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(inv -> ((TransactionCallback<?>) inv.getArgument(0)).doInTransaction(null));

        booking = TestDataBuilder.createTestBooking();
        guest = TestDataBuilder.createPendingGuest(booking, 1);
        lenient().when(guestRepository.findWithBookingById(guest.getId())).thenReturn(Optional.of(guest));
        lenient().when(guestRepository.findById(guest.getId())).thenReturn(Optional.of(guest));
        lenient().when(guestRepository.save(any(BookingGuest.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private PassportSubmissionRequest urlRequest() {
        return PassportSubmissionRequest.builder().imageUrl(TestDataBuilder.TEST_IMAGE_URL).build();
    }

    @Nested
    @DisplayName("Passport intake")
    class IntakeTests {

        @Test
        @DisplayName("Should store OCR data and mark the guest SCANNED")
        void shouldScanPassportFromUrl() {
            // Arrange
            PassportData data = TestDataBuilder.createTestPassportData();
            data.setPassportNumber("ab 1234567");
            when(ocrProvider.scan(TestDataBuilder.TEST_IMAGE_URL))
                    .thenReturn(PassportOcrResult.success(data, 0.97, "{\"raw\":true}"));

            // Act
            PassportIntakeResponse response = intakeService.submitPassport(
                    guest.getId(), urlRequest(), TestDataBuilder.createOwnerCaller());

            // Assert
            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getValidation().isValid()).isTrue();
            assertThat(response.getOcrResult().getConfidence()).isEqualTo(0.97);

            GuestPassportResponse stored = response.getGuest();
            assertThat(stored.getTm30Status()).isEqualTo(GuestTm30Status.SCANNED);
            assertThat(stored.getPassportNumber()).isEqualTo("AB1234567");
            assertThat(stored.getPassportImageUrl()).isEqualTo(TestDataBuilder.TEST_IMAGE_URL);
            assertThat(stored.getBookingId()).isEqualTo(booking.getId());
            assertThat(guest.getOcrRawData()).isEqualTo("{\"raw\":true}");
            assertThat(guest.getPassportVerified()).isFalse();

            verify(aggregator).recompute(booking.getId());
            verifyNoInteractions(imageStorage);
            assertThat(meterRegistry.get("tm30.passport.scanned").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Inline images are uploaded first and the stored URL is scanned")
        void shouldUploadInlineImage() {
            PassportSubmissionRequest request = PassportSubmissionRequest.builder()
                    .imageBase64("data:image/jpeg;base64,QUJD")
                    .mimeType("image/jpeg")
                    .build();
            String storedUrl = "https://storage.example.com/passports/stored.jpg";
            when(imageStorage.upload(anyString(), anyString(), anyString(), any()))
                    .thenReturn(StoredImage.builder().url(storedUrl).path("passports/stored.jpg").build());
            when(ocrProvider.scan(storedUrl))
                    .thenReturn(PassportOcrResult.success(TestDataBuilder.createTestPassportData(), 0.9, null));

            intakeService.submitPassport(guest.getId(), request, TestDataBuilder.createOwnerCaller());

            ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<String> fileName = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<String> folder = ArgumentCaptor.forClass(String.class);
            verify(imageStorage).upload(content.capture(), fileName.capture(), folder.capture(), eq("image/jpeg"));
            assertThat(content.getValue()).isEqualTo("QUJD");
            assertThat(fileName.getValue()).isEqualTo("passport-" + guest.getId() + "-" + NOW.toEpochMilli() + ".jpg");
            assertThat(folder.getValue()).isEqualTo("/passports/" + booking.getId());
            assertThat(guest.getPassportImageUrl()).isEqualTo(storedUrl);
            assertThat(guest.getPassportImagePath()).isEqualTo("passports/stored.jpg");
        }

        @Test
        @DisplayName("Storage failure aborts before OCR and leaves the guest untouched")
        void shouldAbortIntakeWhenUploadFails() {
            // Arrange
            PassportSubmissionRequest request = PassportSubmissionRequest.builder()
                    .imageBase64("QUJD")
                    .mimeType("image/jpeg")
                    .build();
            when(imageStorage.upload(anyString(), anyString(), anyString(), any()))
                    .thenThrow(new ImageStorageException("Blob storage returned HTTP 503"));

            // Act & Assert
            assertThatThrownBy(() -> intakeService.submitPassport(
                    guest.getId(), request, TestDataBuilder.createOwnerCaller()))
                    .isInstanceOf(ImageStorageException.class)
                    .hasMessageContaining("503");

            assertThat(guest.getTm30Status()).isEqualTo(GuestTm30Status.PENDING);
            assertThat(guest.getPassportImageUrl()).isNull();
            assertThat(guest.getOcrProcessedAt()).isNull();
            verifyNoInteractions(ocrProvider, aggregator);
            verify(guestRepository, never()).save(any());
            verify(transactionTemplate, never()).execute(any());
        }

        @Test
        @DisplayName("OCR failure keeps the image but leaves the guest PENDING")
        void shouldKeepGuestPendingWhenOcrFails() {
            when(ocrProvider.scan(anyString())).thenReturn(PassportOcrResult.failure("OCR service unavailable"));

            PassportIntakeResponse response = intakeService.submitPassport(
                    guest.getId(), urlRequest(), TestDataBuilder.createOwnerCaller());

            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getOcrResult().getError()).isEqualTo("OCR service unavailable");
            assertThat(response.getValidation().getErrors()).containsExactly("No data extracted");
            assertThat(guest.getTm30Status()).isEqualTo(GuestTm30Status.PENDING);
            assertThat(guest.getPassportImageUrl()).isEqualTo(TestDataBuilder.TEST_IMAGE_URL);
            assertThat(meterRegistry.get("tm30.passport.ocr.failed").counter().count()).isEqualTo(1.0);
        }

        @Test
        void shouldRequireAnImageSource() {
            PassportSubmissionRequest request = PassportSubmissionRequest.builder().imageUrl("  ").build();

            assertThatThrownBy(() -> intakeService.submitPassport(guest.getId(), request, TestDataBuilder.createOwnerCaller()))
                    .isInstanceOf(InvalidPassportRequestException.class)
                    .hasMessage("Either imageUrl or imageBase64 is required");
            verifyNoInteractions(ocrProvider);
        }

        @Test
        void shouldDenyStrangers() {
            assertThatThrownBy(() -> intakeService.submitPassport(
                    guest.getId(), urlRequest(), TestDataBuilder.createStrangerCaller()))
                    .isInstanceOf(Tm30AccessDeniedException.class);
            verifyNoInteractions(ocrProvider, imageStorage);
        }

        @Test
        void shouldAcceptInternalServiceKey() {
            when(ocrProvider.scan(anyString()))
                    .thenReturn(PassportOcrResult.success(TestDataBuilder.createTestPassportData(), 0.9, null));

            PassportIntakeResponse response = intakeService.submitPassport(
                    guest.getId(), urlRequest(), TestDataBuilder.createInternalCaller());

            assertThat(response.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("Owners cannot overwrite a guest already filed with immigration")
        void shouldRejectRescanOfSubmittedGuest() {
            guest.setTm30Status(GuestTm30Status.SUBMITTED);

            assertThatThrownBy(() -> intakeService.submitPassport(
                    guest.getId(), urlRequest(), TestDataBuilder.createOwnerCaller()))
                    .isInstanceOf(InvalidTm30StateException.class);
            verifyNoInteractions(ocrProvider);
        }
    }

    @Nested
    @DisplayName("Intake by booking and guest number")
    class BookingIntakeTests {

        @Test
        void shouldCreateMissingGuestOnFirstUpload() {
            when(bookingRepository.findWithPropertyById(booking.getId())).thenReturn(Optional.of(booking));
            UUID newGuestId = UUID.randomUUID();
            when(guestRepository.saveAndFlush(any(BookingGuest.class))).thenAnswer(inv -> {
                BookingGuest created = inv.getArgument(0);
                created.setId(newGuestId);
                return created;
            });
            when(guestRepository.findWithBookingById(newGuestId)).thenAnswer(inv -> booking.findGuest(2));
            when(guestRepository.findById(newGuestId)).thenAnswer(inv -> booking.findGuest(2));
            when(ocrProvider.scan(anyString()))
                    .thenReturn(PassportOcrResult.success(TestDataBuilder.createTestPassportData(), 0.9, null));

            PassportIntakeResponse response = intakeService.submitPassportForBooking(
                    booking.getId(), 2, urlRequest(), TestDataBuilder.createOwnerCaller());

            assertThat(booking.getTotalGuests()).isEqualTo(2);
            BookingGuest created = booking.findGuest(2).orElseThrow();
            assertThat(created.getGuestType()).isEqualTo(GuestType.ADDITIONAL);
            assertThat(response.getGuest().getGuestNumber()).isEqualTo(2);
            verify(aggregator).refresh(booking);
        }

        @Test
        @DisplayName("Re-running intake overwrites the extracted fields on the same row")
        void shouldReuseExistingGuest() {
            // Arrange
            guest.setFirstName("Old");
            guest.setLastName("Name");
            guest.setFullName("Old Name");
            guest.setPassportNumber("ZZ0000000");
            guest.setPassportImageUrl("https://cdn.example.com/passports/old.jpg");
            guest.setTm30Status(GuestTm30Status.SCANNED);
            when(bookingRepository.findWithPropertyById(booking.getId())).thenReturn(Optional.of(booking));
            when(ocrProvider.scan(anyString()))
                    .thenReturn(PassportOcrResult.success(TestDataBuilder.createTestPassportData(), 0.9, null));

            // Act
            PassportIntakeResponse response = intakeService.submitPassportForBooking(
                    booking.getId(), 1, urlRequest(), TestDataBuilder.createOwnerCaller());

            // Assert
            assertThat(booking.getTotalGuests()).isEqualTo(1);
            assertThat(response.getGuest().getId()).isEqualTo(guest.getId());
            assertThat(guest.getPassportNumber()).isEqualTo(TestDataBuilder.TEST_PASSPORT_NUMBER);
            assertThat(guest.getFirstName()).isEqualTo("Jane");
            assertThat(guest.getLastName()).isEqualTo("Doe");
            assertThat(guest.getFullName()).isEqualTo("Jane Doe");
            assertThat(guest.getPassportImageUrl()).isEqualTo(TestDataBuilder.TEST_IMAGE_URL);
            assertThat(guest.getTm30Status()).isEqualTo(GuestTm30Status.SCANNED);
            verify(guestRepository).save(guest);
            verify(guestRepository, never()).saveAndFlush(any());
        }

        @Test
        void shouldRejectGuestNumberZero() {
            assertThatThrownBy(() -> intakeService.submitPassportForBooking(
                    booking.getId(), 0, urlRequest(), TestDataBuilder.createOwnerCaller()))
                    .isInstanceOf(InvalidPassportRequestException.class);
        }
    }

    @Nested
    @DisplayName("Manual corrections")
    class CorrectionTests {

        @Test
        @DisplayName("Only the provided fields change and verification is recorded")
        void shouldApplyPartialCorrection() {
            BookingGuest scanned = TestDataBuilder.createScannedGuest(booking, 2);
            when(guestRepository.findWithBookingById(scanned.getId())).thenReturn(Optional.of(scanned));
            PassportCorrectionRequest request = PassportCorrectionRequest.builder()
                    .lastName(" Smith ")
                    .passportNumber("x y 123456")
                    .passportVerified(true)
                    .build();

            GuestPassportResponse response = intakeService.correctPassport(
                    scanned.getId(), request, TestDataBuilder.createOwnerCaller());

            assertThat(response.getTm30Status()).isEqualTo(GuestTm30Status.VERIFIED);
            assertThat(response.getFirstName()).isEqualTo("Jane");
            assertThat(response.getLastName()).isEqualTo("Smith");
            assertThat(response.getFullName()).isEqualTo("Jane Smith");
            assertThat(response.getPassportNumber()).isEqualTo("XY123456");
            assertThat(response.getDateOfBirth()).isEqualTo(LocalDate.of(1990, 5, 17));
            assertThat(response.getPassportVerified()).isTrue();
            verify(aggregator).recompute(booking.getId());
        }

        @Test
        void ownerCannotReopenSubmittedGuest() {
            BookingGuest filed = TestDataBuilder.createGuestWithStatus(booking, 2, GuestTm30Status.SUBMITTED);
            when(guestRepository.findWithBookingById(filed.getId())).thenReturn(Optional.of(filed));
            PassportCorrectionRequest request = PassportCorrectionRequest.builder().firstName("Janet").build();

            assertThatThrownBy(() -> intakeService.correctPassport(filed.getId(), request, TestDataBuilder.createOwnerCaller()))
                    .isInstanceOf(InvalidTm30StateException.class);
            assertThat(filed.getFirstName()).isEqualTo("Jane");
        }

        @Test
        void operatorMayCorrectSubmittedGuest() {
            BookingGuest filed = TestDataBuilder.createGuestWithStatus(booking, 2, GuestTm30Status.SUBMITTED);
            when(guestRepository.findWithBookingById(filed.getId())).thenReturn(Optional.of(filed));
            PassportCorrectionRequest request = PassportCorrectionRequest.builder().firstName("Janet").build();

            GuestPassportResponse response = intakeService.correctPassport(
                    filed.getId(), request, TestDataBuilder.createOperatorCaller());

            assertThat(response.getTm30Status()).isEqualTo(GuestTm30Status.SCANNED);
            assertThat(response.getFirstName()).isEqualTo("Janet");
        }
    }

    @Test
    void shouldStripDataUriPrefix() {
        assertThat(PassportIntakeService.stripDataUriPrefix("data:image/png;base64,AAAA")).isEqualTo("AAAA");
        assertThat(PassportIntakeService.stripDataUriPrefix("AAAA")).isEqualTo("AAAA");
    }
}
