package com.rentnest.tm30.service;

import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.AccessGrant;
import com.rentnest.tm30.domain.PassportData;
import com.rentnest.tm30.domain.PassportOcrResult;
import com.rentnest.tm30.domain.PassportValidationResult;
import com.rentnest.tm30.domain.StoredImage;
import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.dto.GuestPassportResponse;
import com.rentnest.tm30.dto.PassportCorrectionRequest;
import com.rentnest.tm30.dto.PassportIntakeResponse;
import com.rentnest.tm30.dto.PassportSubmissionRequest;
import com.rentnest.tm30.entity.BookingGuest;
import com.rentnest.tm30.entity.GuestTm30Status;
import com.rentnest.tm30.entity.GuestType;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.exception.BookingNotFoundException;
import com.rentnest.tm30.exception.GuestNotFoundException;
import com.rentnest.tm30.exception.InvalidPassportRequestException;
import com.rentnest.tm30.exception.InvalidTm30StateException;
import com.rentnest.tm30.mapper.BookingGuestMapper;
import com.rentnest.tm30.provider.PassportImageStorage;
import com.rentnest.tm30.provider.PassportOcrProvider;
import com.rentnest.tm30.repository.BookingGuestRepository;
import com.rentnest.tm30.repository.RentalBookingRepository;
import com.rentnest.tm30.util.DataMaskingUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Passport intake: image upload, OCR and persistence of the extracted data,
 * plus manual corrections by the booking owner or an operator.
 *
 * External calls (upload, OCR) run outside the database transaction. Only the
 * final write of the guest and the booking recompute are transactional.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PassportIntakeService {

    private static final String DATA_URI_SEPARATOR = ";base64,";

    private final BookingGuestRepository guestRepository;
    private final RentalBookingRepository bookingRepository;
    private final PassportImageStorage imageStorage;
    private final PassportOcrProvider ocrProvider;
    private final PassportValidationService validationService;
    private final Tm30StatusAggregator aggregator;
    private final Tm30AccessPolicy accessPolicy;
    private final BookingGuestMapper guestMapper;
    private final TransactionTemplate transactionTemplate;
    private final Tm30Properties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter passportScannedCounter;
    private Counter ocrFailedCounter;

    @PostConstruct
    public void initMetrics() {
        passportScannedCounter = Counter.builder("tm30.passport.scanned")
                .description("Passports read successfully by OCR")
                .register(meterRegistry);
        ocrFailedCounter = Counter.builder("tm30.passport.ocr.failed")
                .description("Passport OCR attempts that failed or timed out")
                .register(meterRegistry);
    }

    /**
     * Take a passport image for a guest, run OCR and store the result.
     */
    public PassportIntakeResponse submitPassport(UUID guestId, PassportSubmissionRequest request, Tm30Caller caller) {
        String inlineImage = trimToNull(request.getImageBase64());
        String imageUrl = trimToNull(request.getImageUrl());
        if (inlineImage == null && imageUrl == null) {
            throw new InvalidPassportRequestException("Either imageUrl or imageBase64 is required");
        }

        BookingGuest guest = guestRepository.findWithBookingById(guestId)
                .orElseThrow(() -> new GuestNotFoundException(guestId));
        RentalBooking booking = guest.getBooking();
        AccessGrant grant = accessPolicy.checkIntakeAccess(booking, caller);
        if (guest.isSubmitted() && !grant.isAdministrative()) {
            throw new InvalidTm30StateException("Guest passport has already been submitted to TM30");
        }

        String imagePath = null;
        if (inlineImage != null) {
            StoredImage stored = imageStorage.upload(
                    stripDataUriPrefix(inlineImage),
                    "passport-" + guestId + "-" + clock.millis() + ".jpg",
                    properties.getStorage().getFolderPrefix() + "/" + booking.getId(),
                    request.getMimeType());
            imageUrl = stored.getUrl();
            imagePath = stored.getPath();
        }

        PassportOcrResult ocr = ocrProvider.scan(imageUrl);
        PassportValidationResult validation = validationService.validate(ocr.isSuccess() ? ocr.getData() : null);
        if (ocr.isSuccess()) {
            passportScannedCounter.increment();
            log.info("Passport scanned for guest {} of booking {}: number {}, confidence {}, valid={}",
                    guestId, booking.getId(),
                    DataMaskingUtil.maskPassportNumber(ocr.getData().getPassportNumber()),
                    ocr.getConfidence(), validation.isValid());
        } else {
            ocrFailedCounter.increment();
            log.warn("Passport OCR failed for guest {} of booking {}: {}", guestId, booking.getId(), ocr.getError());
        }

        String storedUrl = imageUrl;
        String storedPath = imagePath;
        GuestPassportResponse updated = transactionTemplate.execute(status ->
                applyScan(guestId, storedUrl, storedPath, ocr, grant.isAdministrative()));

        return PassportIntakeResponse.builder()
                .success(ocr.isSuccess())
                .guest(updated)
                .validation(validation)
                .ocrResult(PassportIntakeResponse.OcrSummary.builder()
                        .success(ocr.isSuccess())
                        .confidence(ocr.getConfidence())
                        .error(ocr.getError())
                        .build())
                .build();
    }

    /**
     * Same as {@link #submitPassport} but addresses the guest by booking and
     * guest number, creating the guest row on first upload.
     */
    public PassportIntakeResponse submitPassportForBooking(UUID bookingId, int guestNumber,
                                                          PassportSubmissionRequest request, Tm30Caller caller) {
        if (guestNumber < 1) {
            throw new InvalidPassportRequestException("Guest number must be 1 or greater");
        }
        UUID guestId = transactionTemplate.execute(status -> findOrCreateGuest(bookingId, guestNumber, caller));
        return submitPassport(guestId, request, caller);
    }

    /**
     * Manual correction of passport fields. Null fields are left as they are.
     */
    @Transactional
    public GuestPassportResponse correctPassport(UUID guestId, PassportCorrectionRequest request, Tm30Caller caller) {
        BookingGuest guest = guestRepository.findWithBookingById(guestId)
                .orElseThrow(() -> new GuestNotFoundException(guestId));
        AccessGrant grant = accessPolicy.checkOwnerOrOperator(guest.getBooking(), caller);

        boolean verified = Boolean.TRUE.equals(request.getPassportVerified());
        guest.moveTm30StatusTo(verified ? GuestTm30Status.VERIFIED : GuestTm30Status.SCANNED, grant.isAdministrative());

        if (request.getFirstName() != null) guest.setFirstName(request.getFirstName().trim());
        if (request.getLastName() != null) guest.setLastName(request.getLastName().trim());
        if (request.getPassportNumber() != null) {
            guest.setPassportNumber(trimToNull(PassportValidationService.normalizePassportNumber(request.getPassportNumber())));
        }
        if (request.getNationality() != null) guest.setNationality(request.getNationality().trim());
        if (request.getDateOfBirth() != null) guest.setDateOfBirth(request.getDateOfBirth());
        if (request.getGender() != null) guest.setGender(request.getGender().trim());
        if (request.getPassportExpiry() != null) guest.setPassportExpiry(request.getPassportExpiry());
        guest.deriveFullName();
        guest.setPassportVerified(verified);

        guestRepository.save(guest);
        aggregator.recompute(guest.getBooking().getId());
        log.info("Passport corrected for guest {} by {} ({}), status {}",
                guestId, caller.getUserId(), grant, guest.getTm30Status());
        return guestMapper.toResponse(guest);
    }

    @Transactional(readOnly = true)
    public GuestPassportResponse getGuestPassport(UUID guestId, Tm30Caller caller) {
        BookingGuest guest = guestRepository.findWithBookingById(guestId)
                .orElseThrow(() -> new GuestNotFoundException(guestId));
        accessPolicy.checkOwnerOrOperator(guest.getBooking(), caller);
        return guestMapper.toResponse(guest);
    }

    private GuestPassportResponse applyScan(UUID guestId, String imageUrl, String imagePath,
                                            PassportOcrResult ocr, boolean administrative) {
        BookingGuest guest = guestRepository.findById(guestId)
                .orElseThrow(() -> new GuestNotFoundException(guestId));

        guest.setPassportImageUrl(imageUrl);
        if (imagePath != null) {
            guest.setPassportImagePath(imagePath);
        }
        guest.setOcrProcessedAt(LocalDateTime.now(clock));
        guest.setOcrConfidence(ocr.getConfidence());
        guest.setOcrRawData(ocr.getRawResponse());

        if (ocr.isSuccess()) {
            applyExtractedData(guest, ocr.getData());
            guest.setPassportVerified(false);
            guest.moveTm30StatusTo(GuestTm30Status.SCANNED, administrative);
        } else {
            guest.moveTm30StatusTo(GuestTm30Status.PENDING, administrative);
        }

        guestRepository.save(guest);
        aggregator.recompute(guest.getBooking().getId());
        return guestMapper.toResponse(guest);
    }

    private void applyExtractedData(BookingGuest guest, PassportData data) {
        guest.setFirstName(data.getFirstName());
        guest.setLastName(data.getLastName());
        guest.setFullName(data.getFullName());
        guest.setDateOfBirth(data.getDateOfBirth());
        guest.setNationality(data.getNationality());
        guest.setGender(data.getGender());
        guest.setPassportNumber(data.getPassportNumber() != null
                ? trimToNull(PassportValidationService.normalizePassportNumber(data.getPassportNumber()))
                : null);
        guest.setPassportExpiry(data.getPassportExpiry());
        guest.setPassportIssueDate(data.getPassportIssueDate());
        guest.setPassportCountry(data.getPassportCountry());
        if (!StringUtils.hasText(guest.getFullName())) {
            guest.deriveFullName();
        }
    }

    private UUID findOrCreateGuest(UUID bookingId, int guestNumber, Tm30Caller caller) {
        RentalBooking booking = bookingRepository.findWithPropertyById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        accessPolicy.checkIntakeAccess(booking, caller);

        return booking.findGuest(guestNumber)
                .map(BookingGuest::getId)
                .orElseGet(() -> {
                    BookingGuest guest = BookingGuest.builder()
                            .guestNumber(guestNumber)
                            .guestType(GuestType.forGuestNumber(guestNumber))
                            .build();
                    booking.addGuest(guest);
                    aggregator.refresh(booking);
                    BookingGuest saved = guestRepository.saveAndFlush(guest);
                    log.info("Created guest {} (#{}) on booking {} at first passport upload",
                            saved.getId(), guestNumber, bookingId);
                    return saved.getId();
                });
    }

    static String stripDataUriPrefix(String base64) {
        int separator = base64.indexOf(DATA_URI_SEPARATOR);
        return separator >= 0 ? base64.substring(separator + DATA_URI_SEPARATOR.length()) : base64;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
