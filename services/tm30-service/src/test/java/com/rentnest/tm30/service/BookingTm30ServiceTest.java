package com.rentnest.tm30.service;

import com.rentnest.tm30.TestDataBuilder;
import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.dto.BookingTm30StatusResponse;
import com.rentnest.tm30.dto.PendingSubmissionResponse;
import com.rentnest.tm30.entity.BookingTm30Status;
import com.rentnest.tm30.entity.GuestType;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.exception.BookingNotFoundException;
import com.rentnest.tm30.exception.Tm30AccessDeniedException;
import com.rentnest.tm30.mapper.RentalBookingMapper;
import com.rentnest.tm30.repository.RentalBookingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingTm30Service Unit Tests")
class BookingTm30ServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T23:00:00Z");

    @Mock
    private RentalBookingRepository bookingRepository;

    @Mock
    private Tm30StatusAggregator aggregator;

    @Mock
    private RentalBookingMapper bookingMapper;

    private BookingTm30Service bookingService;

    private RentalBooking booking;

    @BeforeEach
    void setUp() {
        Tm30Properties properties = new Tm30Properties();
        bookingService = new BookingTm30Service(bookingRepository, aggregator, new Tm30AccessPolicy(properties),
                bookingMapper, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        booking = TestDataBuilder.createTestBooking();
        lenient().when(bookingRepository.findWithPropertyById(booking.getId())).thenReturn(Optional.of(booking));
    }

    @Test
    @DisplayName("Registering guests twice creates each row only once")
    void shouldRegisterGuestsIdempotently() {
        when(bookingRepository.save(booking)).thenReturn(booking);
        when(bookingMapper.toStatusResponse(booking)).thenReturn(new BookingTm30StatusResponse());

        bookingService.registerGuests(booking.getId(), 3, TestDataBuilder.createOwnerCaller());
        bookingService.registerGuests(booking.getId(), 3, TestDataBuilder.createOwnerCaller());

        assertThat(booking.getTotalGuests()).isEqualTo(3);
        assertThat(booking.findGuest(1).orElseThrow().getGuestType()).isEqualTo(GuestType.PRIMARY);
        assertThat(booking.findGuest(3).orElseThrow().getGuestType()).isEqualTo(GuestType.ADDITIONAL);
        verify(aggregator, times(2)).refresh(booking);
    }

    @Test
    void shouldKeepExistingGuestsWhenRegistering() {
        TestDataBuilder.createScannedGuest(booking, 1);
        when(bookingRepository.save(booking)).thenReturn(booking);

        bookingService.registerGuests(booking.getId(), 2, TestDataBuilder.createOwnerCaller());

        assertThat(booking.findGuest(1).orElseThrow().getPassportNumber()).isEqualTo("AB12345671");
        assertThat(booking.getTotalGuests()).isEqualTo(2);
    }

    @Test
    void shouldHideStatusFromStrangers() {
        assertThatThrownBy(() -> bookingService.getBookingStatus(booking.getId(), TestDataBuilder.createStrangerCaller()))
                .isInstanceOf(Tm30AccessDeniedException.class);
    }

    @Test
    void shouldFailForUnknownBooking() {
        UUID unknown = UUID.randomUUID();
        when(bookingRepository.findWithPropertyById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookingService.getBookingStatus(unknown, TestDataBuilder.createOwnerCaller()))
                .isInstanceOf(BookingNotFoundException.class);
    }

    @Test
    void retryIsOperatorOnly() {
        assertThatThrownBy(() -> bookingService.retryFailed(booking.getId(), TestDataBuilder.createOwnerCaller()))
                .isInstanceOf(Tm30AccessDeniedException.class);
        verifyNoInteractions(aggregator);
    }

    @Test
    void operatorRetryDelegatesToAggregator() {
        when(aggregator.retryFailed(booking.getId())).thenReturn(booking);

        bookingService.retryFailed(booking.getId(), TestDataBuilder.createOperatorCaller());

        verify(bookingMapper).toStatusResponse(booking);
    }

    @Test
    @DisplayName("Pending view covers now until the end of the last Bangkok day")
    void shouldQueryPendingWindow() {
        when(bookingRepository.findPendingSubmissions(any(), any(), any())).thenReturn(List.of(booking));
        when(bookingMapper.toPendingBooking(booking)).thenReturn(new PendingSubmissionResponse.PendingBooking());

        PendingSubmissionResponse response = bookingService.pendingSubmissions(1, TestDataBuilder.createOperatorCaller());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<BookingTm30Status>> statuses = ArgumentCaptor.forClass(Collection.class);
        verify(bookingRepository).findPendingSubmissions(eq(NOW),
                eq(Instant.parse("2025-03-03T16:59:59.999Z")), statuses.capture());
        assertThat(statuses.getValue()).containsExactlyInAnyOrder(BookingTm30Status.PENDING, BookingTm30Status.FAILED);
        assertThat(response.getTotal()).isEqualTo(1);
    }
}
