package com.rentnest.tm30.mapper;

import com.rentnest.tm30.dto.BookingTm30StatusResponse;
import com.rentnest.tm30.dto.PendingSubmissionResponse;
import com.rentnest.tm30.entity.RentalBooking;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for RentalBooking TM30 views
 */
@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        uses = BookingGuestMapper.class
)
public interface RentalBookingMapper {

    @Mapping(source = "id", target = "bookingId")
    @Mapping(source = "property.title", target = "propertyTitle")
    BookingTm30StatusResponse toStatusResponse(RentalBooking booking);

    @Mapping(source = "id", target = "bookingId")
    @Mapping(source = "property.title", target = "propertyTitle")
    @Mapping(source = "property.tm30AccommodationId", target = "accommodationId")
    @Mapping(target = "guestsReady", expression = "java(booking.getGuests().stream().filter(com.rentnest.tm30.entity.BookingGuest::isEligibleForSubmission).count())")
    PendingSubmissionResponse.PendingBooking toPendingBooking(RentalBooking booking);
}
