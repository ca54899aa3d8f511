package com.rentnest.tm30.mapper;

import com.rentnest.tm30.dto.GuestPassportResponse;
import com.rentnest.tm30.entity.BookingGuest;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for BookingGuest entity to DTO conversions
 */
@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE
)
public interface BookingGuestMapper {

    @Mapping(source = "booking.id", target = "bookingId")
    GuestPassportResponse toResponse(BookingGuest guest);

    List<GuestPassportResponse> toResponseList(List<BookingGuest> guests);
}
