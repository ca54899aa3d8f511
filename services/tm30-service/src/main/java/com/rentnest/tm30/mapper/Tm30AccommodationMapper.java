package com.rentnest.tm30.mapper;

import com.rentnest.tm30.dto.AccommodationListResponse;
import com.rentnest.tm30.entity.Tm30Accommodation;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface Tm30AccommodationMapper {

    @Mapping(source = "property.id", target = "linkedPropertyId")
    @Mapping(source = "property.title", target = "linkedPropertyTitle")
    AccommodationListResponse.AccommodationView toView(Tm30Accommodation accommodation);

    List<AccommodationListResponse.AccommodationView> toViews(List<Tm30Accommodation> accommodations);
}
