package com.rentnest.tm30.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * TM30 accommodation fields of a property after a link or unlink
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccommodationLinkResponse {

    private UUID propertyId;
    private String propertyTitle;
    private String tm30AccommodationId;
    private String tm30AccommodationName;
    private String message;
}
