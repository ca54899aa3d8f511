package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One accommodation as listed on the immigration portal
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncedAccommodation {

    /**
     * Portal identifier, absent when the portal listing does not show one
     */
    private String portalId;

    private String name;

    private String address;

    private String status;
}
