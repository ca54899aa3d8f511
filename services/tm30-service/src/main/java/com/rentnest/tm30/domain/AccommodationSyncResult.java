package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccommodationSyncResult {

    private int created;

    private int updated;

    private int skipped;

    public int getTotal() {
        return created + updated;
    }
}
