package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location of a passport image after upload to blob storage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredImage {

    /**
     * Public URL, becomes the guest's canonical passport image URL
     */
    private String url;

    /**
     * Storage-internal path
     */
    private String path;
}
