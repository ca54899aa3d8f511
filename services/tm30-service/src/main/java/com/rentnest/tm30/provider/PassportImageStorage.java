package com.rentnest.tm30.provider;

import com.rentnest.tm30.domain.StoredImage;
import com.rentnest.tm30.exception.ImageStorageException;

/**
 * Provider interface for storing passport images in blob storage
 */
public interface PassportImageStorage {

    /**
     * Upload an inline image
     *
     * @param base64Content image bytes, base64 encoded
     * @param fileName target file name
     * @param folder target folder, e.g. {@code /passports/{bookingId}}
     * @param mimeType content type declared by the caller, may be null
     * @return public URL and internal path of the stored file
     * @throws ImageStorageException when the upload fails
     */
    StoredImage upload(String base64Content, String fileName, String folder, String mimeType);
}
