package com.rentnest.tm30.provider;

import com.rentnest.tm30.domain.PassportOcrResult;

/**
 * Provider interface for reading passport data from an image
 * Implementations never throw: failures and timeouts come back as an unsuccessful result
 */
public interface PassportOcrProvider {

    /**
     * Scan a passport image
     *
     * @param imageUrl publicly reachable URL of the passport image
     * @return OCR result with extracted fields on success, error message otherwise
     */
    PassportOcrResult scan(String imageUrl);
}
