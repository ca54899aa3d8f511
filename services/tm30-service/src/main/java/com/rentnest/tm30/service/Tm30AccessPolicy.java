package com.rentnest.tm30.service;

import com.rentnest.tm30.config.Tm30Properties;
import com.rentnest.tm30.domain.AccessGrant;
import com.rentnest.tm30.domain.Tm30Caller;
import com.rentnest.tm30.entity.RentalBooking;
import com.rentnest.tm30.exception.InvalidSharedSecretException;
import com.rentnest.tm30.exception.Tm30AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authorization rules for TM30 operations
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Tm30AccessPolicy {

    private static final String BEARER_PREFIX = "Bearer ";

    private final Tm30Properties properties;

    /**
     * Passport intake: booking owner first, then operators, then the internal service key.
     */
    public AccessGrant checkIntakeAccess(RentalBooking booking, Tm30Caller caller) {
        if (booking.isOwnedBy(caller.getUserId())) {
            return AccessGrant.OWNER;
        }
        if (caller.isOperator()) {
            return AccessGrant.OPERATOR;
        }
        if (caller.getApiKey() != null && secretMatches(properties.getSecurity().getInternalApiKey(), caller.getApiKey())) {
            return AccessGrant.INTERNAL_KEY;
        }
        log.warn("Passport intake denied for booking {} (user {})", booking.getId(), caller.getUserId());
        throw new Tm30AccessDeniedException("Not authorized to upload passports for this booking");
    }

    /**
     * Reads and corrections: booking owner or operators. The internal key is not accepted.
     */
    public AccessGrant checkOwnerOrOperator(RentalBooking booking, Tm30Caller caller) {
        if (booking.isOwnedBy(caller.getUserId())) {
            return AccessGrant.OWNER;
        }
        if (caller.isOperator()) {
            return AccessGrant.OPERATOR;
        }
        log.warn("TM30 access denied for booking {} (user {})", booking.getId(), caller.getUserId());
        throw new Tm30AccessDeniedException("Not authorized to access TM30 data for this booking");
    }

    public void checkOperator(Tm30Caller caller) {
        if (!caller.isOperator()) {
            throw new Tm30AccessDeniedException("Admin or agent role required");
        }
    }

    /**
     * Cron trigger: {@code Authorization: Bearer <cron secret>}. An unset secret rejects every call.
     */
    public void checkCronAuthorization(String authorizationHeader) {
        String presented = authorizationHeader != null && authorizationHeader.startsWith(BEARER_PREFIX)
                ? authorizationHeader.substring(BEARER_PREFIX.length())
                : null;
        if (!secretMatches(properties.getSecurity().getCronSecret(), presented)) {
            log.warn("Rejected cron trigger with invalid or missing secret");
            throw new InvalidSharedSecretException("cron trigger");
        }
    }

    public void checkCallbackSecret(String presentedSecret) {
        if (!secretMatches(properties.getSecurity().getCallbackSecret(), presentedSecret)) {
            log.warn("Rejected TM30 callback with invalid or missing secret");
            throw new InvalidSharedSecretException("status callback");
        }
    }

    /**
     * Constant-time comparison. A blank expected secret never matches.
     */
    static boolean secretMatches(String expected, String presented) {
        if (expected == null || expected.isBlank() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
