package com.rentnest.tm30.util;

import java.util.regex.Pattern;

/**
 * Utility class for masking guest PII in logs
 */
public class DataMaskingUtil {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("([a-zA-Z0-9._%+-]+)@([a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})");
    private static final Pattern PHONE_PATTERN = Pattern.compile("\\+?\\d[\\d\\s-]{6,}(\\d{3})");
    private static final Pattern API_KEY_PATTERN = Pattern.compile("(?i)(api[_-]?key|secret|token)=([^&]+)");

    /**
     * Mask passport numbers, keeping the last three characters
     * Example: AB1234567 → ******567
     */
    public static String maskPassportNumber(String passportNumber) {
        if (passportNumber == null) return null;
        if (passportNumber.length() <= 3) return "***";
        return "*".repeat(passportNumber.length() - 3) + passportNumber.substring(passportNumber.length() - 3);
    }

    /**
     * Mask email addresses
     * Example: john.doe@example.com → j***@example.com
     */
    public static String maskEmail(String text) {
        if (text == null) return null;
        return EMAIL_PATTERN.matcher(text).replaceAll(matchResult ->
                matchResult.group(1).charAt(0) + "***@" + matchResult.group(2));
    }

    /**
     * Mask phone numbers
     * Example: +66 81 234 5678 → ***678
     */
    public static String maskPhone(String text) {
        if (text == null) return null;
        return PHONE_PATTERN.matcher(text).replaceAll("***$1");
    }

    /**
     * Mask credentials passed as query parameters
     * Example: token=abc123 → token=***
     */
    public static String maskCredentials(String text) {
        if (text == null) return null;
        return API_KEY_PATTERN.matcher(text).replaceAll("$1=***");
    }

    public static String maskAll(String text) {
        if (text == null) return null;
        return maskCredentials(maskPhone(maskEmail(text)));
    }
}
