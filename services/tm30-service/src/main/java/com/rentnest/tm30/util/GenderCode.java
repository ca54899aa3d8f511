package com.rentnest.tm30.util;

/**
 * Maps free-form gender values onto the single-letter code the immigration form accepts
 */
public final class GenderCode {

    public static final String FEMALE = "F";
    public static final String MALE = "M";

    private GenderCode() {
    }

    /**
     * "F" and "Female" map to F, everything else (including null) to M.
     */
    public static String normalize(String gender) {
        if (FEMALE.equals(gender) || "Female".equals(gender)) {
            return FEMALE;
        }
        return MALE;
    }
}
