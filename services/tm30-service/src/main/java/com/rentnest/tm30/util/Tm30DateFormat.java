package com.rentnest.tm30.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Date rendering for TM30 filings: DD/MM/YYYY, zero padded, in Thailand local time
 */
public final class Tm30DateFormat {

    public static final ZoneId THAILAND = ZoneId.of("Asia/Bangkok");

    private static final DateTimeFormatter WIRE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private Tm30DateFormat() {
    }

    /**
     * Example: 2025-03-01T23:30:00Z → 02/03/2025
     */
    public static String format(Instant instant, ZoneId zone) {
        if (instant == null) {
            return "";
        }
        return WIRE_FORMAT.format(instant.atZone(zone));
    }

    public static String format(Instant instant) {
        return format(instant, THAILAND);
    }

    public static String format(LocalDate date) {
        return date == null ? "" : WIRE_FORMAT.format(date);
    }
}
