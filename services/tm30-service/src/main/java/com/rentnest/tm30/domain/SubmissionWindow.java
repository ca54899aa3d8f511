package com.rentnest.tm30.domain;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * One calendar day in a given zone, as an inclusive instant range
 * (00:00:00.000 to 23:59:59.999 local time)
 */
public record SubmissionWindow(LocalDate date, Instant start, Instant end) {

    public static SubmissionWindow today(Clock clock, ZoneId zone) {
        LocalDate date = LocalDate.now(clock.withZone(zone));
        return forDate(date, zone);
    }

    public static SubmissionWindow forDate(LocalDate date, ZoneId zone) {
        Instant start = date.atStartOfDay(zone).toInstant();
        Instant end = date.plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1);
        return new SubmissionWindow(date, start, end);
    }
}
