package com.studiomanagement.booking.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

public final class DateTimeUtils {

    private DateTimeUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static LocalDateTime slotStart(LocalDate date, LocalTime time) {
        return date.atTime(time);
    }

    public static LocalDateTime slotEnd(LocalDate date, LocalTime time, int durationHours) {
        return slotStart(date, time).plusHours(durationHours);
    }

    /**
     * Half-open interval test: [s1, e1) and [s2, e2) share at least one instant.
     */
    public static boolean overlaps(LocalDateTime s1, LocalDateTime e1, LocalDateTime s2, LocalDateTime e2) {
        return s1.isBefore(e2) && s2.isBefore(e1);
    }
}
