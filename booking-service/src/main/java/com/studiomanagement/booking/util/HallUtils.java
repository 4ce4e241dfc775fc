package com.studiomanagement.booking.util;

import com.studiomanagement.booking.model.Hall;

import java.math.BigDecimal;

public final class HallUtils {

    private HallUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Hourly rate of renting both halls together.
     */
    public static BigDecimal combineRates(Hall a, Hall b) {
        return a.getHourlyRate().add(b.getHourlyRate());
    }

    /**
     * Halls are the same bookable resource when their numbers match, whatever their rates.
     */
    public static boolean sameHallIdentity(Hall a, Hall b) {
        if (a == null || b == null) {
            return false;
        }
        return a.getNumber() == b.getNumber();
    }
}
