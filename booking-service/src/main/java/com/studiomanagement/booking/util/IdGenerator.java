package com.studiomanagement.booking.util;

import com.studiomanagement.booking.constants.BookingConstants;

import java.util.UUID;

public final class IdGenerator {

    private static final int UUID_SUBSTRING_LENGTH = 8;

    private IdGenerator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String generateBookingId() {
        return BookingConstants.BOOKING_ID_PREFIX + randomSuffix();
    }

    public static String generateClientId() {
        return BookingConstants.CLIENT_ID_PREFIX + randomSuffix();
    }

    private static String randomSuffix() {
        return UUID.randomUUID()
                .toString()
                .replace("-", "")
                .substring(0, UUID_SUBSTRING_LENGTH)
                .toUpperCase();
    }
}
