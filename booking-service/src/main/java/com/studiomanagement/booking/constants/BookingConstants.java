package com.studiomanagement.booking.constants;

public final class BookingConstants {

    private BookingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Duration Bounds ==========

    public static final int DEFAULT_MIN_DURATION_HOURS = 1;
    public static final int DEFAULT_MAX_DURATION_HOURS = 8;

    // ========== Client Rules ==========

    public static final int MIN_DISCOUNT_PERCENT = 0;
    public static final int MAX_DISCOUNT_PERCENT = 30;
    public static final int PHONE_LENGTH = 11;

    // ========== Pricing ==========

    public static final int PRESENTATION_SCALE = 2;

    // ========== Locking ==========

    public static final long DEFAULT_LOCK_WAIT_TIMEOUT_MS = 5000;
    public static final String HALL_LOCK_PREFIX = "hall:";

    // ========== ID Generation ==========

    public static final String BOOKING_ID_PREFIX = "BK";
    public static final String CLIENT_ID_PREFIX = "CL";
}
