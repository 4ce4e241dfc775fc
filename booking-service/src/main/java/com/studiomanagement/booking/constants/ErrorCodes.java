package com.studiomanagement.booking.constants;

public final class ErrorCodes {

    private ErrorCodes() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INVALID_NAME = "INVALID_NAME";
    public static final String INVALID_PHONE = "INVALID_PHONE";
    public static final String INVALID_DISCOUNT = "INVALID_DISCOUNT";
    public static final String INVALID_DURATION = "INVALID_DURATION";
    public static final String INVALID_DATE = "INVALID_DATE";
    public static final String INVALID_TIME = "INVALID_TIME";
    public static final String INVALID_RATE = "INVALID_RATE";
    public static final String INVALID_CAPACITY = "INVALID_CAPACITY";
    public static final String UNKNOWN_HALL = "UNKNOWN_HALL";
    public static final String UNKNOWN_EQUIPMENT = "UNKNOWN_EQUIPMENT";
    public static final String UNKNOWN_CLIENT = "UNKNOWN_CLIENT";
    public static final String DUPLICATE_HALL = "DUPLICATE_HALL";
    public static final String DUPLICATE_EQUIPMENT = "DUPLICATE_EQUIPMENT";

    public static final String HALL_NOT_AVAILABLE = "HALL_NOT_AVAILABLE";
    public static final String CLIENT_NOT_FOUND = "CLIENT_NOT_FOUND";
    public static final String NO_HALLS = "NO_HALLS";
    public static final String LOCK_TIMEOUT = "LOCK_TIMEOUT";
}
