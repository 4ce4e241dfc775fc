package com.studiomanagement.booking.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Booking Request ==========

    public static final String BOOKING_REQUEST_REQUIRED = "Booking request is required";
    public static final String CLIENT_ID_REQUIRED = "Client ID is required";
    public static final String HALL_NUMBER_REQUIRED = "Hall number is required";
    public static final String DATE_REQUIRED = "Date is required";
    public static final String START_TIME_REQUIRED = "Start time is required";
    public static final String START_TIME_MINUTE_PRECISION = "Start time must have minute precision";
    public static final String DURATION_REQUIRED = "Duration is required";
    public static final String DURATION_MIN = "Duration must be at least 1 hour";
    public static final String DURATION_OUT_OF_RANGE = "Duration must be between %d and %d hours";

    // ========== Client ==========

    public static final String FIRST_NAME_REQUIRED = "First name is required";
    public static final String LAST_NAME_REQUIRED = "Last name is required";
    public static final String PHONE_REQUIRED = "Phone is required";
    public static final String PHONE_FORMAT = "Phone must contain exactly 11 digits";
    public static final String DISCOUNT_REQUIRED = "Discount is required";
    public static final String DISCOUNT_RANGE = "Discount must be between 0 and 30 percent";
    public static final String CLIENT_PHONE_INVALID = "Client phone is not a valid 11-digit number: %s";

    // ========== Catalog ==========

    public static final String HALL_REQUIRED = "Hall is required";
    public static final String HALL_NUMBER_POSITIVE = "Hall number must be positive";
    public static final String HALL_CAPACITY_POSITIVE = "Hall capacity must be at least 1";
    public static final String EQUIPMENT_REQUIRED = "Equipment item is required";
    public static final String EQUIPMENT_NAME_REQUIRED = "Equipment name is required";
    public static final String RATE_REQUIRED = "Hourly rate is required";
    public static final String RATE_NON_NEGATIVE = "Hourly rate must be non-negative";
    public static final String HALL_ALREADY_EXISTS = "Hall already exists: %d";
    public static final String EQUIPMENT_ALREADY_EXISTS = "Equipment already exists: %s";
    public static final String UNKNOWN_HALL = "Hall not found in catalog: %d";
    public static final String UNKNOWN_EQUIPMENT = "Equipment not found in catalog: %s";
    public static final String UNKNOWN_CLIENT = "Client is not registered: %s";

    // ========== Pricing ==========

    public static final String DURATION_NON_NEGATIVE = "Duration must be non-negative";
    public static final String DISCOUNT_PERCENT_RANGE = "Discount percent must be between 0 and 100";
}
