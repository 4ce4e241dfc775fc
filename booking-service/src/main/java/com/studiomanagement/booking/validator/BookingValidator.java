package com.studiomanagement.booking.validator;

import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.constants.ValidationMessages;
import com.studiomanagement.booking.dto.BookingRequest;
import com.studiomanagement.booking.exception.StudioValidationException;
import org.springframework.util.StringUtils;

import java.time.LocalTime;

public final class BookingValidator {

    private BookingValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateRequest(BookingRequest request, int minDurationHours, int maxDurationHours) {
        if (request == null) {
            throw new StudioValidationException(ErrorCodes.INVALID_REQUEST, ValidationMessages.BOOKING_REQUEST_REQUIRED);
        }
        if (!StringUtils.hasText(request.getClientId())) {
            throw new StudioValidationException(ErrorCodes.UNKNOWN_CLIENT, ValidationMessages.CLIENT_ID_REQUIRED);
        }
        if (request.getHallNumber() == null) {
            throw new StudioValidationException(ErrorCodes.UNKNOWN_HALL, ValidationMessages.HALL_NUMBER_REQUIRED);
        }
        if (request.getDate() == null) {
            throw new StudioValidationException(ErrorCodes.INVALID_DATE, ValidationMessages.DATE_REQUIRED);
        }
        validateStartTime(request.getStartTime());
        validateDuration(request.getDurationHours(), minDurationHours, maxDurationHours);
    }

    public static void validateStartTime(LocalTime startTime) {
        if (startTime == null) {
            throw new StudioValidationException(ErrorCodes.INVALID_TIME, ValidationMessages.START_TIME_REQUIRED);
        }
        if (startTime.getSecond() != 0 || startTime.getNano() != 0) {
            throw new StudioValidationException(ErrorCodes.INVALID_TIME, ValidationMessages.START_TIME_MINUTE_PRECISION);
        }
    }

    public static void validateDuration(Integer durationHours, int minDurationHours, int maxDurationHours) {
        if (durationHours == null) {
            throw new StudioValidationException(ErrorCodes.INVALID_DURATION, ValidationMessages.DURATION_REQUIRED);
        }
        if (durationHours < minDurationHours || durationHours > maxDurationHours) {
            throw new StudioValidationException(ErrorCodes.INVALID_DURATION,
                    String.format(ValidationMessages.DURATION_OUT_OF_RANGE, minDurationHours, maxDurationHours));
        }
    }

    /**
     * The duration bound must be a closed, positive range.
     */
    public static void validateDurationBounds(int minDurationHours, int maxDurationHours) {
        if (minDurationHours < 1 || maxDurationHours < minDurationHours) {
            throw new IllegalArgumentException("Invalid duration bounds: [" + minDurationHours
                    + ", " + maxDurationHours + "]");
        }
    }
}
