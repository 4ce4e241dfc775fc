package com.studiomanagement.booking.exception;

import com.studiomanagement.booking.constants.ErrorCodes;

/**
 * Thrown for malformed input: empty required fields, out-of-range discounts or durations,
 * malformed phones and references to things the catalog does not hold.
 */
public class StudioValidationException extends StudioException {

    public StudioValidationException(String message) {
        super(ErrorCodes.VALIDATION_ERROR, message);
    }

    public StudioValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
