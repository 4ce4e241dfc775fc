package com.studiomanagement.booking.validator;

import com.studiomanagement.booking.constants.BookingConstants;
import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.constants.ValidationMessages;
import com.studiomanagement.booking.exception.StudioValidationException;
import org.springframework.util.StringUtils;

public final class ClientValidator {

    private ClientValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Checks the fields a client record needs to exist. Phone format is deliberately not
     * checked: a record may carry a phone that later fails {@link #isValidPhone(String)}.
     */
    public static void validateNewClient(String firstName, String lastName, String phone, int discount) {
        if (!StringUtils.hasText(firstName)) {
            throw new StudioValidationException(ErrorCodes.INVALID_NAME, ValidationMessages.FIRST_NAME_REQUIRED);
        }
        if (!StringUtils.hasText(lastName)) {
            throw new StudioValidationException(ErrorCodes.INVALID_NAME, ValidationMessages.LAST_NAME_REQUIRED);
        }
        if (!StringUtils.hasText(phone)) {
            throw new StudioValidationException(ErrorCodes.INVALID_PHONE, ValidationMessages.PHONE_REQUIRED);
        }
        validateDiscount(discount);
    }

    public static void validatePhoneFormat(String phone) {
        if (!isValidPhone(phone)) {
            throw new StudioValidationException(ErrorCodes.INVALID_PHONE, ValidationMessages.PHONE_FORMAT);
        }
    }

    public static void validateDiscount(int discount) {
        if (!isValidDiscount(discount)) {
            throw new StudioValidationException(ErrorCodes.INVALID_DISCOUNT, ValidationMessages.DISCOUNT_RANGE);
        }
    }

    /**
     * Exactly eleven ASCII digits.
     */
    public static boolean isValidPhone(String phone) {
        if (phone == null || phone.length() != BookingConstants.PHONE_LENGTH) {
            return false;
        }
        for (int i = 0; i < phone.length(); i++) {
            char c = phone.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    public static boolean isValidDiscount(int discount) {
        return discount >= BookingConstants.MIN_DISCOUNT_PERCENT
                && discount <= BookingConstants.MAX_DISCOUNT_PERCENT;
    }
}
