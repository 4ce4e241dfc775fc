package com.studiomanagement.booking.validator;

import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.constants.ValidationMessages;
import com.studiomanagement.booking.exception.StudioValidationException;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

public final class CatalogValidator {

    private CatalogValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateHall(Hall hall) {
        if (hall == null) {
            throw new StudioValidationException(ValidationMessages.HALL_REQUIRED);
        }
        if (hall.getNumber() <= 0) {
            throw new StudioValidationException(ValidationMessages.HALL_NUMBER_POSITIVE);
        }
        validateRate(hall.getHourlyRate());
        if (hall.getCapacity() < 1) {
            throw new StudioValidationException(ErrorCodes.INVALID_CAPACITY, ValidationMessages.HALL_CAPACITY_POSITIVE);
        }
    }

    public static void validateEquipment(EquipmentItem item) {
        if (item == null) {
            throw new StudioValidationException(ValidationMessages.EQUIPMENT_REQUIRED);
        }
        if (!StringUtils.hasText(item.getName())) {
            throw new StudioValidationException(ValidationMessages.EQUIPMENT_NAME_REQUIRED);
        }
        validateRate(item.getHourlyRate());
    }

    public static void validateRate(BigDecimal rate) {
        if (rate == null) {
            throw new StudioValidationException(ErrorCodes.INVALID_RATE, ValidationMessages.RATE_REQUIRED);
        }
        if (rate.signum() < 0) {
            throw new StudioValidationException(ErrorCodes.INVALID_RATE, ValidationMessages.RATE_NON_NEGATIVE);
        }
    }
}
