package com.studiomanagement.booking.service;

import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.constants.ValidationMessages;
import com.studiomanagement.booking.exception.StudioValidationException;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Cost of renting a hall with add-ons. Pure and exact: no rounding is applied, so the same
 * inputs always give the same {@link BigDecimal}.
 */
@Service
@Slf4j
public class PricingService {

    private static final int FULL_PERCENT = 100;

    /**
     * (hall rate * hours + sum of add-on rates * hours) * (1 - discount / 100)
     */
    public BigDecimal computeCost(Hall hall, Collection<EquipmentItem> equipment,
                                  int durationHours, int discountPercent) {
        if (hall == null) {
            throw new StudioValidationException(ValidationMessages.HALL_REQUIRED);
        }
        if (durationHours < 0) {
            throw new StudioValidationException(ErrorCodes.INVALID_DURATION, ValidationMessages.DURATION_NON_NEGATIVE);
        }
        if (discountPercent < 0 || discountPercent > FULL_PERCENT) {
            throw new StudioValidationException(ErrorCodes.INVALID_DISCOUNT, ValidationMessages.DISCOUNT_PERCENT_RANGE);
        }

        BigDecimal hours = BigDecimal.valueOf(durationHours);
        BigDecimal subtotal = hall.getHourlyRate().multiply(hours);
        if (equipment != null) {
            for (EquipmentItem item : equipment) {
                subtotal = subtotal.add(item.getHourlyRate().multiply(hours));
            }
        }

        BigDecimal cost = applyDiscount(subtotal, discountPercent);
        log.debug("Computed cost: hall={}, addOns={}, hours={}, discount={}%, cost={}",
                hall.getNumber(), equipment == null ? 0 : equipment.size(), durationHours, discountPercent, cost);
        return cost;
    }

    /**
     * amount * (100 - discount) / 100, exact.
     */
    private BigDecimal applyDiscount(BigDecimal amount, int discountPercent) {
        return amount.multiply(BigDecimal.valueOf(FULL_PERCENT - discountPercent)).movePointLeft(2);
    }
}
