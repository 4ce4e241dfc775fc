package com.studiomanagement.booking.model;

import com.studiomanagement.booking.enums.EquipmentCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Add-on billed per hour alongside the hall. Identified by its name.
 */
@Value
@Builder(toBuilder = true)
public class EquipmentItem {

    String name;
    BigDecimal hourlyRate;

    @Builder.Default
    EquipmentCategory category = EquipmentCategory.OTHER;

    String description;
}
