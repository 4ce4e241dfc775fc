package com.studiomanagement.booking.dto;

import com.studiomanagement.booking.constants.ValidationMessages;
import com.studiomanagement.booking.enums.EquipmentCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class EquipmentEntry {

    @NotBlank(message = ValidationMessages.EQUIPMENT_NAME_REQUIRED)
    String name;

    @NotNull(message = ValidationMessages.RATE_REQUIRED)
    @DecimalMin(value = "0.0", message = ValidationMessages.RATE_NON_NEGATIVE)
    BigDecimal hourlyRate;

    EquipmentCategory category;
    String description;
}
