package com.studiomanagement.booking.dto;

import com.studiomanagement.booking.constants.ValidationMessages;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class HallEntry {

    @NotNull(message = ValidationMessages.HALL_NUMBER_REQUIRED)
    @Min(value = 1, message = ValidationMessages.HALL_NUMBER_POSITIVE)
    Integer number;

    @NotNull(message = ValidationMessages.RATE_REQUIRED)
    @DecimalMin(value = "0.0", message = ValidationMessages.RATE_NON_NEGATIVE)
    BigDecimal hourlyRate;

    @NotNull(message = ValidationMessages.HALL_CAPACITY_POSITIVE)
    @Min(value = 1, message = ValidationMessages.HALL_CAPACITY_POSITIVE)
    Integer capacity;
}
