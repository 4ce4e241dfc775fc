package com.studiomanagement.booking.dto;

import com.studiomanagement.booking.constants.BookingConstants;
import com.studiomanagement.booking.constants.ValidationMessages;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ClientRequest {

    @NotBlank(message = ValidationMessages.FIRST_NAME_REQUIRED)
    String firstName;

    @NotBlank(message = ValidationMessages.LAST_NAME_REQUIRED)
    String lastName;

    @NotBlank(message = ValidationMessages.PHONE_REQUIRED)
    String phone;

    @NotNull(message = ValidationMessages.DISCOUNT_REQUIRED)
    @Min(value = BookingConstants.MIN_DISCOUNT_PERCENT, message = ValidationMessages.DISCOUNT_RANGE)
    @Max(value = BookingConstants.MAX_DISCOUNT_PERCENT, message = ValidationMessages.DISCOUNT_RANGE)
    @Builder.Default
    Integer discountPercent = BookingConstants.MIN_DISCOUNT_PERCENT;
}
