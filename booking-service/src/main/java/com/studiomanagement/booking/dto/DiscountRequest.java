package com.studiomanagement.booking.dto;

import com.studiomanagement.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class DiscountRequest {

    // range is checked by the registry so the REST and in-process paths reject alike
    @NotNull(message = ValidationMessages.DISCOUNT_REQUIRED)
    Integer discountPercent;
}
