package com.studiomanagement.booking.dto;

import com.studiomanagement.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PhoneUpdateRequest {

    @NotBlank(message = ValidationMessages.PHONE_REQUIRED)
    String phone;
}
