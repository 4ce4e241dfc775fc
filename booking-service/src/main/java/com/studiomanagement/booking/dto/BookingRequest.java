package com.studiomanagement.booking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.studiomanagement.booking.constants.BookingConstants;
import com.studiomanagement.booking.constants.ValidationMessages;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingRequest {

    @NotBlank(message = ValidationMessages.CLIENT_ID_REQUIRED)
    String clientId;

    @NotNull(message = ValidationMessages.HALL_NUMBER_REQUIRED)
    Integer hallNumber;

    @Builder.Default
    List<String> equipmentNames = new ArrayList<>();

    @NotNull(message = ValidationMessages.DATE_REQUIRED)
    LocalDate date;

    @NotNull(message = ValidationMessages.START_TIME_REQUIRED)
    @JsonFormat(pattern = "HH:mm")
    LocalTime startTime;

    @NotNull(message = ValidationMessages.DURATION_REQUIRED)
    @Min(value = BookingConstants.DEFAULT_MIN_DURATION_HOURS, message = ValidationMessages.DURATION_MIN)
    Integer durationHours;
}
