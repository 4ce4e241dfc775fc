package com.studiomanagement.booking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AvailabilityEntry {

    Integer hallNumber;
    LocalDate date;

    @JsonFormat(pattern = "HH:mm")
    LocalTime startTime;

    Integer durationHours;
    String state;
    String policy;
}
