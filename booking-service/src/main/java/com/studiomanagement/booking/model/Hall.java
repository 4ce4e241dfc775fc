package com.studiomanagement.booking.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Hall {

    int number;
    BigDecimal hourlyRate;
    int capacity;

    @Override
    public String toString() {
        return "Hall " + number + ", " + hourlyRate + " per hour, capacity " + capacity;
    }
}
