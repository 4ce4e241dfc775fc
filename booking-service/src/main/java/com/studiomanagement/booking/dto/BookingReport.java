package com.studiomanagement.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Totals for the reports screen. Revenue figures are unrounded sums of booking costs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingReport {

    long totalBookings;
    BigDecimal totalRevenue;
    Map<Integer, Long> bookingsByHall;
    Map<Integer, BigDecimal> revenueByHall;
}
