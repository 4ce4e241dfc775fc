package com.studiomanagement.booking.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Set;

/**
 * A granted slot. Created only by the ledger's admission step and never edited afterwards;
 * cancellation removes it.
 */
@Value
@Builder
public class Booking {

    String bookingId;
    Client client;
    Hall hall;
    Set<EquipmentItem> equipment;
    LocalDate date;
    LocalTime startTime;
    int durationHours;
    BigDecimal cost;
    LocalDateTime createdAt;

    public LocalDateTime startsAt() {
        return date.atTime(startTime);
    }

    public LocalDateTime endsAt() {
        return startsAt().plusHours(durationHours);
    }
}
