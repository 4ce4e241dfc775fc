package com.studiomanagement.booking.service.availability;

import com.studiomanagement.booking.enums.ConflictPolicyType;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.Hall;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Strategy deciding whether a candidate slot collides with one existing booking.
 * Implementations must treat bookings of a different hall as never conflicting.
 */
public interface ConflictPolicy {

    ConflictPolicyType type();

    /**
     * @param existing      a booking already held by the ledger
     * @param hall          hall of the candidate slot
     * @param date          calendar date of the candidate slot
     * @param time          start time of the candidate slot
     * @param durationHours length of the candidate slot
     * @return true when granting the candidate would double-book the hall
     */
    boolean conflicts(Booking existing, Hall hall, LocalDate date, LocalTime time, int durationHours);
}
