package com.studiomanagement.booking.service.availability;

import com.studiomanagement.booking.enums.ConflictPolicyType;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.Hall;
import com.studiomanagement.booking.util.HallUtils;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Only an identical (hall, date, start time) triple collides. Overlapping slots with
 * different start times are let through.
 */
public class ExactMatchConflictPolicy implements ConflictPolicy {

    @Override
    public ConflictPolicyType type() {
        return ConflictPolicyType.EXACT_MATCH;
    }

    @Override
    public boolean conflicts(Booking existing, Hall hall, LocalDate date, LocalTime time, int durationHours) {
        return HallUtils.sameHallIdentity(existing.getHall(), hall)
                && existing.getDate().equals(date)
                && existing.getStartTime().equals(time);
    }
}
