package com.studiomanagement.booking.service.availability;

import com.studiomanagement.booking.enums.ConflictPolicyType;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.Hall;
import com.studiomanagement.booking.util.DateTimeUtils;
import com.studiomanagement.booking.util.HallUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Slots of the same hall collide when their [start, start + duration) intervals intersect.
 * Intervals live on the local date-time line, so a late booking that runs past midnight
 * also blocks the start of the next day.
 */
public class IntervalOverlapConflictPolicy implements ConflictPolicy {

    @Override
    public ConflictPolicyType type() {
        return ConflictPolicyType.INTERVAL_OVERLAP;
    }

    @Override
    public boolean conflicts(Booking existing, Hall hall, LocalDate date, LocalTime time, int durationHours) {
        if (!HallUtils.sameHallIdentity(existing.getHall(), hall)) {
            return false;
        }
        LocalDateTime start = DateTimeUtils.slotStart(date, time);
        LocalDateTime end = DateTimeUtils.slotEnd(date, time, durationHours);
        return DateTimeUtils.overlaps(existing.startsAt(), existing.endsAt(), start, end);
    }
}
