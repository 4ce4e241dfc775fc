package com.studiomanagement.booking.service;

import com.studiomanagement.booking.enums.ConflictPolicyType;
import com.studiomanagement.booking.enums.SlotState;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.Hall;
import com.studiomanagement.booking.service.availability.ConflictPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.Optional;

/**
 * Answers whether a slot is free given a set of existing bookings. Holds no bookings itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AvailabilityService {

    private final ConflictPolicy conflictPolicy;

    public boolean isAvailable(Collection<Booking> existingBookings, Hall hall,
                               LocalDate date, LocalTime time, int durationHours) {
        return findConflict(existingBookings, hall, date, time, durationHours).isEmpty();
    }

    public SlotState slotState(Collection<Booking> existingBookings, Hall hall,
                               LocalDate date, LocalTime time, int durationHours) {
        return isAvailable(existingBookings, hall, date, time, durationHours) ? SlotState.FREE : SlotState.BOOKED;
    }

    /**
     * First booking, in iteration order, that the candidate slot would collide with.
     */
    public Optional<Booking> findConflict(Collection<Booking> existingBookings, Hall hall,
                                          LocalDate date, LocalTime time, int durationHours) {
        Optional<Booking> conflict = existingBookings.stream()
                .filter(existing -> conflictPolicy.conflicts(existing, hall, date, time, durationHours))
                .findFirst();
        conflict.ifPresent(b -> log.debug("Slot hall={} {} {} collides with booking {}",
                hall.getNumber(), date, time, b.getBookingId()));
        return conflict;
    }

    public ConflictPolicyType policyType() {
        return conflictPolicy.type();
    }
}
