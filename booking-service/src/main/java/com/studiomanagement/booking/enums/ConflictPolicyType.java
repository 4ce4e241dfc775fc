package com.studiomanagement.booking.enums;

/**
 * How two bookings of the same hall are judged to collide.
 */
public enum ConflictPolicyType {
    /** Conflict only when hall, date and start time are identical. */
    EXACT_MATCH,
    /** Conflict when the [start, start + duration) intervals intersect. */
    INTERVAL_OVERLAP
}
