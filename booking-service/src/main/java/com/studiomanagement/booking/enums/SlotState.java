package com.studiomanagement.booking.enums;

public enum SlotState {
    FREE,
    BOOKED
}
