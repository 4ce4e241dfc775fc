package com.studiomanagement.booking.exception;

import com.studiomanagement.booking.constants.ErrorCodes;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Thrown when an admission collides with a booking already held for the hall.
 */
@Getter
public class HallNotAvailableException extends StudioException {

    private final int hallNumber;
    private final LocalDate date;
    private final LocalTime time;

    public HallNotAvailableException(int hallNumber, LocalDate date, LocalTime time) {
        super(ErrorCodes.HALL_NOT_AVAILABLE,
                "Hall " + hallNumber + " is not available on " + date + " at " + time);
        this.hallNumber = hallNumber;
        this.date = date;
        this.time = time;
    }
}
