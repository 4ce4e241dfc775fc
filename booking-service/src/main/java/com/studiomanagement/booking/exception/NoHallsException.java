package com.studiomanagement.booking.exception;

import com.studiomanagement.booking.constants.ErrorCodes;

public class NoHallsException extends StudioException {

    public NoHallsException() {
        super(ErrorCodes.NO_HALLS, "No halls are registered in the catalog");
    }
}
