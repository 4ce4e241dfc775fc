package com.studiomanagement.booking.exception;

import com.studiomanagement.booking.constants.ErrorCodes;
import lombok.Getter;

/**
 * Thrown when a client lookup or a cancellation matches nothing.
 */
@Getter
public class ClientNotFoundException extends StudioException {

    private final String clientId;

    public ClientNotFoundException(String clientId, String message) {
        super(ErrorCodes.CLIENT_NOT_FOUND, message);
        this.clientId = clientId;
    }

    public static ClientNotFoundException notRegistered(String clientId) {
        return new ClientNotFoundException(clientId, "Client not found: " + clientId);
    }

    public static ClientNotFoundException noBookings(String clientId) {
        return new ClientNotFoundException(clientId, "No bookings found for client: " + clientId);
    }
}
