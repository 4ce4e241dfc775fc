package com.studiomanagement.booking.repository;

import com.studiomanagement.booking.model.Booking;

import java.util.List;

/**
 * Storage for admitted bookings. Lists come back in insertion order.
 */
public interface BookingRepository {

    Booking save(Booking booking);

    List<Booking> findAll();

    List<Booking> findByHallNumber(int hallNumber);

    List<Booking> findByClientId(String clientId);

    /**
     * @return number of bookings removed
     */
    int deleteByClientId(String clientId);

    long count();
}
