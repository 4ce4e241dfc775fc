package com.studiomanagement.booking.repository;

import com.studiomanagement.booking.model.Booking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-lifetime booking store on a copy-on-write list: reads see a consistent snapshot
 * and every write is atomic without further locking.
 */
@Repository
@Slf4j
public class InMemoryBookingRepository implements BookingRepository {

    private final List<Booking> bookings = new CopyOnWriteArrayList<>();

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: id={}, hall={}", booking.getBookingId(), booking.getHall().getNumber());
        bookings.add(booking);
        return booking;
    }

    @Override
    public List<Booking> findAll() {
        return List.copyOf(bookings);
    }

    @Override
    public List<Booking> findByHallNumber(int hallNumber) {
        return bookings.stream()
                .filter(b -> b.getHall().getNumber() == hallNumber)
                .toList();
    }

    @Override
    public List<Booking> findByClientId(String clientId) {
        return bookings.stream()
                .filter(b -> b.getClient().getClientId().equals(clientId))
                .toList();
    }

    @Override
    public int deleteByClientId(String clientId) {
        AtomicInteger removed = new AtomicInteger();
        bookings.removeIf(b -> {
            boolean match = b.getClient().getClientId().equals(clientId);
            if (match) {
                removed.incrementAndGet();
            }
            return match;
        });
        return removed.get();
    }

    @Override
    public long count() {
        return bookings.size();
    }
}
