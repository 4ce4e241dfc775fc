package com.studiomanagement.booking.mapper;

import com.studiomanagement.booking.constants.BookingConstants;
import com.studiomanagement.booking.dto.BookingEntry;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.EquipmentItem;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts ledger bookings to their wire form. Costs are rounded here and only here.
 */
@Component
public class BookingMapper {

    public BookingEntry toEntry(Booking booking) {
        if (booking == null) {
            return null;
        }

        return BookingEntry.builder()
                .bookingId(booking.getBookingId())
                .clientId(booking.getClient().getClientId())
                .clientName(booking.getClient().getFullName())
                .hallNumber(booking.getHall().getNumber())
                .equipment(booking.getEquipment().stream()
                        .map(EquipmentItem::getName)
                        .collect(Collectors.toList()))
                .date(booking.getDate())
                .startTime(booking.getStartTime())
                .endTime(booking.endsAt().toLocalTime())
                .durationHours(booking.getDurationHours())
                .cost(booking.getCost().setScale(BookingConstants.PRESENTATION_SCALE, RoundingMode.HALF_UP))
                .createdAt(booking.getCreatedAt())
                .build();
    }

    public List<BookingEntry> toEntries(List<Booking> bookings) {
        return bookings.stream().map(this::toEntry).collect(Collectors.toList());
    }

    public Map<LocalDate, List<BookingEntry>> toGroupedEntries(Map<LocalDate, List<Booking>> grouped) {
        Map<LocalDate, List<BookingEntry>> result = new LinkedHashMap<>();
        grouped.forEach((date, bookings) -> result.put(date, toEntries(bookings)));
        return result;
    }
}
