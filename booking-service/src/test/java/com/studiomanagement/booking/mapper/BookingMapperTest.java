package com.studiomanagement.booking.mapper;

import com.studiomanagement.booking.dto.BookingEntry;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.Client;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BookingMapper Unit Tests")
class BookingMapperTest {

    private final BookingMapper bookingMapper = new BookingMapper();

    @Test
    @DisplayName("Should round cost half-up to two places and derive the end time")
    void toEntry() {
        Client client = Client.builder()
                .clientId("CL1234ABCD")
                .firstName("Anna")
                .lastName("Petrova")
                .phone("89001234567")
                .build();
        EquipmentItem lighting = EquipmentItem.builder().name("Lighting").hourlyRate(new BigDecimal("500")).build();
        Booking booking = Booking.builder()
                .bookingId("BKABCD1234")
                .client(client)
                .hall(Hall.builder().number(1).hourlyRate(new BigDecimal("33.33")).capacity(4).build())
                .equipment(new LinkedHashSet<>(List.of(lighting)))
                .date(LocalDate.of(2025, 2, 10))
                .startTime(LocalTime.of(23, 0))
                .durationHours(2)
                .cost(new BigDecimal("30.9969"))
                .createdAt(LocalDateTime.now())
                .build();

        BookingEntry entry = bookingMapper.toEntry(booking);

        assertThat(entry.getCost()).isEqualTo(new BigDecimal("31.00"));
        assertThat(entry.getEndTime()).isEqualTo(LocalTime.of(1, 0));
        assertThat(entry.getClientName()).isEqualTo("Anna Petrova");
        assertThat(entry.getEquipment()).containsExactly("Lighting");
        assertThat(booking.getCost()).isEqualTo(new BigDecimal("30.9969"));
    }
}
