package com.studiomanagement.booking.service;

import com.studiomanagement.booking.enums.ConflictPolicyType;
import com.studiomanagement.booking.enums.SlotState;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.Hall;
import com.studiomanagement.booking.service.availability.ConflictPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AvailabilityService Unit Tests")
class AvailabilityServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 2, 10);
    private static final LocalTime TIME = LocalTime.of(15, 0);

    @Mock
    private ConflictPolicy conflictPolicy;

    @Mock
    private Booking first;

    @Mock
    private Booking second;

    private AvailabilityService availabilityService;
    private Hall hall;

    @BeforeEach
    void setUp() {
        availabilityService = new AvailabilityService(conflictPolicy);
        hall = Hall.builder().number(1).hourlyRate(new BigDecimal("2000")).capacity(10).build();
        when(first.getBookingId()).thenReturn("BK00000001");
        when(second.getBookingId()).thenReturn("BK00000002");
        when(conflictPolicy.type()).thenReturn(ConflictPolicyType.INTERVAL_OVERLAP);
    }

    @Test
    @DisplayName("Should report FREE for an empty ledger")
    void emptyLedger() {
        assertThat(availabilityService.isAvailable(List.of(), hall, DATE, TIME, 2)).isTrue();
        assertThat(availabilityService.slotState(List.of(), hall, DATE, TIME, 2)).isEqualTo(SlotState.FREE);
        verifyNoInteractions(conflictPolicy);
    }

    @Test
    @DisplayName("Should report BOOKED when the policy finds a conflict")
    void conflictFound() {
        when(conflictPolicy.conflicts(eq(first), any(), any(), any(), anyInt())).thenReturn(false);
        when(conflictPolicy.conflicts(eq(second), any(), any(), any(), anyInt())).thenReturn(true);

        assertThat(availabilityService.slotState(List.of(first, second), hall, DATE, TIME, 2))
                .isEqualTo(SlotState.BOOKED);
        assertThat(availabilityService.findConflict(List.of(first, second), hall, DATE, TIME, 2))
                .contains(second);
    }

    @Test
    @DisplayName("Should return the first conflict in iteration order")
    void firstConflict() {
        when(conflictPolicy.conflicts(any(), any(), any(), any(), anyInt())).thenReturn(true);

        assertThat(availabilityService.findConflict(List.of(first, second), hall, DATE, TIME, 1))
                .contains(first);
    }

    @Test
    @DisplayName("Should expose the configured policy type")
    void policyType() {
        assertThat(availabilityService.policyType()).isEqualTo(ConflictPolicyType.INTERVAL_OVERLAP);
    }
}
