package com.studiomanagement.booking.util;

import com.studiomanagement.booking.model.Hall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HallUtils Unit Tests")
class HallUtilsTest {

    private final Hall hall1 = Hall.builder().number(1).hourlyRate(new BigDecimal("2000")).capacity(10).build();
    private final Hall hall2 = Hall.builder().number(2).hourlyRate(new BigDecimal("1500.50")).capacity(6).build();

    @Test
    @DisplayName("combineRates should sum hourly rates")
    void combineRates() {
        assertThat(HallUtils.combineRates(hall1, hall2)).isEqualByComparingTo("3500.50");
    }

    @Test
    @DisplayName("sameHallIdentity should compare numbers only")
    void sameHallIdentity() {
        Hall repriced = Hall.builder().number(1).hourlyRate(new BigDecimal("9999")).capacity(1).build();

        assertThat(HallUtils.sameHallIdentity(hall1, repriced)).isTrue();
        assertThat(HallUtils.sameHallIdentity(hall1, hall2)).isFalse();
        assertThat(HallUtils.sameHallIdentity(hall1, null)).isFalse();
    }
}
