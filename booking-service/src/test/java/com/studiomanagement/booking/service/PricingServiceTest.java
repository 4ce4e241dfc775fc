package com.studiomanagement.booking.service;

import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.exception.StudioValidationException;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PricingService Unit Tests")
class PricingServiceTest {

    private PricingService pricingService;

    private Hall hall;
    private EquipmentItem lighting;

    @BeforeEach
    void setUp() {
        pricingService = new PricingService();
        hall = Hall.builder().number(1).hourlyRate(new BigDecimal("2000")).capacity(10).build();
        lighting = EquipmentItem.builder().name("Lighting").hourlyRate(new BigDecimal("500")).build();
    }

    @Nested
    @DisplayName("computeCost()")
    class ComputeCostTests {

        @Test
        @DisplayName("Should charge the hall rate times duration without add-ons")
        void hallOnly() {
            BigDecimal cost = pricingService.computeCost(hall, List.of(), 2, 0);

            assertThat(cost).isEqualByComparingTo("4000");
        }

        @Test
        @DisplayName("Should add equipment rates for the same duration")
        void withEquipment() {
            BigDecimal cost = pricingService.computeCost(hall, List.of(lighting), 2, 0);

            assertThat(cost).isEqualByComparingTo("5000");
        }

        @Test
        @DisplayName("Should apply the client discount to the whole subtotal")
        void withDiscount() {
            BigDecimal cost = pricingService.computeCost(hall, List.of(lighting), 2, 10);

            assertThat(cost).isEqualByComparingTo("4500.00");
        }

        @Test
        @DisplayName("Should not round fractional results")
        void noRounding() {
            Hall oddHall = Hall.builder().number(2).hourlyRate(new BigDecimal("33.33")).capacity(1).build();

            BigDecimal cost = pricingService.computeCost(oddHall, null, 1, 7);

            assertThat(cost).isEqualByComparingTo("30.9969");
        }

        @Test
        @DisplayName("Should give zero for zero hours")
        void zeroDuration() {
            assertThat(pricingService.computeCost(hall, List.of(lighting), 0, 0)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Should be non-decreasing in duration and equipment, non-increasing in discount")
        void monotonicity() {
            EquipmentItem backdrop = EquipmentItem.builder().name("Backdrop").hourlyRate(new BigDecimal("200")).build();

            BigDecimal previous = BigDecimal.ZERO;
            for (int hours = 1; hours <= 8; hours++) {
                BigDecimal cost = pricingService.computeCost(hall, List.of(lighting), hours, 5);
                assertThat(cost).isGreaterThanOrEqualTo(previous);
                previous = cost;
            }

            BigDecimal none = pricingService.computeCost(hall, List.of(), 3, 5);
            BigDecimal one = pricingService.computeCost(hall, List.of(lighting), 3, 5);
            BigDecimal two = pricingService.computeCost(hall, List.of(lighting, backdrop), 3, 5);
            assertThat(one).isGreaterThanOrEqualTo(none);
            assertThat(two).isGreaterThanOrEqualTo(one);

            previous = pricingService.computeCost(hall, List.of(lighting), 3, 0);
            for (int discount = 1; discount <= 30; discount++) {
                BigDecimal cost = pricingService.computeCost(hall, List.of(lighting), 3, discount);
                assertThat(cost).isLessThanOrEqualTo(previous);
                previous = cost;
            }
        }

        @Test
        @DisplayName("Should never go negative: 100% is free and anything above is rejected")
        void discountCeiling() {
            assertThat(pricingService.computeCost(hall, List.of(lighting), 2, 100)).isEqualByComparingTo("0");

            assertThatThrownBy(() -> pricingService.computeCost(hall, List.of(lighting), 2, 150))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.INVALID_DISCOUNT);
        }

        @Test
        @DisplayName("Should reject invalid inputs")
        void invalidInputs() {
            assertThatThrownBy(() -> pricingService.computeCost(null, List.of(), 1, 0))
                    .isInstanceOf(StudioValidationException.class);

            assertThatThrownBy(() -> pricingService.computeCost(hall, List.of(), -1, 0))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.INVALID_DURATION);

            assertThatThrownBy(() -> pricingService.computeCost(hall, List.of(), 1, 101))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.INVALID_DISCOUNT);
        }
    }
}
