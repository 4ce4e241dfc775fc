package com.studiomanagement.booking.service;

import com.studiomanagement.booking.config.CatalogProperties;
import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.dto.EquipmentEntry;
import com.studiomanagement.booking.dto.HallEntry;
import com.studiomanagement.booking.enums.EquipmentCategory;
import com.studiomanagement.booking.exception.StudioValidationException;
import com.studiomanagement.booking.mapper.CatalogMapper;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CatalogService Unit Tests")
class CatalogServiceTest {

    private CatalogProperties catalogProperties;
    private CatalogService catalogService;

    @BeforeEach
    void setUp() {
        catalogProperties = new CatalogProperties();
        catalogService = new CatalogService(catalogProperties, new CatalogMapper());
    }

    @Nested
    @DisplayName("Halls")
    class HallTests {

        @Test
        @DisplayName("Should list halls in registration order")
        void registrationOrder() {
            Hall second = hall(2, "2500");
            Hall first = hall(1, "2000");
            catalogService.registerHall(second);
            catalogService.registerHall(first);

            assertThat(catalogService.listHalls()).containsExactly(second, first);
            assertThat(catalogService.findHall(1)).contains(first);
            assertThat(catalogService.findHall(3)).isEmpty();
        }

        @Test
        @DisplayName("Should reject a duplicate hall number")
        void duplicate() {
            catalogService.registerHall(hall(1, "2000"));

            assertThatThrownBy(() -> catalogService.registerHall(hall(1, "3000")))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.DUPLICATE_HALL);
            assertThat(catalogService.listHalls()).hasSize(1);
        }

        @Test
        @DisplayName("Should reject negative rate and zero capacity")
        void invalidHall() {
            assertThatThrownBy(() -> catalogService.registerHall(hall(1, "-1")))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.INVALID_RATE);
            assertThatThrownBy(() -> catalogService.registerHall(
                    Hall.builder().number(1).hourlyRate(BigDecimal.TEN).capacity(0).build()))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.INVALID_CAPACITY);
            assertThatThrownBy(() -> catalogService.registerHall(null))
                    .isInstanceOf(StudioValidationException.class);
        }

        @Test
        @DisplayName("Should return snapshots that callers cannot modify")
        void immutableSnapshot() {
            catalogService.registerHall(hall(1, "2000"));
            List<Hall> snapshot = catalogService.listHalls();

            catalogService.registerHall(hall(2, "2500"));

            assertThat(snapshot).hasSize(1);
            assertThatThrownBy(() -> snapshot.add(hall(3, "100")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Equipment")
    class EquipmentTests {

        @Test
        @DisplayName("Should find equipment by trimmed name")
        void findByName() {
            EquipmentItem item = EquipmentItem.builder().name("Lighting").hourlyRate(new BigDecimal("500")).build();
            catalogService.registerEquipment(item);

            assertThat(catalogService.findEquipment(" Lighting ")).contains(item);
            assertThat(catalogService.findEquipment(null)).isEmpty();
            assertThat(item.getCategory()).isEqualTo(EquipmentCategory.OTHER);
        }

        @Test
        @DisplayName("Should store padded names trimmed so lookup and duplicate checks agree")
        void paddedNames() {
            catalogService.registerEquipment(EquipmentItem.builder().name("Lighting").hourlyRate(BigDecimal.ONE).build());
            EquipmentItem fog = catalogService.registerEquipment(
                    EquipmentItem.builder().name(" Fog ").hourlyRate(BigDecimal.TEN)
                            .category(EquipmentCategory.PROPS).build());

            assertThatThrownBy(() -> catalogService.registerEquipment(
                    EquipmentItem.builder().name("Lighting ").hourlyRate(BigDecimal.TEN).build()))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.DUPLICATE_EQUIPMENT);

            assertThat(fog.getName()).isEqualTo("Fog");
            assertThat(fog.getCategory()).isEqualTo(EquipmentCategory.PROPS);
            assertThat(catalogService.findEquipment(" Fog")).contains(fog);
            assertThat(catalogService.findEquipment("Fog")).contains(fog);
            assertThat(catalogService.listEquipment()).extracting(EquipmentItem::getName)
                    .containsExactly("Lighting", "Fog");
        }

        @Test
        @DisplayName("Should reject duplicate and blank names")
        void invalidEquipment() {
            catalogService.registerEquipment(EquipmentItem.builder().name("Lighting").hourlyRate(BigDecimal.ONE).build());

            assertThatThrownBy(() -> catalogService.registerEquipment(
                    EquipmentItem.builder().name("Lighting").hourlyRate(BigDecimal.TEN).build()))
                    .isInstanceOf(StudioValidationException.class)
                    .extracting("errorCode").isEqualTo(ErrorCodes.DUPLICATE_EQUIPMENT);
            assertThatThrownBy(() -> catalogService.registerEquipment(
                    EquipmentItem.builder().name("  ").hourlyRate(BigDecimal.TEN).build()))
                    .isInstanceOf(StudioValidationException.class);
        }
    }

    @Nested
    @DisplayName("initialize()")
    class InitializeTests {

        @Test
        @DisplayName("Should seed halls and equipment from configuration")
        void seedsFromProperties() {
            catalogProperties.setHalls(List.of(
                    HallEntry.builder().number(1).hourlyRate(new BigDecimal("2000")).capacity(10).build()));
            catalogProperties.setEquipment(List.of(
                    EquipmentEntry.builder().name("White backdrop").hourlyRate(new BigDecimal("200"))
                            .category(EquipmentCategory.BACKDROP).description("Seamless paper").build()));

            catalogService.initialize();

            assertThat(catalogService.listHalls()).extracting(Hall::getNumber).containsExactly(1);
            assertThat(catalogService.findEquipment("White backdrop"))
                    .get()
                    .extracting(EquipmentItem::getCategory)
                    .isEqualTo(EquipmentCategory.BACKDROP);
        }

        @Test
        @DisplayName("Should fail startup on a duplicate seeded hall")
        void duplicateSeed() {
            HallEntry entry = HallEntry.builder().number(1).hourlyRate(new BigDecimal("2000")).capacity(10).build();
            catalogProperties.setHalls(List.of(entry, entry));

            assertThatThrownBy(() -> catalogService.initialize())
                    .isInstanceOf(StudioValidationException.class);
        }
    }

    private Hall hall(int number, String rate) {
        return Hall.builder().number(number).hourlyRate(new BigDecimal(rate)).capacity(10).build();
    }
}
