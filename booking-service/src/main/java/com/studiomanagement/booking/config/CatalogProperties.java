package com.studiomanagement.booking.config;

import com.studiomanagement.booking.dto.EquipmentEntry;
import com.studiomanagement.booking.dto.HallEntry;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Halls and equipment registered when the service starts.
 */
@Data
@ConfigurationProperties(prefix = "studio.catalog")
public class CatalogProperties {

    private List<HallEntry> halls = new ArrayList<>();
    private List<EquipmentEntry> equipment = new ArrayList<>();
}
