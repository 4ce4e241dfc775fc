package com.studiomanagement.booking.mapper;

import com.studiomanagement.booking.dto.EquipmentEntry;
import com.studiomanagement.booking.dto.HallEntry;
import com.studiomanagement.booking.enums.EquipmentCategory;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class CatalogMapper {

    public Hall toHall(HallEntry entry) {
        if (entry == null) {
            return null;
        }
        return Hall.builder()
                .number(entry.getNumber() != null ? entry.getNumber() : 0)
                .hourlyRate(entry.getHourlyRate())
                .capacity(entry.getCapacity() != null ? entry.getCapacity() : 0)
                .build();
    }

    public EquipmentItem toEquipment(EquipmentEntry entry) {
        if (entry == null) {
            return null;
        }
        return EquipmentItem.builder()
                .name(entry.getName() != null ? entry.getName().trim() : null)
                .hourlyRate(entry.getHourlyRate())
                .category(entry.getCategory() != null ? entry.getCategory() : EquipmentCategory.OTHER)
                .description(entry.getDescription())
                .build();
    }

    public HallEntry toEntry(Hall hall) {
        return HallEntry.builder()
                .number(hall.getNumber())
                .hourlyRate(hall.getHourlyRate())
                .capacity(hall.getCapacity())
                .build();
    }

    public EquipmentEntry toEntry(EquipmentItem item) {
        return EquipmentEntry.builder()
                .name(item.getName())
                .hourlyRate(item.getHourlyRate())
                .category(item.getCategory())
                .description(item.getDescription())
                .build();
    }

    public List<HallEntry> toHallEntries(List<Hall> halls) {
        return halls.stream().map(this::toEntry).collect(Collectors.toList());
    }

    public List<EquipmentEntry> toEquipmentEntries(List<EquipmentItem> items) {
        return items.stream().map(this::toEntry).collect(Collectors.toList());
    }
}
