package com.studiomanagement.booking.service;

import com.studiomanagement.booking.config.CatalogProperties;
import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.constants.ValidationMessages;
import com.studiomanagement.booking.exception.StudioValidationException;
import com.studiomanagement.booking.mapper.CatalogMapper;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import com.studiomanagement.booking.validator.CatalogValidator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of bookable halls and add-on equipment. Filled during setup, read-mostly afterwards.
 */
@Service
@Slf4j
public class CatalogService {

    private final CatalogProperties catalogProperties;
    private final CatalogMapper catalogMapper;

    private final Map<Integer, Hall> halls;
    private final Map<String, EquipmentItem> equipment;
    private final ReadWriteLock catalogLock;

    public CatalogService(CatalogProperties catalogProperties, CatalogMapper catalogMapper) {
        this.catalogProperties = catalogProperties;
        this.catalogMapper = catalogMapper;
        this.halls = new LinkedHashMap<>();
        this.equipment = new LinkedHashMap<>();
        this.catalogLock = new ReentrantReadWriteLock();
    }

    @PostConstruct
    void initialize() {
        catalogProperties.getHalls().forEach(entry -> registerHall(catalogMapper.toHall(entry)));
        catalogProperties.getEquipment().forEach(entry -> registerEquipment(catalogMapper.toEquipment(entry)));
        log.info("Catalog initialized: {} halls, {} equipment items", halls.size(), equipment.size());
    }

    // ========== Registration ==========

    public Hall registerHall(Hall hall) {
        CatalogValidator.validateHall(hall);

        catalogLock.writeLock().lock();
        try {
            if (halls.containsKey(hall.getNumber())) {
                throw new StudioValidationException(ErrorCodes.DUPLICATE_HALL,
                        String.format(ValidationMessages.HALL_ALREADY_EXISTS, hall.getNumber()));
            }
            halls.put(hall.getNumber(), hall);
        } finally {
            catalogLock.writeLock().unlock();
        }

        log.info("Registered hall: number={}, rate={}, capacity={}",
                hall.getNumber(), hall.getHourlyRate(), hall.getCapacity());
        return hall;
    }

    /**
     * Registers an add-on under its trimmed name, the same key {@link #findEquipment(String)} uses.
     */
    public EquipmentItem registerEquipment(EquipmentItem equipmentItem) {
        CatalogValidator.validateEquipment(equipmentItem);
        EquipmentItem item = equipmentItem.toBuilder().name(equipmentItem.getName().trim()).build();

        catalogLock.writeLock().lock();
        try {
            if (equipment.containsKey(item.getName())) {
                throw new StudioValidationException(ErrorCodes.DUPLICATE_EQUIPMENT,
                        String.format(ValidationMessages.EQUIPMENT_ALREADY_EXISTS, item.getName()));
            }
            equipment.put(item.getName(), item);
        } finally {
            catalogLock.writeLock().unlock();
        }

        log.info("Registered equipment: name={}, rate={}, category={}",
                item.getName(), item.getHourlyRate(), item.getCategory());
        return item;
    }

    // ========== Queries ==========

    /**
     * Snapshot of all halls in registration order.
     */
    public List<Hall> listHalls() {
        catalogLock.readLock().lock();
        try {
            return List.copyOf(halls.values());
        } finally {
            catalogLock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all equipment in registration order.
     */
    public List<EquipmentItem> listEquipment() {
        catalogLock.readLock().lock();
        try {
            return List.copyOf(equipment.values());
        } finally {
            catalogLock.readLock().unlock();
        }
    }

    public Optional<Hall> findHall(int number) {
        catalogLock.readLock().lock();
        try {
            return Optional.ofNullable(halls.get(number));
        } finally {
            catalogLock.readLock().unlock();
        }
    }

    public Optional<EquipmentItem> findEquipment(String name) {
        if (name == null) {
            return Optional.empty();
        }
        catalogLock.readLock().lock();
        try {
            return Optional.ofNullable(equipment.get(name.trim()));
        } finally {
            catalogLock.readLock().unlock();
        }
    }
}
