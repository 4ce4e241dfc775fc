package com.studiomanagement.booking.controller.v1;

import com.studiomanagement.booking.dto.EquipmentEntry;
import com.studiomanagement.booking.dto.HallEntry;
import com.studiomanagement.booking.mapper.CatalogMapper;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import com.studiomanagement.booking.service.BookingService;
import com.studiomanagement.booking.service.CatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/catalog")
@RequiredArgsConstructor
@Slf4j
public class CatalogController {

    private final CatalogService catalogService;
    private final BookingService bookingService;
    private final CatalogMapper catalogMapper;

    @GetMapping("/halls")
    public ResponseEntity<List<HallEntry>> listHalls() {
        log.debug("GET /v1/catalog/halls");
        return ResponseEntity.ok(catalogMapper.toHallEntries(catalogService.listHalls()));
    }

    @PostMapping("/halls")
    public ResponseEntity<HallEntry> registerHall(@Valid @RequestBody HallEntry request) {
        log.info("POST /v1/catalog/halls - number={}", request.getNumber());
        Hall hall = catalogService.registerHall(catalogMapper.toHall(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogMapper.toEntry(hall));
    }

    @GetMapping("/halls/most-expensive")
    public ResponseEntity<HallEntry> mostExpensiveHall() {
        log.debug("GET /v1/catalog/halls/most-expensive");
        return ResponseEntity.ok(catalogMapper.toEntry(bookingService.findMostExpensiveHall()));
    }

    @GetMapping("/equipment")
    public ResponseEntity<List<EquipmentEntry>> listEquipment() {
        log.debug("GET /v1/catalog/equipment");
        return ResponseEntity.ok(catalogMapper.toEquipmentEntries(catalogService.listEquipment()));
    }

    @PostMapping("/equipment")
    public ResponseEntity<EquipmentEntry> registerEquipment(@Valid @RequestBody EquipmentEntry request) {
        log.info("POST /v1/catalog/equipment - name={}", request.getName());
        EquipmentItem item = catalogService.registerEquipment(catalogMapper.toEquipment(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogMapper.toEntry(item));
    }
}
