package com.studiomanagement.booking.controller.v1;

import com.studiomanagement.booking.dto.AvailabilityEntry;
import com.studiomanagement.booking.dto.BookingEntry;
import com.studiomanagement.booking.dto.BookingReport;
import com.studiomanagement.booking.dto.BookingRequest;
import com.studiomanagement.booking.enums.SlotState;
import com.studiomanagement.booking.mapper.BookingMapper;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.service.AvailabilityService;
import com.studiomanagement.booking.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final BookingService bookingService;
    private final AvailabilityService availabilityService;
    private final BookingMapper bookingMapper;

    @PostMapping
    public ResponseEntity<BookingEntry> admit(@Valid @RequestBody BookingRequest request) {
        log.info("POST /v1/bookings - client={}, hall={}, date={}, time={}",
                request.getClientId(), request.getHallNumber(), request.getDate(), request.getStartTime());

        Booking booking = bookingService.admit(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(bookingMapper.toEntry(booking));
    }

    @GetMapping
    public ResponseEntity<List<BookingEntry>> list() {
        log.debug("GET /v1/bookings");
        return ResponseEntity.ok(bookingMapper.toEntries(bookingService.list()));
    }

    @GetMapping("/by-date")
    public ResponseEntity<Map<LocalDate, List<BookingEntry>>> listByDate() {
        log.debug("GET /v1/bookings/by-date");
        return ResponseEntity.ok(bookingMapper.toGroupedEntries(bookingService.listGroupedByDate()));
    }

    @GetMapping("/client/{clientId}")
    public ResponseEntity<List<BookingEntry>> findByClient(@PathVariable String clientId) {
        log.debug("GET /v1/bookings/client/{}", clientId);
        return ResponseEntity.ok(bookingMapper.toEntries(bookingService.findByClient(clientId)));
    }

    @DeleteMapping("/client/{clientId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String clientId) {
        log.info("DELETE /v1/bookings/client/{}", clientId);

        int removed = bookingService.cancel(clientId);
        return ResponseEntity.ok(Map.of(
                "status", "CANCELLED",
                "clientId", clientId,
                "removed", removed
        ));
    }

    @GetMapping("/availability")
    public ResponseEntity<AvailabilityEntry> availability(
            @RequestParam int hallNumber,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(pattern = "HH:mm") LocalTime time,
            @RequestParam(defaultValue = "1") int durationHours) {

        log.debug("GET /v1/bookings/availability - hall={}, date={}, time={}", hallNumber, date, time);

        SlotState state = bookingService.checkAvailability(hallNumber, date, time, durationHours);
        return ResponseEntity.ok(AvailabilityEntry.builder()
                .hallNumber(hallNumber)
                .date(date)
                .startTime(time)
                .durationHours(durationHours)
                .state(state.name())
                .policy(availabilityService.policyType().name())
                .build());
    }

    @GetMapping("/report")
    public ResponseEntity<BookingReport> report() {
        log.debug("GET /v1/bookings/report");
        return ResponseEntity.ok(bookingService.report());
    }
}
