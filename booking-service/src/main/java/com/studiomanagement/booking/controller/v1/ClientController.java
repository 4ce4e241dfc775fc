package com.studiomanagement.booking.controller.v1;

import com.studiomanagement.booking.dto.ClientEntry;
import com.studiomanagement.booking.dto.ClientRequest;
import com.studiomanagement.booking.dto.DiscountRequest;
import com.studiomanagement.booking.dto.PhoneUpdateRequest;
import com.studiomanagement.booking.mapper.ClientMapper;
import com.studiomanagement.booking.model.Client;
import com.studiomanagement.booking.service.ClientService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/clients")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ClientController {

    ClientService clientService;
    ClientMapper clientMapper;

    @PostMapping
    public ResponseEntity<ClientEntry> addClient(@Valid @RequestBody ClientRequest request) {
        log.info("POST /v1/clients - name={} {}", request.getFirstName(), request.getLastName());

        Client client = clientService.addClient(request.getFirstName(), request.getLastName(),
                request.getPhone(), request.getDiscountPercent());
        return ResponseEntity.status(HttpStatus.CREATED).body(clientMapper.toEntry(client));
    }

    @GetMapping
    public ResponseEntity<List<ClientEntry>> list() {
        log.debug("GET /v1/clients");
        return ResponseEntity.ok(clientMapper.toEntries(clientService.list()));
    }

    @GetMapping("/{clientId}")
    public ResponseEntity<ClientEntry> findById(@PathVariable String clientId) {
        log.debug("GET /v1/clients/{}", clientId);
        return ResponseEntity.ok(clientMapper.toEntry(clientService.findById(clientId)));
    }

    @PutMapping("/{clientId}/phone")
    public ResponseEntity<ClientEntry> updatePhone(@PathVariable String clientId,
                                                   @Valid @RequestBody PhoneUpdateRequest request) {
        log.info("PUT /v1/clients/{}/phone", clientId);
        return ResponseEntity.ok(clientMapper.toEntry(clientService.updatePhone(clientId, request.getPhone())));
    }

    @PutMapping("/{clientId}/discount")
    public ResponseEntity<ClientEntry> applyDiscount(@PathVariable String clientId,
                                                     @Valid @RequestBody DiscountRequest request) {
        log.info("PUT /v1/clients/{}/discount - discount={}", clientId, request.getDiscountPercent());
        return ResponseEntity.ok(clientMapper.toEntry(
                clientService.applyDiscount(clientId, request.getDiscountPercent())));
    }
}
