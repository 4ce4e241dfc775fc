package com.studiomanagement.booking.service;

import com.studiomanagement.booking.exception.ClientNotFoundException;
import com.studiomanagement.booking.model.Client;
import com.studiomanagement.booking.repository.ClientRepository;
import com.studiomanagement.booking.util.IdGenerator;
import com.studiomanagement.booking.validator.ClientValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Client registry: identity, contact phone and personal discount.
 * Mutations are serialized; a rejected update leaves the record as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientService {

    private final ClientRepository clientRepository;
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();

    public Client addClient(String firstName, String lastName, String phone, int discountPercent) {
        ClientValidator.validateNewClient(firstName, lastName, phone, discountPercent);

        Client client = Client.builder()
                .clientId(IdGenerator.generateClientId())
                .firstName(firstName.trim())
                .lastName(lastName.trim())
                .phone(phone.trim())
                .discountPercent(discountPercent)
                .createdAt(LocalDateTime.now())
                .build();

        registryLock.writeLock().lock();
        try {
            clientRepository.save(client);
        } finally {
            registryLock.writeLock().unlock();
        }

        if (!ClientValidator.isValidPhone(client.getPhone())) {
            log.warn("Client registered with a phone that will not pass validation: id={}", client.getClientId());
        }
        log.info("Registered client: id={}, name={}, discount={}%",
                client.getClientId(), client.getFullName(), discountPercent);
        return client;
    }

    public Client updatePhone(String clientId, String newPhone) {
        registryLock.writeLock().lock();
        try {
            Client client = findOrThrow(clientId);
            client.updatePhone(newPhone);
            log.info("Updated phone: client={}", clientId);
            return client;
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    public Client applyDiscount(String clientId, int amount) {
        registryLock.writeLock().lock();
        try {
            Client client = findOrThrow(clientId);
            client.applyDiscount(amount);
            log.info("Applied discount: client={}, discount={}%", clientId, amount);
            return client;
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    /**
     * True when the client's stored phone is exactly eleven digits.
     */
    public boolean validatePhone(Client client) {
        return client != null && ClientValidator.isValidPhone(client.getPhone());
    }

    public Client findById(String clientId) {
        registryLock.readLock().lock();
        try {
            return findOrThrow(clientId);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public Optional<Client> find(String clientId) {
        registryLock.readLock().lock();
        try {
            return clientRepository.findById(clientId);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public List<Client> list() {
        registryLock.readLock().lock();
        try {
            return clientRepository.findAll();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    private Client findOrThrow(String clientId) {
        return clientRepository.findById(clientId)
                .orElseThrow(() -> ClientNotFoundException.notRegistered(clientId));
    }
}
