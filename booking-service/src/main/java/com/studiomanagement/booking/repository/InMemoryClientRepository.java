package com.studiomanagement.booking.repository;

import com.studiomanagement.booking.model.Client;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-lifetime client store keeping registration order.
 */
@Repository
@Slf4j
public class InMemoryClientRepository implements ClientRepository {

    private final Map<String, Client> clientsById = Collections.synchronizedMap(new LinkedHashMap<>());

    @Override
    public Client save(Client client) {
        log.debug("Saving client: id={}", client.getClientId());
        clientsById.put(client.getClientId(), client);
        return client;
    }

    @Override
    public Optional<Client> findById(String clientId) {
        return Optional.ofNullable(clientsById.get(clientId));
    }

    @Override
    public List<Client> findAll() {
        synchronized (clientsById) {
            return Collections.unmodifiableList(new ArrayList<>(clientsById.values()));
        }
    }
}
