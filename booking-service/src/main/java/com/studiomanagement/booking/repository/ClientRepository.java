package com.studiomanagement.booking.repository;

import com.studiomanagement.booking.model.Client;

import java.util.List;
import java.util.Optional;

public interface ClientRepository {

    Client save(Client client);

    Optional<Client> findById(String clientId);

    List<Client> findAll();
}
