package com.studiomanagement.booking.mapper;

import com.studiomanagement.booking.dto.ClientEntry;
import com.studiomanagement.booking.model.Client;
import com.studiomanagement.booking.validator.ClientValidator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class ClientMapper {

    public ClientEntry toEntry(Client client) {
        if (client == null) {
            return null;
        }

        return ClientEntry.builder()
                .clientId(client.getClientId())
                .firstName(client.getFirstName())
                .lastName(client.getLastName())
                .phone(client.getPhone())
                .phoneValid(ClientValidator.isValidPhone(client.getPhone()))
                .discountPercent(client.getDiscountPercent())
                .createdAt(client.getCreatedAt())
                .build();
    }

    public List<ClientEntry> toEntries(List<Client> clients) {
        return clients.stream().map(this::toEntry).collect(Collectors.toList());
    }
}
