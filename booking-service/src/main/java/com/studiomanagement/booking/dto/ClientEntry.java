package com.studiomanagement.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ClientEntry {

    String clientId;
    String firstName;
    String lastName;
    String phone;
    boolean phoneValid;
    Integer discountPercent;
    LocalDateTime createdAt;
}
