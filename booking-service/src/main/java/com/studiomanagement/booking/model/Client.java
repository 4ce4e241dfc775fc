package com.studiomanagement.booking.model;

import com.studiomanagement.booking.validator.ClientValidator;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * A studio client. Bookings hold a reference to the record, so equality is identity.
 * Phone and discount change only through the guarded mutators below.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Client {

    final String clientId;
    final String firstName;
    final String lastName;
    volatile String phone;
    volatile int discountPercent;
    final LocalDateTime createdAt;

    public String getFullName() {
        return firstName + " " + lastName;
    }

    public void updatePhone(String newPhone) {
        ClientValidator.validatePhoneFormat(newPhone);
        this.phone = newPhone;
    }

    public void applyDiscount(int amount) {
        ClientValidator.validateDiscount(amount);
        this.discountPercent = amount;
    }
}
