package com.studiomanagement.booking.config;

import com.studiomanagement.booking.enums.ConflictPolicyType;
import com.studiomanagement.booking.service.availability.ConflictPolicy;
import com.studiomanagement.booking.service.availability.ExactMatchConflictPolicy;
import com.studiomanagement.booking.service.availability.IntervalOverlapConflictPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class AvailabilityConfiguration {

    @Bean
    public ConflictPolicy conflictPolicy(
            @Value("${booking.conflict-policy:INTERVAL_OVERLAP}") ConflictPolicyType type) {
        log.info("Using conflict policy: {}", type);
        return switch (type) {
            case EXACT_MATCH -> new ExactMatchConflictPolicy();
            case INTERVAL_OVERLAP -> new IntervalOverlapConflictPolicy();
        };
    }
}
