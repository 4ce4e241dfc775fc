package com.studiomanagement.booking.service;

import com.studiomanagement.booking.constants.BookingConstants;
import com.studiomanagement.booking.service.lock.LockOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process lock per resource, waiting at most the configured timeout.
 */
@Service
@Slf4j
public class HallLockService implements LockOperations {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long waitTimeoutMs;

    public HallLockService(
            @Value("${booking.lock.wait-timeout-ms:" + BookingConstants.DEFAULT_LOCK_WAIT_TIMEOUT_MS + "}") long waitTimeoutMs) {
        this.waitTimeoutMs = waitTimeoutMs;
    }

    @Override
    public <T> T executeWithLock(String resourceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(resourceId, id -> new ReentrantLock(true));

        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Lock acquisition interrupted: resource={}", resourceId);
            throw new LockAcquisitionException("Interrupted while waiting for lock: " + resourceId);
        }

        if (!acquired) {
            log.warn("Failed to acquire lock within timeout: resource={}, waitTimeout={}ms",
                    resourceId, waitTimeoutMs);
            throw new LockAcquisitionException("Failed to acquire lock for: " + resourceId);
        }

        log.debug("Acquired lock: resource={}", resourceId);
        try {
            return action.get();
        } finally {
            lock.unlock();
            log.debug("Released lock: resource={}", resourceId);
        }
    }
}
