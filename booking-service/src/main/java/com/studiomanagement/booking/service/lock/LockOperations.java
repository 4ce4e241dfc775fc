package com.studiomanagement.booking.service.lock;

import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.exception.StudioException;

import java.util.function.Supplier;

/**
 * Mutual exclusion around a named resource. Admission uses it to make
 * "check availability, then insert" a single step per hall.
 */
public interface LockOperations {

    /**
     * Executes action while holding the lock on a single resource.
     *
     * @param resourceId Resource to lock
     * @param action Action to execute while holding lock
     * @return Result of action
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    <T> T executeWithLock(String resourceId, Supplier<T> action);

    class LockAcquisitionException extends StudioException {
        public LockAcquisitionException(String message) {
            super(ErrorCodes.LOCK_TIMEOUT, message, true);
        }
    }
}
