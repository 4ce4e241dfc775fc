package com.studiomanagement.booking.service;

import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.service.lock.LockOperations.LockAcquisitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HallLockService Unit Tests")
class HallLockServiceTest {

    @Test
    @DisplayName("Should run the action and return its result")
    void runsAction() {
        HallLockService lockService = new HallLockService(100);

        assertThat(lockService.executeWithLock("hall:1", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("Should release the lock when the action throws")
    void releasesOnFailure() {
        HallLockService lockService = new HallLockService(100);

        assertThatThrownBy(() -> lockService.executeWithLock("hall:1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lockService.executeWithLock("hall:1", () -> "again")).isEqualTo("again");
    }

    @Test
    @DisplayName("Should time out with a retryable error while another thread holds the lock")
    void timesOut() throws Exception {
        HallLockService lockService = new HallLockService(50);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<String> holder = executor.submit(() -> lockService.executeWithLock("hall:1", () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "done";
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> lockService.executeWithLock("hall:1", () -> "blocked"))
                    .isInstanceOf(LockAcquisitionException.class)
                    .satisfies(ex -> {
                        LockAcquisitionException e = (LockAcquisitionException) ex;
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCodes.LOCK_TIMEOUT);
                        assertThat(e.isRetryable()).isTrue();
                    });
            assertThat(lockService.executeWithLock("hall:2", () -> "other hall")).isEqualTo("other hall");

            release.countDown();
            assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("done");
        } finally {
            executor.shutdownNow();
        }
    }
}
