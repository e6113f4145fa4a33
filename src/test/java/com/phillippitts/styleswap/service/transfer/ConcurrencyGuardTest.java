package com.phillippitts.styleswap.service.transfer;

import com.phillippitts.styleswap.exception.ResourceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGuardTest {

    @Test
    void shouldAcquireAndReleasePermit() {
        ConcurrencyGuard guard = new ConcurrencyGuard(2, 100);

        guard.acquire();
        assertThat(guard.availablePermits()).isEqualTo(1);

        guard.release();
        assertThat(guard.availablePermits()).isEqualTo(2);
    }

    @Test
    void shouldTimeOutWhenNoPermitFreesUp() {
        ConcurrencyGuard guard = new ConcurrencyGuard(1, 20);
        guard.acquire();

        assertThatThrownBy(guard::acquire)
                .isInstanceOf(ResourceException.class)
                .hasMessageContaining("concurrency limit reached after 20ms");
    }

    @Test
    void shouldRestoreInterruptFlagWhenInterrupted() {
        ConcurrencyGuard guard = new ConcurrencyGuard(1, 5_000);
        guard.acquire();
        Thread.currentThread().interrupt();

        try {
            assertThatThrownBy(guard::acquire)
                    .isInstanceOf(ResourceException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldRejectNonPositivePermits() {
        assertThatThrownBy(() -> new ConcurrencyGuard(0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
