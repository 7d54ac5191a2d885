package com.postq.internal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SendThrottleTest {

    @Test
    void shouldSpaceConsecutiveSends() throws Exception {
        SendThrottle throttle = new SendThrottle(50);

        long start = System.nanoTime();
        throttle.acquire();
        throttle.acquire();
        throttle.acquire();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(elapsedMs).isGreaterThanOrEqualTo(95);
    }

    @Test
    void shouldNotWaitWithoutAMinimumDelay() throws Exception {
        SendThrottle throttle = new SendThrottle(0);

        long start = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            throttle.acquire();
        }

        assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(50);
    }
}
