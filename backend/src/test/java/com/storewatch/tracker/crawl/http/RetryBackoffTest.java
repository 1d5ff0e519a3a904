package com.storewatch.tracker.crawl.http;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RetryBackoffTest {

    @Test
    void delayDoublesPerAttemptWithJitter() {
        RetryBackoff backoff = new RetryBackoff(1000, 16000, new Random(42));
        for (int i = 0; i < 50; i++) {
            assertThat(backoff.delayForAttempt(1)).isBetween(500L, 999L);
            assertThat(backoff.delayForAttempt(3)).isBetween(2000L, 3999L);
        }
    }

    @Test
    void delayIsCappedAtMaximum() {
        RetryBackoff backoff = new RetryBackoff(1000, 16000, new Random(7));
        for (int i = 0; i < 50; i++) {
            assertThat(backoff.delayForAttempt(20)).isBetween(8000L, 15999L);
        }
    }

    @Test
    void zeroBaseDisablesBackoff() {
        RetryBackoff backoff = new RetryBackoff(0, 16000, new Random(1));
        assertThat(backoff.delayForAttempt(5)).isZero();
    }
}
