package com.example.automation.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BackoffPolicy Tests")
class BackoffPolicyTest {

    private static final Duration BASE = Duration.ofSeconds(1);
    private static final Duration MAX = Duration.ofSeconds(30);

    @Test
    @DisplayName("Should grow linearly with the attempt number")
    void testLinear() {
        assertEquals(Duration.ofSeconds(1), BackoffPolicy.LINEAR.delayFor(1, BASE, MAX));
        assertEquals(Duration.ofSeconds(2), BackoffPolicy.LINEAR.delayFor(2, BASE, MAX));
        assertEquals(Duration.ofSeconds(5), BackoffPolicy.LINEAR.delayFor(5, BASE, MAX));
    }

    @Test
    @DisplayName("Should double with each attempt")
    void testExponential() {
        assertEquals(Duration.ofSeconds(1), BackoffPolicy.EXPONENTIAL.delayFor(1, BASE, MAX));
        assertEquals(Duration.ofSeconds(2), BackoffPolicy.EXPONENTIAL.delayFor(2, BASE, MAX));
        assertEquals(Duration.ofSeconds(16), BackoffPolicy.EXPONENTIAL.delayFor(5, BASE, MAX));
    }

    @Test
    @DisplayName("Should never exceed the maximum delay")
    void testCapped() {
        assertEquals(MAX, BackoffPolicy.LINEAR.delayFor(100, BASE, MAX));
        assertEquals(MAX, BackoffPolicy.EXPONENTIAL.delayFor(6, BASE, MAX));
        assertEquals(MAX, BackoffPolicy.EXPONENTIAL.delayFor(1000, BASE, MAX));
    }

    @Test
    @DisplayName("Should be non-decreasing across attempts")
    void testMonotonic() {
        for (BackoffPolicy policy : BackoffPolicy.values()) {
            Duration previous = Duration.ZERO;
            for (int attempt = 1; attempt <= 50; attempt++) {
                Duration delay = policy.delayFor(attempt, BASE, MAX);
                assertTrue(delay.compareTo(previous) >= 0, policy + " decreased at attempt " + attempt);
                previous = delay;
            }
        }
    }

    @Test
    @DisplayName("Should reject attempt numbers below one")
    void testInvalidAttempt() {
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.LINEAR.delayFor(0, BASE, MAX));
    }
}
