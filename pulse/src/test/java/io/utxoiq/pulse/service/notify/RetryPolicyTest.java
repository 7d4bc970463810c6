package io.utxoiq.pulse.service.notify;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Max delay cap
 * - Attempt bound
 * - Builder validation
 */
class RetryPolicyTest {

    @Test
    void testExponentialBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(5))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();

        assertEquals(Duration.ofSeconds(1), policy.delayAfter(1), "First retry waits the initial delay");
        assertEquals(Duration.ofSeconds(2), policy.delayAfter(2), "Second retry doubles");
        assertEquals(Duration.ofSeconds(4), policy.delayAfter(3), "Third retry doubles again");
        assertEquals(Duration.ZERO, policy.delayAfter(0), "No attempt made, no delay");
    }

    @Test
    void testMaxDelayRespected() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(3.0)
            .maxAttempts(10)
            .build();

        assertEquals(Duration.ofSeconds(10), policy.delayAfter(1));
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(2), "10 * 3 hits the cap");
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(3), "Still capped");
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(50), "No overflow for large attempt counts");
    }

    @Test
    void testAttemptsAreBounded() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        assertTrue(policy.shouldRetry(1), "Retry after first failure");
        assertTrue(policy.shouldRetry(2), "Retry after second failure");
        assertFalse(policy.shouldRetry(3), "Third attempt was the last");
    }

    @Test
    void testConstantDelayWithMultiplierOne() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(250))
            .multiplier(1.0)
            .build();

        assertEquals(Duration.ofMillis(250), policy.delayAfter(1));
        assertEquals(Duration.ofMillis(250), policy.delayAfter(4));
    }

    @Test
    void testDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.getMaxAttempts());
        assertEquals(Duration.ofMillis(500), policy.getInitialDelay());
        assertEquals(Duration.ofSeconds(30), policy.getMaxDelay());
        assertEquals(2.0, policy.getMultiplier());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            RetryPolicy.builder().initialDelay(Duration.ZERO).build());

        assertThrows(IllegalArgumentException.class, () ->
            RetryPolicy.builder().initialDelay(Duration.ofSeconds(-1)).build());

        assertThrows(IllegalArgumentException.class, () ->
            RetryPolicy.builder().multiplier(0.5).build());

        assertThrows(IllegalArgumentException.class, () ->
            RetryPolicy.builder().maxAttempts(0).build());

        assertThrows(IllegalArgumentException.class, () ->
            RetryPolicy.builder().maxAttempts(Integer.MAX_VALUE).build(), "Unbounded retry is rejected");

        assertThrows(IllegalArgumentException.class, () ->
            RetryPolicy.builder()
                .initialDelay(Duration.ofMinutes(10))
                .maxDelay(Duration.ofMinutes(5))
                .build());
    }
}
