package com.federation.application.federation.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Test
    @DisplayName("Should give the first attempt the full timeout and shrink later ones down to the floor")
    void shouldShrinkTimeoutToFloor() {
        // Given
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(15), Duration.ofSeconds(2), Duration.ofSeconds(5),
            new ExponentialBackoff(Duration.ofSeconds(2), Duration.ofSeconds(30), 0.0));

        // Then
        assertEquals(Duration.ofSeconds(15), policy.timeoutFor(1));
        assertEquals(Duration.ofSeconds(13), policy.timeoutFor(2));
        assertEquals(Duration.ofSeconds(11), policy.timeoutFor(3));
        assertEquals(Duration.ofSeconds(7), policy.timeoutFor(5));
        assertEquals(Duration.ofSeconds(5), policy.timeoutFor(6));
        assertEquals(Duration.ofSeconds(5), policy.timeoutFor(9));
    }

    @Test
    @DisplayName("Should require at least one attempt")
    void shouldRequireOneAttempt() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ofSeconds(1),
            Duration.ZERO, Duration.ofSeconds(1), new ExponentialBackoff(Duration.ZERO, Duration.ZERO, 0.0)));
    }
}
