package com.keystone.core.recovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffStrategyTest {

    @Test
    @DisplayName("Fixed backoff is constant")
    void fixed() {
        var backoff = new BackoffStrategy.Fixed(Duration.ofMillis(250));

        assertEquals(Duration.ofMillis(250), backoff.delay(0));
        assertEquals(Duration.ofMillis(250), backoff.delay(5));
        assertEquals(Duration.ofMillis(250), backoff.max());
    }

    @Test
    @DisplayName("Exponential backoff doubles and is capped")
    void exponential() {
        var backoff = new BackoffStrategy.Exponential(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(1), backoff.delay(0));
        assertEquals(Duration.ofSeconds(2), backoff.delay(1));
        assertEquals(Duration.ofSeconds(4), backoff.delay(2));
        assertEquals(Duration.ofSeconds(5), backoff.delay(3));
        assertEquals(Duration.ofSeconds(5), backoff.delay(40));
    }

    @Test
    @DisplayName("Linear backoff adds the increment and is capped")
    void linear() {
        var backoff = new BackoffStrategy.Linear(Duration.ofMillis(500), Duration.ofMillis(500), Duration.ofMillis(1200));

        assertEquals(Duration.ofMillis(500), backoff.delay(0));
        assertEquals(Duration.ofMillis(1000), backoff.delay(1));
        assertEquals(Duration.ofMillis(1200), backoff.delay(2));
    }

    @Test
    @DisplayName("Invalid parameters are rejected")
    void invalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffStrategy.Exponential(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(5)));
        assertThrows(IllegalArgumentException.class, () -> new BackoffStrategy.Fixed(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> new RecoveryPolicy(-1,
                new BackoffStrategy.Fixed(Duration.ZERO), FallbackAction.abort()));
    }

    @Test
    @DisplayName("USE_ALTERNATE needs an alternate id")
    void alternateNeedsId() {
        assertThrows(IllegalArgumentException.class, () -> new FallbackAction(FallbackType.USE_ALTERNATE, null));
        assertEquals("USE_ALTERNATE(B2)", FallbackAction.useAlternate("B2").toString());
    }
}
