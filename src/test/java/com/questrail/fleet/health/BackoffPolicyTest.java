package com.questrail.fleet.health;

import com.questrail.fleet.config.FleetSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    private final BackoffPolicy defaults = BackoffPolicy.from(FleetSettings.defaults());

    @Test
    void defaultDelaysDoubleFromTwoSeconds() {
        long[] expected = {2, 4, 8, 16, 32};
        for (int attempt = 1; attempt <= expected.length; attempt++) {
            assertEquals(Duration.ofSeconds(expected[attempt - 1]), defaults.delayBefore(attempt), "attempt " + attempt);
        }
    }

    @Test
    void delayIsCappedAtMaximum() {
        assertEquals(Duration.ofSeconds(60), defaults.delayBefore(6));
        assertEquals(Duration.ofSeconds(60), defaults.delayBefore(500));
    }

    @Test
    void budgetIsSpentAfterMaxAttempts() {
        assertFalse(defaults.exhausted(4));
        assertTrue(defaults.exhausted(5));
    }

    @Test
    void rejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> defaults.delayBefore(0));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0));
    }
}
