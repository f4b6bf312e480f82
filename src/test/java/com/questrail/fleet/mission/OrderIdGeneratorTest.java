package com.questrail.fleet.mission;

import com.questrail.fleet.time.MutableWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OrderIdGeneratorTest {

    private final MutableWallClock clock = new MutableWallClock(Instant.parse("2024-05-01T10:15:30.250Z"));

    @Test
    void idsCarryTimestampAndSameSecondSuffix() {
        OrderIdGenerator ids = new OrderIdGenerator("ORDER", clock, ZoneOffset.UTC);

        assertEquals("ORDER-20240501-101530", ids.next());
        assertEquals("ORDER-20240501-101530-2", ids.next());
        assertEquals("ORDER-20240501-101530-3", ids.next());

        clock.advance(Duration.ofSeconds(1));
        assertEquals("ORDER-20240501-101531", ids.next());
    }

    @Test
    void timestampUsesConfiguredZone() {
        OrderIdGenerator ids = new OrderIdGenerator("TOUR", clock, ZoneId.of("Europe/Berlin"));
        assertEquals("TOUR-20240501-121530", ids.next());
    }

    @Test
    void validatesIdsAndPrefix() {
        assertTrue(OrderIdGenerator.isValid("ORDER-20240501_1"));
        assertFalse(OrderIdGenerator.isValid("order 1"));
        assertFalse(OrderIdGenerator.isValid(""));
        assertFalse(OrderIdGenerator.isValid(null));
        assertThrows(IllegalArgumentException.class, () -> new OrderIdGenerator("a/b", clock, ZoneOffset.UTC));
    }
}
