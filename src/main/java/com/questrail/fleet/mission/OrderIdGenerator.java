package com.questrail.fleet.mission;

import com.questrail.fleet.internal.time.WallClock;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Generates order ids of the form {@code <prefix>-yyyyMMdd-HHmmss}, with a
 * {@code -2}, {@code -3}... suffix for further ids in the same second.
 */
public final class OrderIdGenerator
{
    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final String prefix;
    private final WallClock clock;
    private final ZoneId zone;

    private String lastStamp = "";
    private int sameSecond;

    public OrderIdGenerator(String prefix, WallClock clock, ZoneId zone) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
        if (!isValid(prefix)) {
            throw new IllegalArgumentException("invalid order id prefix: " + prefix);
        }
    }

    public synchronized String next() {
        String stamp = STAMP.format(clock.now().atZone(zone));
        if (stamp.equals(lastStamp)) {
            sameSecond++;
            return prefix + "-" + stamp + "-" + sameSecond;
        }
        lastStamp = stamp;
        sameSecond = 1;
        return prefix + "-" + stamp;
    }

    /**
     * Letters, digits, {@code -} and {@code _} only.
     */
    public static boolean isValid(String orderId) {
        return orderId != null && VALID.matcher(orderId).matches();
    }
}
