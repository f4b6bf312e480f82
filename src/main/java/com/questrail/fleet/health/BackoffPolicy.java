package com.questrail.fleet.health;

import com.questrail.fleet.config.FleetSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * BackoffPolicy
 * -----------------------------------------------------------------------------
 * Exponential spacing of reconnect attempts with a ceiling and an attempt
 * budget.
 *
 * <p>The delay before attempt {@code k} (1-based) is
 * {@code min(base * 2^(k-1), max)}. With the defaults (2s, 60s, 5 attempts)
 * the delays are 2, 4, 8, 16 and 32 seconds.</p>
 */
public record BackoffPolicy(Duration base, Duration max, int maxAttempts) {
    public BackoffPolicy {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static BackoffPolicy from(FleetSettings settings) {
        return new BackoffPolicy(settings.backoffBase(), settings.backoffMax(), settings.maxReconnectAttempts());
    }

    public Duration delayBefore(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        // 2^62 ns is far beyond any sane ceiling; stop doubling there.
        int shift = Math.min(attempt - 1, 62);
        long baseNanos = base.toNanos();
        long maxNanos = max.toNanos();
        if (baseNanos > (maxNanos >> shift)) {
            return max;
        }
        return Duration.ofNanos(Math.min(baseNanos << shift, maxNanos));
    }

    public boolean exhausted(int attemptsMade) {
        return attemptsMade >= maxAttempts;
    }
}
