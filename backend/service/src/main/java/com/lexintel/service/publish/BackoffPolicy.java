package com.lexintel.service.publish;

import java.time.Duration;
import java.time.Instant;

public record BackoffPolicy(Duration base, int multiplier, Duration cap) {
    public BackoffPolicy {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (multiplier < 1) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must not be below base");
        }
    }

    public Duration delayFor(int retryCount) {
        Duration delay = base;
        for (int i = 0; i < retryCount; i++) {
            if (delay.compareTo(cap) >= 0) {
                return cap;
            }
            delay = delay.multipliedBy(multiplier);
        }
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    // The later of the backoff delay and any delay the platform asked for.
    public Instant nextRetryAt(Instant now, int retryCount, Duration retryAfter) {
        Duration delay = delayFor(retryCount);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter;
        }
        return now.plus(delay);
    }
}
