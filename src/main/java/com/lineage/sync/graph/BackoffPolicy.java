package com.lineage.sync.graph;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with random jitter: the delay before retry {@code n}
 * (counting from 0) is {@code base * 2^n + jitter}, with jitter drawn
 * uniformly from {@code [0, jitterBound)}.
 *
 * <p>With the jitter bound not larger than the base, successive delays are
 * strictly increasing.</p>
 */
public class BackoffPolicy {

    public static final Duration DEFAULT_BASE = Duration.ofMillis(500);
    public static final Duration DEFAULT_JITTER_BOUND = Duration.ofMillis(500);

    private static final int MAX_EXPONENT = 20;

    private final long baseMillis;
    private final long jitterBoundMillis;
    private final Random random;

    public BackoffPolicy() {
        this(DEFAULT_BASE, DEFAULT_JITTER_BOUND, new SecureRandom());
    }

    public BackoffPolicy(Duration base, Duration jitterBound, Random random) {
        Objects.requireNonNull(base, "base is required");
        Objects.requireNonNull(jitterBound, "jitterBound is required");
        if (base.isNegative() || jitterBound.isNegative()) {
            throw new IllegalArgumentException("base and jitterBound must not be negative");
        }
        this.baseMillis = base.toMillis();
        this.jitterBoundMillis = jitterBound.toMillis();
        this.random = Objects.requireNonNull(random, "random is required");
    }

    /**
     * Delay to wait before retry {@code retryIndex} (0-based).
     */
    public Duration delayFor(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must not be negative");
        }
        long exponential = baseMillis << Math.min(retryIndex, MAX_EXPONENT);
        return Duration.ofMillis(exponential + jitter());
    }

    private long jitter() {
        if (jitterBoundMillis == 0) {
            return 0;
        }
        synchronized (random) {
            return (long) (random.nextDouble() * jitterBoundMillis);
        }
    }

    public Duration getBase() {
        return Duration.ofMillis(baseMillis);
    }

    public Duration getJitterBound() {
        return Duration.ofMillis(jitterBoundMillis);
    }
}
