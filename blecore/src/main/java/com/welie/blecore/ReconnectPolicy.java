package com.welie.blecore;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Random;

/**
 * Automatic reconnection after an unexpected link loss: how often to try and how long to wait
 * between attempts. Delays grow exponentially up to a ceiling and are spread with random jitter.
 */
public final class ReconnectPolicy {

    /**
     * Never reconnect automatically.
     */
    public static final ReconnectPolicy NONE = new ReconnectPolicy(0, 0, 1.0, 0, 0.0);

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final double multiplier;
    private final long maxDelayMillis;
    private final double jitterFactor;

    /**
     * @param maxAttempts number of reconnect attempts after a link loss, 0 disables reconnecting
     * @param initialDelayMillis delay before the first attempt
     * @param multiplier growth factor of the delay per attempt, at least 1
     * @param maxDelayMillis ceiling for the delay
     * @param jitterFactor relative random spread of the delay, between 0 and 1
     */
    public ReconnectPolicy(int maxAttempts, long initialDelayMillis, double multiplier, long maxDelayMillis, double jitterFactor) {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts may not be negative");
        if (initialDelayMillis < 0) throw new IllegalArgumentException("initialDelayMillis may not be negative");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be at least 1");
        if (maxDelayMillis < initialDelayMillis) throw new IllegalArgumentException("maxDelayMillis must be at least initialDelayMillis");
        if (jitterFactor < 0.0 || jitterFactor > 1.0) throw new IllegalArgumentException("jitterFactor must be between 0 and 1");

        this.maxAttempts = maxAttempts;
        this.initialDelayMillis = initialDelayMillis;
        this.multiplier = multiplier;
        this.maxDelayMillis = maxDelayMillis;
        this.jitterFactor = jitterFactor;
    }

    public boolean isEnabled() {
        return maxAttempts > 0;
    }

    /**
     * Delay before a reconnect attempt.
     *
     * @param attempt the attempt number, starting at 1
     * @param random source for the jitter
     * @return the delay in milliseconds, never more than the ceiling
     */
    public long getDelay(int attempt, @NotNull Random random) {
        Objects.requireNonNull(random, "no valid random provided");
        if (attempt < 1) throw new IllegalArgumentException("attempt starts at 1");

        final double base = Math.min(initialDelayMillis * Math.pow(multiplier, attempt - 1), maxDelayMillis);
        final double jitter = base * jitterFactor * (2.0 * random.nextDouble() - 1.0);
        final long delay = Math.round(base + jitter);
        return Math.max(0, Math.min(delay, maxDelayMillis));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialDelayMillis() {
        return initialDelayMillis;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    @Override
    public String toString() {
        if (!isEnabled()) return "ReconnectPolicy{none}";
        return String.format("ReconnectPolicy{maxAttempts=%d, initialDelay=%dms, multiplier=%.2f, maxDelay=%dms, jitter=%.2f}",
                maxAttempts, initialDelayMillis, multiplier, maxDelayMillis, jitterFactor);
    }
}
