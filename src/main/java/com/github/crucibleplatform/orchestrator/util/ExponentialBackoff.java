package com.github.crucibleplatform.orchestrator.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with up to 25% additive jitter, capped per attempt.
 *
 * @author crucible-platform
 */
public record ExponentialBackoff(Duration baseDelay, double multiplier, Duration maxDelay, DoubleSupplier jitter) {

    public static final double MAX_JITTER_RATIO = 0.25;

    public ExponentialBackoff(final Duration baseDelay, final double multiplier, final Duration maxDelay) {
        this(baseDelay, multiplier, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param attempt zero based retry attempt
     */
    public Duration delayFor(final int attempt) {
        final double exponential = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        final double capped = Math.min(exponential, maxDelay.toMillis());
        final double jitterRatio = Math.min(1.0, Math.max(0.0, jitter.getAsDouble())) * MAX_JITTER_RATIO;
        return Duration.ofMillis(Math.round(capped + capped * jitterRatio));
    }

}
