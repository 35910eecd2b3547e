package io.github.cartly.engine.supervision;

/*-
 * #%L
 * cartly
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Restart policy of crashed entities. The pause before n-th consecutive restart grows exponentially from
 * {@code minBackoff}, is capped by {@code maxBackoff}, and is prolonged by random portion of up to
 * {@code randomFactor} of its length.
 */
public final class BackoffRestartStrategy {
    /**
     * Value of {@code maxRestarts} allowing the entity to restart forever.
     */
    public static final int UNLIMITED = -1;

    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final double randomFactor;
    private final int maxRestarts;
    private final DoubleSupplier random;

    public BackoffRestartStrategy(Duration minBackoff, Duration maxBackoff, double randomFactor, int maxRestarts) {
        this(minBackoff, maxBackoff, randomFactor, maxRestarts, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Create strategy with specific source of randomness.
     * @param random supplier of values between 0 (inclusive) and 1 (exclusive)
     */
    public BackoffRestartStrategy(Duration minBackoff, Duration maxBackoff, double randomFactor, int maxRestarts,
            DoubleSupplier random) {
        this.minBackoff = Objects.requireNonNull(minBackoff, "minBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (minBackoff.isNegative() || minBackoff.isZero()) {
            throw new IllegalArgumentException("minBackoff must be positive, was " + minBackoff);
        }
        if (maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff " + maxBackoff + " is lower than minBackoff " + minBackoff);
        }
        if (randomFactor < 0) {
            throw new IllegalArgumentException("randomFactor must not be negative, was " + randomFactor);
        }
        if (maxRestarts < UNLIMITED) {
            throw new IllegalArgumentException("maxRestarts must be -1 (unlimited) or greater, was " + maxRestarts);
        }
        this.randomFactor = randomFactor;
        this.maxRestarts = maxRestarts;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Pause before given restart.
     * @param restart number of consecutive restart, starting with 1
     * @return the pause
     */
    public Duration backoff(int restart) {
        int exponent = Math.min(Math.max(restart, 1) - 1, 20);
        Duration candidate = minBackoff.multipliedBy(1L << exponent);
        Duration capped = candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
        double jitter = 1 + random.getAsDouble() * randomFactor;
        return Duration.ofNanos((long) (capped.toNanos() * jitter));
    }

    /**
     * Whether the entity may restart once more.
     * @param restart number of consecutive restart, starting with 1
     * @return false when the number of restarts is exhausted
     */
    public boolean canRestart(int restart) {
        return maxRestarts == UNLIMITED || restart <= maxRestarts;
    }

    public Duration getMinBackoff() {
        return minBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public double getRandomFactor() {
        return randomFactor;
    }

    public int getMaxRestarts() {
        return maxRestarts;
    }

    @Override
    public String toString() {
        return "BackoffRestartStrategy{minBackoff=" + minBackoff + ", maxBackoff=" + maxBackoff + ", randomFactor="
                + randomFactor + ", maxRestarts=" + maxRestarts + '}';
    }
}
