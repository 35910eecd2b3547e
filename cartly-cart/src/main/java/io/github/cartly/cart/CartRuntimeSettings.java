package io.github.cartly.cart;

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

import io.github.cartly.engine.supervision.BackoffRestartStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Tunables of {@link CartRuntime}: supervision of crashed carts and snapshot policy.
 *
 * <p>Settings can be read from properties, recognized keys are:</p>
 * <ul>
 *     <li>{@code cart.supervision.minBackoffMillis} pause after first crash, 200 by default</li>
 *     <li>{@code cart.supervision.maxBackoffMillis} upper bound of the pause, 5000 by default</li>
 *     <li>{@code cart.supervision.randomFactor} random extension of the pause, 0.1 by default</li>
 *     <li>{@code cart.supervision.maxRestarts} restarts before cart is stopped, -1 (unlimited) by default</li>
 *     <li>{@code cart.snapshot.every} events between snapshots, 100 by default</li>
 *     <li>{@code cart.snapshot.keep} snapshots retained per cart, 3 by default</li>
 * </ul>
 */
public final class CartRuntimeSettings {
    public static final String MIN_BACKOFF = "cart.supervision.minBackoffMillis";
    public static final String MAX_BACKOFF = "cart.supervision.maxBackoffMillis";
    public static final String RANDOM_FACTOR = "cart.supervision.randomFactor";
    public static final String MAX_RESTARTS = "cart.supervision.maxRestarts";
    public static final String SNAPSHOT_EVERY = "cart.snapshot.every";
    public static final String KEEP_SNAPSHOTS = "cart.snapshot.keep";

    public static final String DEFAULT_RESOURCE = "cart-runtime.properties";

    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final double randomFactor;
    private final int maxRestarts;
    private final int snapshotEvery;
    private final int keepSnapshots;

    private CartRuntimeSettings(Duration minBackoff, Duration maxBackoff, double randomFactor, int maxRestarts,
            int snapshotEvery, int keepSnapshots) {
        this.minBackoff = Objects.requireNonNull(minBackoff, "minBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (minBackoff.isNegative() || minBackoff.isZero()) {
            throw new IllegalArgumentException("Minimal backoff must be positive, was " + minBackoff);
        }
        if (maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException("Maximal backoff " + maxBackoff + " is less than minimal backoff "
                    + minBackoff);
        }
        if (randomFactor < 0) {
            throw new IllegalArgumentException("Random factor cannot be negative, was " + randomFactor);
        }
        if (maxRestarts < BackoffRestartStrategy.UNLIMITED) {
            throw new IllegalArgumentException("Max restarts must be -1 (unlimited) or more, was " + maxRestarts);
        }
        if (snapshotEvery < 1) {
            throw new IllegalArgumentException("Snapshot interval must be positive, was " + snapshotEvery);
        }
        if (keepSnapshots < 1) {
            throw new IllegalArgumentException("At least one snapshot must be kept, was " + keepSnapshots);
        }
        this.randomFactor = randomFactor;
        this.maxRestarts = maxRestarts;
        this.snapshotEvery = snapshotEvery;
        this.keepSnapshots = keepSnapshots;
    }

    public static CartRuntimeSettings defaults() {
        return new CartRuntimeSettings(Duration.ofMillis(200), Duration.ofSeconds(5), 0.1,
                BackoffRestartStrategy.UNLIMITED, 100, 3);
    }

    /**
     * Read settings from properties. Missing keys keep their default values.
     * @param properties the properties
     * @return the settings
     * @throws IllegalArgumentException when a value is not a number or out of range
     */
    public static CartRuntimeSettings fromProperties(Properties properties) {
        CartRuntimeSettings defaults = defaults();
        try {
            return new CartRuntimeSettings(
                    Duration.ofMillis(Long.parseLong(properties.getProperty(MIN_BACKOFF,
                        String.valueOf(defaults.minBackoff.toMillis())).trim())),
                    Duration.ofMillis(Long.parseLong(properties.getProperty(MAX_BACKOFF,
                        String.valueOf(defaults.maxBackoff.toMillis())).trim())),
                    Double.parseDouble(properties.getProperty(RANDOM_FACTOR,
                        String.valueOf(defaults.randomFactor)).trim()),
                    Integer.parseInt(properties.getProperty(MAX_RESTARTS,
                        String.valueOf(defaults.maxRestarts)).trim()),
                    Integer.parseInt(properties.getProperty(SNAPSHOT_EVERY,
                        String.valueOf(defaults.snapshotEvery)).trim()),
                    Integer.parseInt(properties.getProperty(KEEP_SNAPSHOTS,
                        String.valueOf(defaults.keepSnapshots)).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cart runtime settings: " + e.getMessage(), e);
        }
    }

    /**
     * Read settings from properties resource on the classpath.
     * @param resource name of the resource
     * @return the settings
     * @throws IllegalArgumentException when the resource does not exist or contains invalid values
     */
    public static CartRuntimeSettings fromClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = CartRuntimeSettings.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource " + resource + " not found on classpath");
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }

    public static CartRuntimeSettings fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public CartRuntimeSettings withBackoff(Duration minBackoff, Duration maxBackoff, double randomFactor) {
        return new CartRuntimeSettings(minBackoff, maxBackoff, randomFactor, maxRestarts, snapshotEvery,
                keepSnapshots);
    }

    public CartRuntimeSettings withMaxRestarts(int maxRestarts) {
        return new CartRuntimeSettings(minBackoff, maxBackoff, randomFactor, maxRestarts, snapshotEvery,
                keepSnapshots);
    }

    public CartRuntimeSettings withSnapshotEvery(int snapshotEvery) {
        return new CartRuntimeSettings(minBackoff, maxBackoff, randomFactor, maxRestarts, snapshotEvery,
                keepSnapshots);
    }

    public CartRuntimeSettings withKeepSnapshots(int keepSnapshots) {
        return new CartRuntimeSettings(minBackoff, maxBackoff, randomFactor, maxRestarts, snapshotEvery,
                keepSnapshots);
    }

    public BackoffRestartStrategy toRestartStrategy() {
        return new BackoffRestartStrategy(minBackoff, maxBackoff, randomFactor, maxRestarts);
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

    public int getSnapshotEvery() {
        return snapshotEvery;
    }

    public int getKeepSnapshots() {
        return keepSnapshots;
    }

    @Override
    public String toString() {
        return "CartRuntimeSettings{minBackoff=" + minBackoff + ", maxBackoff=" + maxBackoff + ", randomFactor="
                + randomFactor + ", maxRestarts=" + maxRestarts + ", snapshotEvery=" + snapshotEvery
                + ", keepSnapshots=" + keepSnapshots + '}';
    }
}
