// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

/**
 * Settings of a {@link BufferedClient}.
 *
 * <p>
 * <strong>Example:</strong>
 *
 * <pre>{@code
 * BufferedConfig config = BufferedConfig.builder()
 *         .maxBatchSize(50)
 *         .delay(Duration.ofMillis(5))
 *         .build();
 * }</pre>
 *
 * @param maxConcurrentRequests how many round trips may be in flight at once,
 *                              or {@code null} for no limit (default 1)
 * @param maxBatchSize          the most calls one round trip carries
 *                              (default 20)
 * @param delay                 how long to wait for more calls after the
 *                              first one of a chunk arrives (default zero:
 *                              only calls already queued are coalesced)
 */
public record BufferedConfig(
        @Nullable Integer maxConcurrentRequests,
        int maxBatchSize,
        Duration delay) {

    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 1;
    public static final int DEFAULT_MAX_BATCH_SIZE = 20;

    public BufferedConfig {
        if (maxConcurrentRequests != null && maxConcurrentRequests < 1) {
            throw new IllegalArgumentException(
                    "maxConcurrentRequests must be at least 1, got: " + maxConcurrentRequests);
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1, got: " + maxBatchSize);
        }
        delay = delay == null ? Duration.ZERO : delay;
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
    }

    public static BufferedConfig defaults() {
        return new BufferedConfig(DEFAULT_MAX_CONCURRENT_REQUESTS, DEFAULT_MAX_BATCH_SIZE, Duration.ZERO);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable Integer maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private Duration delay = Duration.ZERO;

        private Builder() {
        }

        public Builder maxConcurrentRequests(final int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        /**
         * Removes the limit on concurrent round trips.
         */
        public Builder unboundedConcurrency() {
            this.maxConcurrentRequests = null;
            return this;
        }

        public Builder maxBatchSize(final int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder delay(final Duration delay) {
            this.delay = delay;
            return this;
        }

        public BufferedConfig build() {
            return new BufferedConfig(maxConcurrentRequests, maxBatchSize, delay);
        }
    }
}
