// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * A JSON-RPC request and response id.
 *
 * <p>Ids are unsigned 32-bit integers so that they always fit in a double
 * and never have a fractional part. They are allocated by the engine from a
 * single process-wide counter; callers cannot choose them. Ids allocated in
 * sequence compare in allocation order, which the batch correlator relies on.
 *
 * <p>The counter wraps after 2<sup>32</sup> allocations.
 *
 * @param value the id, in {@code [0, 2^32 - 1]}
 */
public record Id(long value) implements Comparable<Id> {

    /** Largest representable id. */
    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    private static final AtomicInteger COUNTER = new AtomicInteger();

    public Id {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("id out of unsigned 32-bit range: " + value);
        }
    }

    /**
     * Allocates the next id.
     */
    public static Id next() {
        return new Id(Integer.toUnsignedLong(COUNTER.getAndIncrement()));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Id of(final long value) {
        return new Id(value);
    }

    @com.fasterxml.jackson.annotation.JsonValue
    @Override
    public long value() {
        return value;
    }

    @Override
    public int compareTo(final Id other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
