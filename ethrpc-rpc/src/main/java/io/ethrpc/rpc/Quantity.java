// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.math.BigInteger;

/**
 * Hex quantity encoding used by Ethereum JSON-RPC: {@code 0x}-prefixed,
 * lowercase, no leading zeros ({@code 0x0} for zero).
 */
public final class Quantity {

    private Quantity() {
        // Utility class
    }

    /**
     * Parses a quantity such as {@code 0x1b4}.
     *
     * @throws IllegalArgumentException if {@code hex} is not a quantity
     */
    public static BigInteger decode(final String hex) {
        if (hex == null || !hex.startsWith("0x")) {
            throw new IllegalArgumentException("quantity must start with 0x: " + hex);
        }
        final String digits = hex.substring(2);
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("quantity has no digits: " + hex);
        }
        try {
            return new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid quantity: " + hex, e);
        }
    }

    public static long decodeLong(final String hex) {
        return decode(hex).longValueExact();
    }

    /**
     * Encodes a non-negative value.
     *
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static String encode(final BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("quantity cannot be negative: " + value);
        }
        return "0x" + value.toString(16);
    }

    public static String encode(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("quantity cannot be negative: " + value);
        }
        return "0x" + Long.toHexString(value);
    }
}
