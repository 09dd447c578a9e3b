// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core;

/**
 * Global toggles for verbose debug logging.
 *
 * <p>Three channels exist: {@code rpc} covers single round trips,
 * {@code batch} covers batch correlation and the buffered client's chunk
 * flushes, {@code payload} prints sanitized request and response bodies. All
 * are off by default.
 */
public final class EthRpcDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean batchLogging = false;
    private static volatile boolean payloadLogging = false;

    private EthRpcDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || batchLogging || payloadLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        batchLogging = enabled;
        payloadLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setBatchLogging(final boolean enabled) {
        batchLogging = enabled;
    }

    public static boolean isBatchLoggingEnabled() {
        return batchLogging;
    }

    public static void setPayloadLogging(final boolean enabled) {
        payloadLogging = enabled;
    }

    public static boolean isPayloadLoggingEnabled() {
        return payloadLogging;
    }
}
