// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core;

import static io.ethrpc.core.AnsiColors.*;

/**
 * Formats the single-line debug records emitted through {@link DebugLogger}.
 *
 * <p>Every record starts with a bracketed tag, followed by {@code key=value}
 * pairs:
 * <ul>
 * <li>{@code [RPC]} - a successful single round trip</li>
 * <li>{@code ✗ [RPC-ERROR]} - a failed round trip or a JSON-RPC error</li>
 * <li>{@code [BATCH]} - a correlated batch round trip</li>
 * <li>{@code ✗ [BATCH-ERROR]} - a batch that failed as a whole</li>
 * <li>{@code [BUFFER-FLUSH]} - a chunk closed by the buffered client</li>
 * </ul>
 *
 * <p>All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=eth_chainId id=7 duration=1.06ms
     */
    public static String formatRpc(String method, Object id, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s id=%s %s",
                INDIGO, RESET,
                method,
                id,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=eth_call code=-32000 message=error duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: [BATCH] size=3 ids=12..14 failed=1 duration=2.10ms
     */
    public static String formatBatch(int size, Object firstId, Object lastId, int failed, long durationMicros) {
        return String.format(
                "%s[BATCH]%s size=%d ids=%s..%s failed=%d %s",
                AMBER, RESET,
                size,
                firstId, lastId,
                failed,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [BATCH-ERROR] size=3 error=batch responses do not match requests duration=2.10ms
     */
    public static String formatBatchError(int size, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[BATCH-ERROR]%s size=%d error=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                size,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: [BUFFER-FLUSH] size=20 reason=full queued=3
     */
    public static String formatBufferFlush(int size, String reason, int queued) {
        return String.format(
                "%s[BUFFER-FLUSH]%s size=%d reason=%s queued=%d",
                AMBER, RESET,
                size,
                reason,
                queued);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }
}
