// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug output of the JSON-RPC engines, gated per channel by
 * {@link EthRpcDebug}.
 *
 * <p>Messages use {@link String#formatted} placeholders and are passed
 * through {@link LogSanitizer} before they are written. On a terminal they go
 * straight to stdout so ANSI colors survive; otherwise they are logged at INFO
 * on the {@code io.ethrpc.debug} logger.
 */
public final class DebugLogger {

    static final String LOGGER_NAME = "io.ethrpc.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    /** Single round trips: {@code [RPC]}, {@code [RPC-ERROR]}, {@code [HTTP]}. */
    public static void logRpc(final String message, final Object... args) {
        emit(EthRpcDebug.isRpcLoggingEnabled(), message, args);
    }

    /** Batches and buffered flushes: {@code [BATCH]}, {@code [BUFFER-FLUSH]}. */
    public static void logBatch(final String message, final Object... args) {
        emit(EthRpcDebug.isBatchLoggingEnabled(), message, args);
    }

    /**
     * Wire bodies, e.g. {@code [HTTP-SEND] {...}}. The body is sanitized as
     * JSON-RPC before it is printed, and only parsed when the channel is on.
     */
    public static void logPayload(final String tag, final String body) {
        if (!EthRpcDebug.isPayloadLoggingEnabled()) {
            return;
        }
        emit(true, "%s %s", tag, LogSanitizer.sanitizePayload(body));
    }

    /** Logs when any channel is on. */
    public static void log(final String message, final Object... args) {
        emit(EthRpcDebug.isEnabled(), message, args);
    }

    private static void emit(final boolean enabled, final String message, final Object... args) {
        if (!enabled) {
            return;
        }
        final String line = LogSanitizer.sanitize(args == null || args.length == 0 ? message : message.formatted(args));
        if (AnsiColors.IS_TTY) {
            System.out.println(line);
            return;
        }
        LOG.info(line);
    }
}
