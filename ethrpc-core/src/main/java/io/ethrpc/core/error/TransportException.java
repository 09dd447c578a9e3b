// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a round trip to the node fails before a JSON-RPC response could
 * be read: connection errors, interruption, or a non-success HTTP status.
 *
 * <p>When the transport received a status line, {@link #status()} and
 * {@link #body()} carry it so callers can tell a rate limit (429) from a
 * server fault (5xx).
 */
public final class TransportException extends EthRpcException {

    private final @Nullable Integer status;
    private final @Nullable String body;

    public TransportException(final String message, final Throwable cause) {
        this(message, null, null, cause);
    }

    public TransportException(final int status, final @Nullable String body) {
        this("HTTP " + status + " error: " + body, status, body, null);
    }

    private TransportException(
            final String message,
            final @Nullable Integer status,
            final @Nullable String body,
            final @Nullable Throwable cause) {
        super(message, cause);
        this.status = status;
        this.body = body;
    }

    public @Nullable Integer status() {
        return status;
    }

    public @Nullable String body() {
        return body;
    }

    @Override
    TransportException duplicate() {
        return new TransportException(getMessage(), status, body, getCause());
    }

    @Override
    public String toString() {
        return "TransportException{"
                + "message="
                + getMessage()
                + ", status="
                + status
                + "}";
    }
}
