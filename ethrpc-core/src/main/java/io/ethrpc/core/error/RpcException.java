// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.error;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.ethrpc.core.jsonrpc.ErrorCode;
import io.ethrpc.core.jsonrpc.Id;
import io.ethrpc.core.jsonrpc.JsonRpcError;
import io.ethrpc.core.jsonrpc.JsonValue;

/**
 * Thrown when the node answers a call with a JSON-RPC error object.
 *
 * <p>
 * <strong>Standard Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32600</strong>: Invalid JSON-RPC request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid method parameters</li>
 * <li><strong>-32603</strong>: Internal JSON-RPC error</li>
 * <li><strong>-32000 to -32099</strong>: Server/implementation-specific
 * errors</li>
 * </ul>
 *
 * <p>
 * The error object is kept exactly as received. {@link #data()} often holds
 * revert data for {@code eth_call}.
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      error object</a>
 */
public final class RpcException extends EthRpcException {

    private final JsonRpcError error;
    private final @Nullable Id requestId;

    public RpcException(final JsonRpcError error, final @Nullable Id requestId) {
        this(error, requestId, null);
    }

    private RpcException(final JsonRpcError error, final @Nullable Id requestId, final @Nullable Throwable cause) {
        super(augmentMessage(Objects.requireNonNull(error, "error").toString(), requestId), cause);
        this.error = error;
        this.requestId = requestId;
    }

    public JsonRpcError error() {
        return error;
    }

    public ErrorCode errorCode() {
        return error.code();
    }

    public int code() {
        return error.code().code();
    }

    public JsonValue data() {
        return error.data();
    }

    /**
     * Returns the id of the response that carried the error, or {@code null}
     * when the node reported the error without one (e.g. a parse error).
     */
    public @Nullable Id requestId() {
        return requestId;
    }

    @Override
    RpcException duplicate() {
        return new RpcException(error, requestId, getCause());
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code()
                + ", message="
                + error.message()
                + ", data="
                + error.data()
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Id requestId) {
        if (requestId == null) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
