// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import org.jspecify.annotations.Nullable;

import io.ethrpc.core.error.RpcException;

/**
 * The outcome of an individual call within a JSON-RPC batch.
 *
 * <p>
 * <strong>Example:</strong>
 *
 * <pre>{@code
 * BatchResult<BigInteger> result = handle.result();
 * if (result.success()) {
 *     System.out.println("Balance: " + result.data());
 * } else {
 *     System.out.println("Failed: " + result.error().message());
 * }
 * }</pre>
 *
 * @param <T>   the type of the result data
 * @param data  the decoded result (null if the call failed, or if the node
 *              returned {@code null})
 * @param error the error object the node returned (null if successful)
 * @param id    the id of the response
 */
public record BatchResult<T>(@Nullable T data, @Nullable JsonRpcError error, @Nullable Id id) {

    public static <T> BatchResult<T> ok(final @Nullable T data, final @Nullable Id id) {
        return new BatchResult<>(data, null, id);
    }

    public static <T> BatchResult<T> failed(final JsonRpcError error, final @Nullable Id id) {
        return new BatchResult<>(null, error, id);
    }

    public boolean success() {
        return error == null;
    }

    /**
     * Returns the data, or throws the error as an {@link RpcException}.
     */
    public @Nullable T getOrThrow() {
        if (error != null) {
            throw new RpcException(error, id);
        }
        return data;
    }
}
