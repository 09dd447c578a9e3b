// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.util.concurrent.CompletableFuture;

import io.ethrpc.core.error.TransportException;

/**
 * Moves serialized JSON-RPC payloads to a node and back.
 *
 * <p>
 * A transport knows nothing about JSON-RPC: it takes a request body (a single
 * object or an array) and returns the response body verbatim. Envelopes,
 * ids and correlation are handled by {@link io.ethrpc.core.jsonrpc.JsonRpc}.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * <p>
 * <strong>Built-in Implementations:</strong>
 * <ul>
 * <li>{@link HttpTransport} - HTTP/HTTPS POST</li>
 * </ul>
 *
 * @see HttpTransport
 * @see EthRpcClient#from(RpcTransport)
 */
public interface RpcTransport extends AutoCloseable {

    /**
     * Performs one round trip.
     *
     * @param body the serialized request
     * @return the serialized response
     * @throws TransportException if the round trip fails
     */
    String send(String body);

    /**
     * Performs one round trip without blocking the caller. The default
     * implementation runs {@link #send(String)} on the common pool.
     */
    default CompletableFuture<String> sendAsync(final String body) {
        return CompletableFuture.supplyAsync(() -> send(body));
    }

    /**
     * Returns whether several round trips may be in flight at once. Buffered
     * clients clamp their dispatch concurrency to one when this is false.
     */
    default boolean supportsConcurrentRequests() {
        return true;
    }

    /**
     * Creates a default HTTP transport.
     *
     * @param url the JSON-RPC endpoint URL
     */
    static RpcTransport http(final String url) {
        return HttpTransport.builder(url).build();
    }

    /**
     * Closes this transport and releases any associated resources.
     * <p>
     * The default implementation does nothing.
     */
    @Override
    default void close() {
        // Default no-op for transports that don't need cleanup
    }
}
