// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import io.ethrpc.core.error.EthRpcException;

/**
 * One request/response exchange with a node, supplied by the caller.
 *
 * <p>Implementations typically wrap an HTTP POST. Any failure should be
 * thrown as an {@link EthRpcException} (usually a
 * {@link io.ethrpc.core.error.TransportException}); the engine passes it on
 * unchanged.
 *
 * @param <T> the request shape
 * @param <U> the response shape
 */
@FunctionalInterface
public interface RoundTrip<T, U> {

    U roundtrip(T request);
}
