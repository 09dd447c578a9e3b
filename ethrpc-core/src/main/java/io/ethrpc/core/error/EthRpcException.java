// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.error;

/**
 * Base runtime exception for every failure the JSON-RPC engine reports.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * EthRpcException
 * ├── {@link JsonCodecException} - local encode/decode failures
 * ├── {@link TransportException} - the round trip itself failed
 * ├── {@link RpcException} - the node answered with a JSON-RPC error object
 * └── {@link BatchCorrelationException} - batch responses do not match requests
 * </pre>
 *
 * <p>
 * Codec and RPC errors belong to a single call. Transport and correlation
 * errors belong to a whole round trip and are handed to every call that
 * shared it through {@link SharedFailure}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     BigInteger head = client.call(Eth.BLOCK_NUMBER);
 * } catch (RpcException e) {
 *     // node rejected the call: e.errorCode(), e.data()
 * } catch (TransportException e) {
 *     // connection refused, HTTP 5xx, ...
 * } catch (EthRpcException e) {
 *     // anything else
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public abstract sealed class EthRpcException extends RuntimeException
        permits JsonCodecException,
        TransportException,
        RpcException,
        BatchCorrelationException {

    protected EthRpcException(final String message) {
        super(message);
    }

    protected EthRpcException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an equivalent exception carrying the same diagnostic data and
     * the same cause instance.
     *
     * <p>Only {@link SharedFailure} calls this.
     */
    abstract EthRpcException duplicate();
}
