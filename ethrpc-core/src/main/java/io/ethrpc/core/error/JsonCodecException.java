// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.error;

/**
 * Thrown when a value cannot be encoded to, or decoded from, JSON.
 *
 * <p>This is a local fault: malformed JSON in a response body, a result that
 * does not match the shape a method expects, or params that Jackson cannot
 * serialize. It is never used for a well-formed JSON-RPC error object; see
 * {@link RpcException} for those.
 */
public final class JsonCodecException extends EthRpcException {

    public JsonCodecException(final String message) {
        super(message);
    }

    public JsonCodecException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    JsonCodecException duplicate() {
        return new JsonCodecException(getMessage(), getCause());
    }
}
