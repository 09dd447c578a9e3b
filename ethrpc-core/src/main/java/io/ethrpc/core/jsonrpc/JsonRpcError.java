// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A JSON-RPC error object.
 *
 * @param code    the classified error code
 * @param message the short description sent by the node
 * @param data    additional information; {@link JsonValue#NULL} when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"code", "message", "data"})
public record JsonRpcError(ErrorCode code, String message, JsonValue data) {

    @JsonCreator
    public JsonRpcError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        data = data == null ? JsonValue.NULL : data;
    }

    public JsonRpcError(final ErrorCode code, final String message) {
        this(code, message, JsonValue.NULL);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
