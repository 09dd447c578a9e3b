// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A JSON-RPC notification: a request without an id. The peer never answers
 * it, so the engine never waits for a response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"jsonrpc", "method", "params"})
public record JsonRpcNotification(String jsonrpc, String method, JsonValue params) {

    public JsonRpcNotification {
        JsonRpc.requireVersion(jsonrpc);
        Objects.requireNonNull(method, "method");
        params = params == null ? JsonValue.NULL : params;
    }

    public static <P> JsonRpcNotification create(final RpcMethod<P, ?> method, final P params) {
        return new JsonRpcNotification(JsonRpc.VERSION, method.name(), method.encodeParams(params));
    }
}
