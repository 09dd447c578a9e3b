// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A JSON-RPC request object.
 *
 * <p>Requests are built with {@link #create(RpcMethod, Object)}, which
 * allocates a fresh {@link Id}. The canonical constructor exists for decoding
 * requests (e.g. in a test node) and should not be used to pick ids.
 *
 * @param jsonrpc always {@value JsonRpc#VERSION}
 * @param method  the wire method name
 * @param params  the encoded params
 * @param id      the request id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"jsonrpc", "method", "params", "id"})
public record JsonRpcRequest(String jsonrpc, String method, JsonValue params, Id id) {

    public JsonRpcRequest {
        JsonRpc.requireVersion(jsonrpc);
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(id, "id");
        params = params == null ? JsonValue.NULL : params;
    }

    /**
     * Encodes {@code params} with the method's hook and allocates the next id.
     */
    public static <P> JsonRpcRequest create(final RpcMethod<P, ?> method, final P params) {
        final JsonValue encoded = method.encodeParams(params);
        return new JsonRpcRequest(JsonRpc.VERSION, method.name(), encoded, Id.next());
    }
}
