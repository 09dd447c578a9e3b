// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import io.ethrpc.core.error.JsonCodecException;
import io.ethrpc.core.error.RpcException;

/**
 * A JSON-RPC response object, with the result still encoded.
 *
 * <p>
 * A response carries a result, an error, or both. JSON-RPC 2.0 forbids
 * both, but some auto-mining development nodes send a result together with an
 * error; in that case the <strong>result wins</strong> and the error is
 * ignored. A {@code "result": null} is a present result (e.g. an unknown
 * block), represented as {@link JsonValue#NULL}; an absent result is
 * {@code null}.
 *
 * <p>
 * The id is optional because a node may report a failure it could not
 * attribute to a request (a parse error, say) with {@code "id": null}.
 *
 * @param jsonrpc always {@value JsonRpc#VERSION}
 * @param result  the encoded result, or {@code null} if absent
 * @param error   the error object, or {@code null} if absent
 * @param id      the id of the request this answers, or {@code null}
 * @see JsonRpcCodec#readResponse(String)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"jsonrpc", "result", "error", "id"})
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable JsonValue result,
        @Nullable JsonRpcError error,
        @Nullable Id id) {

    public JsonRpcResponse {
        JsonRpc.requireVersion(jsonrpc);
        if (result == null && error == null) {
            throw new IllegalArgumentException("response must carry a result or an error");
        }
    }

    public static JsonRpcResponse success(final JsonValue result, final @Nullable Id id) {
        return new JsonRpcResponse(JsonRpc.VERSION, result == null ? JsonValue.NULL : result, null, id);
    }

    public static JsonRpcResponse failure(final JsonRpcError error, final @Nullable Id id) {
        return new JsonRpcResponse(JsonRpc.VERSION, null, error, id);
    }

    /**
     * Returns whether the error is authoritative, i.e. there is no result.
     */
    @JsonIgnore
    public boolean hasError() {
        return result == null;
    }

    /**
     * Decodes the result for {@code method}.
     *
     * @throws RpcException       if the node answered with an error
     * @throws JsonCodecException if the result does not have the method's
     *                            result shape
     */
    public <R> R result(final RpcMethod<?, R> method) {
        if (result == null) {
            throw new RpcException(error, id);
        }
        return method.decodeResult(result);
    }

    /**
     * Decodes this response into a per-call outcome. Only codec failures are
     * thrown; an error object becomes a failed {@link BatchResult}.
     *
     * @throws JsonCodecException if the result does not have the method's
     *                            result shape
     */
    public <R> BatchResult<R> toBatchResult(final RpcMethod<?, R> method) {
        if (result == null) {
            return BatchResult.failed(error, id);
        }
        return BatchResult.ok(method.decodeResult(result), id);
    }
}
