// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.util.Comparator;
import java.util.concurrent.CompletableFuture;

import io.ethrpc.core.jsonrpc.Id;
import io.ethrpc.core.jsonrpc.JsonRpcCodec;
import io.ethrpc.core.jsonrpc.JsonRpcRequest;
import io.ethrpc.core.jsonrpc.JsonRpcResponse;
import io.ethrpc.core.jsonrpc.RpcMethod;

/**
 * A call waiting in a {@link BufferedClient} queue: the serialized request
 * and the future its response is delivered to.
 */
final class PendingCall {

    static final Comparator<PendingCall> BY_ID = Comparator.comparing(PendingCall::id);

    /** Queue marker telling the worker to flush and stop. Never dispatched. */
    static final PendingCall SHUTDOWN = new PendingCall(Id.of(0), "<shutdown>", "");

    private final Id id;
    private final String method;
    private final String body;
    private final CompletableFuture<JsonRpcResponse> future = new CompletableFuture<>();

    private PendingCall(final Id id, final String method, final String body) {
        this.id = id;
        this.method = method;
        this.body = body;
    }

    static <P> PendingCall create(final RpcMethod<P, ?> method, final P params) {
        final JsonRpcRequest request = JsonRpcRequest.create(method, params);
        return new PendingCall(request.id(), request.method(), JsonRpcCodec.write(request));
    }

    Id id() {
        return id;
    }

    String method() {
        return method;
    }

    String body() {
        return body;
    }

    CompletableFuture<JsonRpcResponse> future() {
        return future;
    }

    /**
     * Delivers the response. A no-op if the caller already cancelled.
     */
    void complete(final JsonRpcResponse response) {
        future.complete(response);
    }

    void fail(final Throwable failure) {
        future.completeExceptionally(failure);
    }

    @Override
    public String toString() {
        return "PendingCall[" + method + " id=" + id + "]";
    }
}
