// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered collection of calls sent together as one JSON-RPC batch.
 *
 * <p>
 * Each {@link #add} returns a typed {@link BatchHandle}; results are also
 * returned in submission order by {@link JsonRpc#tryBatch}. A batch can be
 * executed once.
 *
 * <p>
 * <strong>Example:</strong>
 *
 * <pre>{@code
 * Batch batch = Batch.create();
 * BatchHandle<String> version = batch.add(Web3.CLIENT_VERSION);
 * BatchHandle<BigInteger> chainId = batch.add(Eth.CHAIN_ID);
 * client.batch(batch);
 *
 * System.out.println(version.get() + " on chain " + chainId.get());
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; build a batch on one thread.
 */
public final class Batch {

    private final List<Entry<?, ?>> entries = new ArrayList<>();
    private boolean prepared;

    private Batch() {
    }

    public static Batch create() {
        return new Batch();
    }

    /**
     * Adds a call and returns the handle its result will be delivered to.
     *
     * @throws IllegalStateException if the batch was already executed
     */
    public <P, R> BatchHandle<R> add(final RpcMethod<P, R> method, final P params) {
        Objects.requireNonNull(method, "method");
        if (prepared) {
            throw new IllegalStateException("Batch has already been executed");
        }
        final Entry<P, R> entry = new Entry<>(method, params, new BatchHandle<>());
        entries.add(entry);
        return entry.handle;
    }

    /**
     * Adds a call to a method without params.
     */
    public <R> BatchHandle<R> add(final RpcMethod<Empty, R> method) {
        return add(method, Empty.INSTANCE);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Encodes every call and allocates ids in submission order.
     */
    List<JsonRpcRequest> requests() {
        if (prepared) {
            throw new IllegalStateException("Batch has already been executed");
        }
        prepared = true;
        final List<JsonRpcRequest> requests = new ArrayList<>(entries.size());
        for (Entry<?, ?> entry : entries) {
            requests.add(entry.request());
        }
        return requests;
    }

    /**
     * Decodes correlated responses and completes the handles. Handles are
     * only completed once every response decoded.
     *
     * @param responses one response per entry, in submission order
     */
    List<BatchResult<?>> complete(final List<JsonRpcResponse> responses) {
        final List<BatchResult<?>> results = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            results.add(entries.get(i).decode(responses.get(i)));
        }
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).deliver(results.get(i));
        }
        return Collections.unmodifiableList(results);
    }

    private static final class Entry<P, R> {
        private final RpcMethod<P, R> method;
        private final P params;
        private final BatchHandle<R> handle;

        Entry(final RpcMethod<P, R> method, final P params, final BatchHandle<R> handle) {
            this.method = method;
            this.params = params;
            this.handle = handle;
        }

        JsonRpcRequest request() {
            return JsonRpcRequest.create(method, params);
        }

        BatchResult<R> decode(final JsonRpcResponse response) {
            return response.toBatchResult(method);
        }

        @SuppressWarnings("unchecked")
        void deliver(final BatchResult<?> result) {
            handle.complete((BatchResult<R>) result);
        }
    }
}
