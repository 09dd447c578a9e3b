// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

import io.ethrpc.core.DebugLogger;
import io.ethrpc.core.LogFormatter;
import io.ethrpc.core.error.BatchCorrelationException;
import io.ethrpc.core.error.EthRpcException;
import io.ethrpc.core.error.JsonCodecException;
import io.ethrpc.core.error.RpcException;

/**
 * Transport-agnostic JSON-RPC 2.0 engine.
 *
 * <p>
 * The engine builds envelopes, hands them to a caller-supplied round trip
 * and interprets what comes back. It never opens a connection itself and
 * never retries.
 *
 * <p>
 * <strong>Single call:</strong>
 *
 * <pre>{@code
 * BigInteger block = JsonRpc.call(Eth.BLOCK_NUMBER, Empty.INSTANCE, transport::send);
 * }</pre>
 *
 * <p>
 * <strong>Batch:</strong>
 *
 * <pre>{@code
 * Batch batch = Batch.create();
 * BatchHandle<String> version = batch.add(Web3.CLIENT_VERSION);
 * BatchHandle<BigInteger> block = batch.add(Eth.BLOCK_NUMBER);
 * JsonRpc.tryBatch(batch, JsonRpc.overText(transport::send));
 * }</pre>
 *
 * <p>
 * All methods are stateless and thread-safe; ids come from the process-wide
 * {@link Id#next()} counter.
 */
public final class JsonRpc {

    /** The protocol version every envelope carries. */
    public static final String VERSION = "2.0";

    private JsonRpc() {
        // Utility class
    }

    /**
     * Performs a single call.
     *
     * @throws JsonCodecException if params or result cannot be converted, or
     *                            the response is malformed
     * @throws RpcException       if the node answered with an error
     * @throws EthRpcException    whatever the round trip throws
     */
    public static <P, R> R call(
            final RpcMethod<P, R> method, final P params, final RoundTrip<String, String> roundtrip) {
        Objects.requireNonNull(roundtrip, "roundtrip");
        final JsonRpcRequest request = JsonRpcRequest.create(method, params);
        final long start = System.nanoTime();
        final String body = roundtrip.roundtrip(JsonRpcCodec.write(request));
        return interpret(method, request, JsonRpcCodec.readResponse(body), start);
    }

    /**
     * Performs a single call through an asynchronous round trip. Encoding
     * failures are reported through the returned future.
     */
    public static <P, R> CompletableFuture<R> callAsync(
            final RpcMethod<P, R> method,
            final P params,
            final Function<String, CompletableFuture<String>> roundtrip) {
        Objects.requireNonNull(roundtrip, "roundtrip");
        final JsonRpcRequest request;
        final String body;
        try {
            request = JsonRpcRequest.create(method, params);
            body = JsonRpcCodec.write(request);
        } catch (JsonCodecException e) {
            return CompletableFuture.failedFuture(e);
        }
        final long start = System.nanoTime();
        return roundtrip.apply(body)
                .thenApply(reply -> interpret(method, request, JsonRpcCodec.readResponse(reply), start));
    }

    /**
     * Executes a batch and returns one outcome per call, in submission order.
     * Each call's handle is completed as well. An empty batch returns an
     * empty list without invoking the round trip.
     *
     * @throws BatchCorrelationException if the responses do not match the
     *                                   requests
     * @throws JsonCodecException        if any result cannot be decoded
     */
    public static List<BatchResult<?>> tryBatch(
            final Batch batch, final RoundTrip<List<JsonRpcRequest>, List<JsonRpcResponse>> roundtrip) {
        Objects.requireNonNull(roundtrip, "roundtrip");
        if (batch.isEmpty()) {
            batch.requests();
            return List.of();
        }
        final List<JsonRpcRequest> requests = batch.requests();
        final long start = System.nanoTime();
        try {
            final List<JsonRpcResponse> responses = roundtrip.roundtrip(requests);
            return finish(batch, requests, responses, start);
        } catch (EthRpcException e) {
            logBatchFailure(requests.size(), e, start);
            throw e;
        }
    }

    /**
     * Executes a batch and returns the decoded values in submission order.
     *
     * @throws RpcException if any call failed; the first failure in
     *                      submission order is thrown
     */
    public static List<Object> batch(
            final Batch batch, final RoundTrip<List<JsonRpcRequest>, List<JsonRpcResponse>> roundtrip) {
        return values(tryBatch(batch, roundtrip));
    }

    public static CompletableFuture<List<BatchResult<?>>> tryBatchAsync(
            final Batch batch,
            final Function<List<JsonRpcRequest>, CompletableFuture<List<JsonRpcResponse>>> roundtrip) {
        Objects.requireNonNull(roundtrip, "roundtrip");
        final List<JsonRpcRequest> requests;
        try {
            requests = batch.requests();
        } catch (JsonCodecException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (requests.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        final long start = System.nanoTime();
        return roundtrip.apply(requests)
                .thenApply(responses -> finish(batch, requests, responses, start))
                .whenComplete((results, failure) -> {
                    if (failure != null) {
                        logBatchFailure(requests.size(), unwrap(failure), start);
                    }
                });
    }

    public static CompletableFuture<List<Object>> batchAsync(
            final Batch batch,
            final Function<List<JsonRpcRequest>, CompletableFuture<List<JsonRpcResponse>>> roundtrip) {
        return tryBatchAsync(batch, roundtrip).thenApply(JsonRpc::values);
    }

    /**
     * Calls the same method once per params element in a single batch.
     */
    public static <P, R> List<BatchResult<R>> tryBatchAll(
            final RpcMethod<P, R> method,
            final List<P> params,
            final RoundTrip<List<JsonRpcRequest>, List<JsonRpcResponse>> roundtrip) {
        final Batch batch = Batch.create();
        final List<BatchHandle<R>> handles = new ArrayList<>(params.size());
        for (P p : params) {
            handles.add(batch.add(method, p));
        }
        tryBatch(batch, roundtrip);
        final List<BatchResult<R>> results = new ArrayList<>(handles.size());
        for (BatchHandle<R> handle : handles) {
            results.add(handle.result());
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * Like {@link #tryBatchAll} but returns plain values.
     *
     * @throws RpcException for the first failed call
     */
    public static <P, R> List<R> batchAll(
            final RpcMethod<P, R> method,
            final List<P> params,
            final RoundTrip<List<JsonRpcRequest>, List<JsonRpcResponse>> roundtrip) {
        final List<BatchResult<R>> results = tryBatchAll(method, params, roundtrip);
        final List<R> values = new ArrayList<>(results.size());
        for (BatchResult<R> result : results) {
            values.add(result.getOrThrow());
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Adapts a text round trip into a batch round trip: requests are written
     * as one JSON array and the reply is read with
     * {@link JsonRpcCodec#readBatchResponse(String)}.
     */
    public static RoundTrip<List<JsonRpcRequest>, List<JsonRpcResponse>> overText(
            final RoundTrip<String, String> roundtrip) {
        Objects.requireNonNull(roundtrip, "roundtrip");
        return requests -> JsonRpcCodec.readBatchResponse(roundtrip.roundtrip(JsonRpcCodec.writeBatch(requests)));
    }

    /**
     * Asynchronous counterpart of {@link #overText(RoundTrip)}.
     */
    public static Function<List<JsonRpcRequest>, CompletableFuture<List<JsonRpcResponse>>> overTextAsync(
            final Function<String, CompletableFuture<String>> roundtrip) {
        Objects.requireNonNull(roundtrip, "roundtrip");
        return requests -> {
            final String body;
            try {
                body = JsonRpcCodec.writeBatch(requests);
            } catch (JsonCodecException e) {
                return CompletableFuture.failedFuture(e);
            }
            return roundtrip.apply(body).thenApply(JsonRpcCodec::readBatchResponse);
        };
    }

    static void requireVersion(final String version) {
        if (!VERSION.equals(version)) {
            throw new IllegalArgumentException("jsonrpc must be \"" + VERSION + "\" but was " + version);
        }
    }

    private static <R> R interpret(
            final RpcMethod<?, R> method,
            final JsonRpcRequest request,
            final JsonRpcResponse response,
            final long start) {
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        if (response.hasError()) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method.name(), response.error().code(), response.error().message(), durationMicros));
        } else {
            DebugLogger.logRpc(LogFormatter.formatRpc(method.name(), request.id(), durationMicros));
        }
        return response.result(method);
    }

    private static List<BatchResult<?>> finish(
            final Batch batch,
            final List<JsonRpcRequest> requests,
            final List<JsonRpcResponse> responses,
            final long start) {
        final List<Id> ids = new ArrayList<>(requests.size());
        for (JsonRpcRequest request : requests) {
            ids.add(request.id());
        }
        final List<BatchResult<?>> results = batch.complete(BatchCorrelator.correlate(ids, responses));
        int failed = 0;
        for (BatchResult<?> result : results) {
            if (!result.success()) {
                failed++;
            }
        }
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logBatch(LogFormatter.formatBatch(
                requests.size(), ids.get(0), ids.get(ids.size() - 1), failed, durationMicros));
        return results;
    }

    private static List<Object> values(final List<BatchResult<?>> results) {
        final List<Object> values = new ArrayList<>(results.size());
        for (BatchResult<?> result : results) {
            values.add(result.getOrThrow());
        }
        return Collections.unmodifiableList(values);
    }

    private static void logBatchFailure(final int size, final Throwable failure, final long start) {
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logBatch(LogFormatter.formatBatchError(size, failure.getMessage(), durationMicros));
    }

    private static Throwable unwrap(final Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
