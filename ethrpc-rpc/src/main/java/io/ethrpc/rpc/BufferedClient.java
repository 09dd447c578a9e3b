// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ethrpc.core.DebugLogger;
import io.ethrpc.core.LogFormatter;
import io.ethrpc.core.error.EthRpcException;
import io.ethrpc.core.error.JsonCodecException;
import io.ethrpc.core.error.RpcException;
import io.ethrpc.core.error.SharedFailure;
import io.ethrpc.core.error.TransportException;
import io.ethrpc.core.jsonrpc.BatchCorrelator;
import io.ethrpc.core.jsonrpc.Empty;
import io.ethrpc.core.jsonrpc.Id;
import io.ethrpc.core.jsonrpc.JsonRpcCodec;
import io.ethrpc.core.jsonrpc.JsonRpcResponse;
import io.ethrpc.core.jsonrpc.RpcMethod;

/**
 * Client that transparently coalesces concurrent calls into JSON-RPC batches.
 *
 * <p>
 * Callers use it like a plain client. Calls are queued; a single background
 * worker groups whatever is waiting into chunks of at most
 * {@link BufferedConfig#maxBatchSize()} calls and sends each chunk in one
 * round trip. With the default zero delay only calls that are already
 * queued when the worker wakes up are coalesced, so a lone caller pays no
 * latency.
 *
 * <pre>{@code
 * try (BufferedClient client = new BufferedClient(transport, BufferedConfig.defaults())) {
 *     List<CompletableFuture<JsonValue>> blocks = new ArrayList<>();
 *     for (long n = 0; n < 100; n++) {
 *         blocks.add(client.callAsync(Eth.GET_BLOCK_BY_NUMBER, new Eth.BlockQuery(BlockSpec.number(n), false)));
 *     }
 *     CompletableFuture.allOf(blocks.toArray(CompletableFuture[]::new)).join();
 * }
 * }</pre>
 *
 * <p>
 * <strong>Errors:</strong> a JSON-RPC error or an undecodable result only
 * fails the call it belongs to. When a whole round trip fails (transport
 * error, malformed body, mismatched batch) every call of the chunk fails with
 * its own copy of the same exception.
 *
 * <p>
 * <strong>Lifecycle:</strong> {@link #close()} stops intake, waits for the
 * worker to flush everything already queued and for in-flight round trips to
 * finish. It does not close the transport. Calls made after close throw
 * {@link IllegalStateException}.
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 */
public final class BufferedClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BufferedClient.class);

    static final String WORKER_STOPPED = "background worker unexpectedly stopped";
    private static final long DISPATCH_SHUTDOWN_SECONDS = 30;

    /**
     * What the worker is doing, for diagnostics.
     */
    public enum State {
        /** Waiting for the first call of the next chunk. */
        IDLE,
        /** Holding a chunk open for more calls. */
        COLLECTING,
        /** Handing a chunk to the dispatch executor. */
        DISPATCHING,
        /** Closed and fully drained. */
        TERMINATED
    }

    private final RpcTransport transport;
    private final BufferedConfig config;
    private final LinkedBlockingQueue<PendingCall> queue = new LinkedBlockingQueue<>();
    private final @Nullable Semaphore permits;
    private final ExecutorService dispatcher;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final CountDownLatch workerDone = new CountDownLatch(1);
    private volatile String stopReason = "BufferedClient is closed";

    // Calls taken off the queue but not yet handed to the dispatcher. Worker thread only.
    private List<PendingCall> inHand = List.of();

    public BufferedClient(final RpcTransport transport, final BufferedConfig config) {
        this(transport, config, EthRpcExecutors::startBufferedWorker);
    }

    BufferedClient(final RpcTransport transport, final BufferedConfig config, final Executor workerExecutor) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.permits = createPermits(transport, config);
        this.dispatcher = EthRpcExecutors.newIoBoundExecutor();
        workerExecutor.execute(this::runWorker);
    }

    /**
     * Performs a call and blocks until its result is available.
     *
     * @throws RpcException          if the node answered with an error
     * @throws JsonCodecException    if params or result cannot be converted
     * @throws TransportException    if the round trip failed
     * @throws IllegalStateException if the client is closed or its worker
     *                               stopped
     */
    public <P, R> R call(final RpcMethod<P, R> method, final P params) {
        return await(callAsync(method, params));
    }

    public <R> R call(final RpcMethod<Empty, R> method) {
        return call(method, Empty.INSTANCE);
    }

    /**
     * Queues a call. The returned future completes with the decoded result or
     * exceptionally with the same exceptions {@link #call} throws.
     *
     * @throws IllegalStateException if the client is closed
     */
    public <P, R> CompletableFuture<R> callAsync(final RpcMethod<P, R> method, final P params) {
        ensureOpen();
        final PendingCall call;
        try {
            call = PendingCall.create(method, params);
        } catch (JsonCodecException e) {
            return CompletableFuture.failedFuture(e);
        }
        queue.add(call);
        if (workerDone.getCount() == 0 && queue.remove(call)) {
            // The worker is gone and will not see this call.
            call.fail(new IllegalStateException(stopReason));
        }
        return call.future().thenApply(response -> response.result(method));
    }

    public <R> CompletableFuture<R> callAsync(final RpcMethod<Empty, R> method) {
        return callAsync(method, Empty.INSTANCE);
    }

    public State state() {
        return state.get();
    }

    public BufferedConfig config() {
        return config;
    }

    /**
     * Returns the number of calls waiting for the worker.
     */
    int queuedCalls() {
        int count = 0;
        for (PendingCall call : queue) {
            if (call != PendingCall.SHUTDOWN) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queue.add(PendingCall.SHUTDOWN);
        try {
            workerDone.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for buffered worker to flush", e);
        }
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(DISPATCH_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("In-flight round trips did not finish within {}s, interrupting", DISPATCH_SHUTDOWN_SECONDS);
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down dispatch executor", e);
            dispatcher.shutdownNow();
        }
        state.set(State.TERMINATED);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("BufferedClient is closed");
        }
    }

    private void runWorker() {
        log.debug("Buffered worker started (maxBatchSize={}, delay={})", config.maxBatchSize(), config.delay());
        boolean stopped = false;
        boolean clean = false;
        try {
            while (!stopped) {
                state.set(State.IDLE);
                final PendingCall first = queue.take();
                if (first == PendingCall.SHUTDOWN) {
                    break;
                }
                state.set(State.COLLECTING);
                final List<PendingCall> chunk = new ArrayList<>(config.maxBatchSize());
                chunk.add(first);
                inHand = chunk;
                stopped = collect(chunk);
                dispatch(chunk, chunk.size() == config.maxBatchSize() ? "full" : stopped ? "close" : "drained");
            }
            flushRemaining();
            clean = true;
            log.debug("Buffered worker stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Buffered worker interrupted, failing {} queued calls", queuedCalls() + inHand.size(), e);
        } catch (RuntimeException | Error e) {
            log.error("Buffered worker died, failing {} queued calls", queuedCalls() + inHand.size(), e);
        } finally {
            if (!clean) {
                stopReason = WORKER_STOPPED;
                failAll(inHand, WORKER_STOPPED, null);
            }
            workerDone.countDown();
            failQueued();
        }
    }

    /**
     * Adds calls to {@code chunk} until it is full or the delay elapsed since
     * the chunk was opened. Calls already queued are always taken first.
     *
     * @return true if the shutdown marker was seen
     */
    private boolean collect(final List<PendingCall> chunk) throws InterruptedException {
        final long delayNanos = config.delay().toNanos();
        final long deadline = System.nanoTime() + delayNanos;
        while (chunk.size() < config.maxBatchSize()) {
            PendingCall next = queue.poll();
            if (next == null && delayNanos > 0) {
                final long remaining = deadline - System.nanoTime();
                if (remaining > 0) {
                    next = queue.poll(remaining, TimeUnit.NANOSECONDS);
                }
            }
            if (next == null) {
                break;
            }
            if (next == PendingCall.SHUTDOWN) {
                return true;
            }
            chunk.add(next);
        }
        return false;
    }

    private void flushRemaining() throws InterruptedException {
        List<PendingCall> chunk = drainChunk();
        while (!chunk.isEmpty()) {
            inHand = chunk;
            dispatch(chunk, "close");
            chunk = drainChunk();
        }
    }

    private List<PendingCall> drainChunk() {
        final List<PendingCall> chunk = new ArrayList<>(config.maxBatchSize());
        while (chunk.size() < config.maxBatchSize()) {
            final PendingCall next = queue.poll();
            if (next == null) {
                break;
            }
            if (next != PendingCall.SHUTDOWN) {
                chunk.add(next);
            }
        }
        return chunk;
    }

    private void dispatch(final List<PendingCall> chunk, final String reason) throws InterruptedException {
        state.set(State.DISPATCHING);
        DebugLogger.logBatch(LogFormatter.formatBufferFlush(chunk.size(), reason, queue.size()));
        if (permits != null) {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                failAll(chunk, WORKER_STOPPED, e);
                throw e;
            }
        }
        try {
            dispatcher.execute(() -> {
                try {
                    roundtrip(chunk);
                } finally {
                    if (permits != null) {
                        permits.release();
                    }
                }
            });
            inHand = List.of();
        } catch (RejectedExecutionException e) {
            if (permits != null) {
                permits.release();
            }
            failAll(chunk, WORKER_STOPPED, e);
        }
    }

    private void roundtrip(final List<PendingCall> chunk) {
        try {
            if (chunk.size() == 1) {
                final PendingCall call = chunk.get(0);
                call.complete(JsonRpcCodec.readResponse(transport.send(call.body())));
                return;
            }
            chunk.sort(PendingCall.BY_ID);
            final List<Id> ids = new ArrayList<>(chunk.size());
            final List<String> bodies = new ArrayList<>(chunk.size());
            for (PendingCall call : chunk) {
                ids.add(call.id());
                bodies.add(call.body());
            }
            final String reply = transport.send(JsonRpcCodec.join(bodies));
            final List<JsonRpcResponse> responses =
                    BatchCorrelator.correlate(ids, JsonRpcCodec.readBatchResponse(reply));
            for (int i = 0; i < chunk.size(); i++) {
                chunk.get(i).complete(responses.get(i));
            }
        } catch (EthRpcException e) {
            fanOut(chunk, e);
        } catch (RuntimeException e) {
            fanOut(chunk, new TransportException("Round trip failed: " + e.getMessage(), e));
        }
    }

    private void fanOut(final List<PendingCall> chunk, final EthRpcException failure) {
        DebugLogger.logBatch(LogFormatter.formatBatchError(chunk.size(), failure.getMessage(), 0L));
        final SharedFailure shared = SharedFailure.of(failure);
        for (PendingCall call : chunk) {
            call.fail(shared.duplicate());
        }
    }

    private void failQueued() {
        final List<PendingCall> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        leftover.remove(PendingCall.SHUTDOWN);
        if (leftover.isEmpty()) {
            return;
        }
        failAll(leftover, stopReason, null);
    }

    private static void failAll(final List<PendingCall> calls, final String message, final @Nullable Throwable cause) {
        for (PendingCall call : calls) {
            call.fail(new IllegalStateException(message, cause));
        }
    }

    private static @Nullable Semaphore createPermits(final RpcTransport transport, final BufferedConfig config) {
        if (!transport.supportsConcurrentRequests()) {
            return new Semaphore(1);
        }
        final Integer max = config.maxConcurrentRequests();
        return max == null ? null : new Semaphore(max);
    }

    private static <R> R await(final CompletableFuture<R> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for JSON-RPC response", e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }
}
