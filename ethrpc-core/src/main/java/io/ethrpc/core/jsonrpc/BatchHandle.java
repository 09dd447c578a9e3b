// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A handle to the result of an individual call within a {@link Batch}.
 *
 * <p>
 * After the batch has been executed through {@link JsonRpc#tryBatch}, the
 * result can be retrieved via {@link #result()}. Before execution, calling
 * {@link #result()} will throw an {@link IllegalStateException}.
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe. Completion uses
 * compare-and-set so that a handle can only be completed once.
 *
 * <pre>{@code
 * Batch batch = Batch.create();
 * BatchHandle<BigInteger> block = batch.add(Eth.BLOCK_NUMBER);
 * JsonRpc.tryBatch(batch, roundtrip);
 *
 * if (block.result().success()) {
 *     BigInteger number = block.result().data();
 * }
 * }</pre>
 *
 * @param <T> the type of the result data
 */
public final class BatchHandle<T> {

    private final AtomicReference<BatchResult<T>> result = new AtomicReference<>();

    BatchHandle() {
    }

    /**
     * Returns whether the batch has been executed and this handle has a result.
     */
    public boolean isComplete() {
        return result.get() != null;
    }

    /**
     * Returns the outcome of the call.
     *
     * @throws IllegalStateException if the batch has not been executed yet
     */
    public BatchResult<T> result() {
        final BatchResult<T> r = result.get();
        if (r == null) {
            throw new IllegalStateException("Batch has not been executed yet.");
        }
        return r;
    }

    /**
     * Shorthand for {@code result().getOrThrow()}.
     */
    public T get() {
        return result().getOrThrow();
    }

    void complete(final BatchResult<T> result) {
        Objects.requireNonNull(result, "result");
        if (!this.result.compareAndSet(null, result)) {
            throw new IllegalStateException("BatchHandle has already been completed");
        }
    }
}
