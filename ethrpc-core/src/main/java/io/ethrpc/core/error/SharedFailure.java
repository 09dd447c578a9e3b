// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.error;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A failure of one round trip that has to be reported to several callers.
 *
 * <p>When a batched round trip fails as a whole, every call that rode on it
 * must observe the failure. Handing the same exception instance to several
 * threads would let them race on its suppressed list and stack trace, so
 * each caller gets its own copy from {@link #duplicate()}. Copies keep the
 * message, the type-specific fields and the stack trace of the original, and
 * reference the very same root cause, which is never copied.
 *
 * <p>This is the only way to duplicate an {@link EthRpcException}; the
 * exceptions themselves are not cloneable.
 *
 * <pre>{@code
 * SharedFailure failure = SharedFailure.of(transportError);
 * for (PendingCall call : chunk) {
 *     call.fail(failure.duplicate());
 * }
 * }</pre>
 */
public final class SharedFailure {

    private final EthRpcException original;
    private final AtomicInteger duplicates = new AtomicInteger();

    private SharedFailure(final EthRpcException original) {
        this.original = original;
    }

    public static SharedFailure of(final EthRpcException failure) {
        return new SharedFailure(Objects.requireNonNull(failure, "failure"));
    }

    /**
     * Returns a new exception equivalent to the shared one.
     *
     * @return a fresh exception of the same type, sharing the root cause
     */
    public EthRpcException duplicate() {
        duplicates.incrementAndGet();
        final EthRpcException copy = original.duplicate();
        copy.setStackTrace(original.getStackTrace());
        return copy;
    }

    /**
     * Returns the message every duplicate carries.
     */
    public String message() {
        return original.getMessage();
    }

    /**
     * Returns how many duplicates have been handed out so far.
     */
    public int duplicateCount() {
        return duplicates.get();
    }

    @Override
    public String toString() {
        return "SharedFailure{" + original + ", duplicates=" + duplicates.get() + "}";
    }
}
