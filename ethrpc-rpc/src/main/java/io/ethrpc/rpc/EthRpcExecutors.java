// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the threads ethrpc runs on.
 *
 * <p>
 * All threads are daemon threads with a recognizable name, so they never keep
 * the JVM alive and show up clearly in thread dumps.
 */
public final class EthRpcExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);
    private static final AtomicInteger BUFFERED_THREAD_ID = new AtomicInteger(0);

    private EthRpcExecutors() {
        // Utility class
    }

    /**
     * Creates an executor for I/O-bound work such as round trips. Threads are
     * created on demand, reused while busy, and named {@code ethrpc-io-N}.
     *
     * @return a cached thread pool of daemon threads
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(daemonFactory("ethrpc-io-", IO_THREAD_ID));
    }

    /**
     * Starts the background worker of a buffered client on a new daemon
     * thread named {@code ethrpc-buffered-N}.
     *
     * @param worker the worker loop
     * @return the started thread
     */
    public static Thread startBufferedWorker(final Runnable worker) {
        final Thread thread = daemonFactory("ethrpc-buffered-", BUFFERED_THREAD_ID).newThread(worker);
        thread.start();
        return thread;
    }

    private static ThreadFactory daemonFactory(final String prefix, final AtomicInteger ids) {
        return r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            final int id = ids.getAndIncrement() & 0x7FFFFFFF;
            final Thread t = new Thread(r, prefix + id);
            t.setDaemon(true);
            return t;
        };
    }
}
