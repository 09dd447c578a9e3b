// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.ethrpc.core.error.RpcException;
import io.ethrpc.core.jsonrpc.Batch;
import io.ethrpc.core.jsonrpc.BatchResult;
import io.ethrpc.core.jsonrpc.Empty;
import io.ethrpc.core.jsonrpc.JsonRpc;
import io.ethrpc.core.jsonrpc.RpcMethod;

/**
 * A JSON-RPC client bound to one {@link RpcTransport}.
 *
 * <h2>Example usage:</h2>
 * <pre>{@code
 * // Transport created internally, closed with the client
 * try (EthRpcClient client = EthRpcClient.create("http://localhost:8545")) {
 *     BigInteger blockNumber = client.call(Eth.BLOCK_NUMBER);
 * }
 *
 * // Existing transport (caller manages its lifecycle)
 * EthRpcClient client = EthRpcClient.from(transport);
 * String version = client.call(Web3.CLIENT_VERSION);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe if the underlying
 * {@link RpcTransport} is thread-safe.
 *
 * <p><b>Resource Management:</b> When created from a URL, {@link #close()}
 * closes the transport. When created from an existing transport, the caller
 * is responsible for closing it and {@link #close()} is a no-op.
 */
public final class EthRpcClient implements AutoCloseable {

    /** Environment variable {@link #fromEnv()} reads the node URL from. */
    public static final String ENV_VAR = "ETHRPC";

    private final RpcTransport transport;
    private final boolean ownsTransport;

    private EthRpcClient(final RpcTransport transport, final boolean ownsTransport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.ownsTransport = ownsTransport;
    }

    /**
     * Creates a client with its own {@link HttpTransport}.
     */
    public static EthRpcClient create(final String url) {
        return new EthRpcClient(RpcTransport.http(url), true);
    }

    public static EthRpcClient from(final RpcTransport transport) {
        return new EthRpcClient(transport, false);
    }

    /**
     * Creates a client for the URL in the {@value #ENV_VAR} environment
     * variable.
     *
     * @throws IllegalStateException if the variable is not set
     */
    public static EthRpcClient fromEnv() {
        return fromEnv(System.getenv());
    }

    static EthRpcClient fromEnv(final Map<String, String> env) {
        final String url = env.get(ENV_VAR);
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("missing " + ENV_VAR + " environment variable");
        }
        return create(url.trim());
    }

    public <P, R> R call(final RpcMethod<P, R> method, final P params) {
        return JsonRpc.call(method, params, transport::send);
    }

    public <R> R call(final RpcMethod<Empty, R> method) {
        return call(method, Empty.INSTANCE);
    }

    public <P, R> CompletableFuture<R> callAsync(final RpcMethod<P, R> method, final P params) {
        return JsonRpc.callAsync(method, params, transport::sendAsync);
    }

    public <R> CompletableFuture<R> callAsync(final RpcMethod<Empty, R> method) {
        return callAsync(method, Empty.INSTANCE);
    }

    /**
     * Sends a batch and returns one outcome per call, in submission order.
     */
    public List<BatchResult<?>> tryBatch(final Batch batch) {
        return JsonRpc.tryBatch(batch, JsonRpc.overText(transport::send));
    }

    /**
     * Sends a batch and returns the values in submission order.
     *
     * @throws RpcException for the first call that failed
     */
    public List<Object> batch(final Batch batch) {
        return JsonRpc.batch(batch, JsonRpc.overText(transport::send));
    }

    public CompletableFuture<List<BatchResult<?>>> tryBatchAsync(final Batch batch) {
        return JsonRpc.tryBatchAsync(batch, JsonRpc.overTextAsync(transport::sendAsync));
    }

    /**
     * Creates a client that coalesces concurrent calls over this client's
     * transport. Closing it does not close the transport.
     */
    public BufferedClient buffered(final BufferedConfig config) {
        return new BufferedClient(transport, config);
    }

    public BufferedClient buffered() {
        return buffered(BufferedConfig.defaults());
    }

    public RpcTransport transport() {
        return transport;
    }

    @Override
    public void close() {
        if (ownsTransport) {
            transport.close();
        }
    }
}
