// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ethrpc.core.DebugLogger;
import io.ethrpc.core.error.TransportException;

/**
 * {@link RpcTransport} over HTTP(S) using {@link java.net.http.HttpClient}.
 *
 * <p>
 * Every round trip is a {@code POST} with {@code Content-Type:
 * application/json}. A status outside 2xx becomes a
 * {@link TransportException} carrying the status and body. With
 * {@link io.ethrpc.core.EthRpcDebug#setPayloadLogging(boolean)} on, request
 * and response bodies are logged after sanitizing.
 *
 * <pre>{@code
 * HttpTransport transport = HttpTransport.builder("http://localhost:8545")
 *         .readTimeout(Duration.ofSeconds(5))
 *         .header("Authorization", "Bearer " + token)
 *         .build();
 * }</pre>
 */
public final class HttpTransport implements RpcTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);

    private final TransportConfig config;
    private final URI uri;
    private final ExecutorService executor;
    private final HttpClient httpClient;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private HttpTransport(final TransportConfig config) {
        this.config = config;
        this.uri = URI.create(config.url());
        this.executor = EthRpcExecutors.newIoBoundExecutor();
        this.httpClient = HttpClient.newBuilder()
                .executor(executor)
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public static HttpTransport create(final TransportConfig config) {
        return new HttpTransport(config);
    }

    public TransportConfig config() {
        return config;
    }

    @Override
    public String send(final String body) {
        ensureOpen();
        final HttpRequest request = buildRequest(body);
        DebugLogger.logPayload("[HTTP-SEND]", body);
        final long start = System.nanoTime();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted during JSON-RPC round trip to " + uri, e);
        } catch (IOException e) {
            throw new TransportException("Network error during JSON-RPC round trip to " + uri, e);
        }
        return checkStatus(response, start);
    }

    @Override
    public CompletableFuture<String> sendAsync(final String body) {
        ensureOpen();
        final HttpRequest request = buildRequest(body);
        DebugLogger.logPayload("[HTTP-SEND]", body);
        final long start = System.nanoTime();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, failure) -> {
                    if (failure != null) {
                        final Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                                ? failure.getCause()
                                : failure;
                        throw new CompletionException(new TransportException(
                                "Network error during JSON-RPC round trip to " + uri, cause));
                    }
                    return checkStatus(response, start);
                });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down HTTP executor", e);
            executor.shutdownNow();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("HttpTransport is closed");
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private String checkStatus(final HttpResponse<String> response, final long start) {
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        final int status = response.statusCode();
        DebugLogger.logPayload("[HTTP-RECV] status=" + status, response.body());
        if (status < 200 || status >= 300) {
            DebugLogger.logRpc("[HTTP] status=%d duration=%dus url=%s", status, durationMicros, uri);
            throw new TransportException(status, response.body());
        }
        DebugLogger.logRpc("[HTTP] status=%d duration=%dus bytes=%d", status, durationMicros,
                response.body().length());
        return response.body();
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpTransport build() {
            return new HttpTransport(new TransportConfig(url, connectTimeout, readTimeout, headers));
        }
    }
}
