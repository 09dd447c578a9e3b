// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of an {@link HttpTransport}.
 *
 * @param url            the JSON-RPC endpoint
 * @param connectTimeout TCP connect timeout (default 10s)
 * @param readTimeout    per-request timeout (default 30s)
 * @param headers        extra HTTP headers sent with every request
 */
public record TransportConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public TransportConfig {
        Objects.requireNonNull(url, "url");
        final String scheme = URI.create(url).getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("url must be an http(s) URL: " + url);
        }
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportConfig withDefaults(final String url) {
        return new TransportConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
