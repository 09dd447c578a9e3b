// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import io.ethrpc.core.EthRpcDebug;
import io.ethrpc.core.error.TransportException;

class HttpTransportTest {

    private HttpServer server;
    private URI baseUri;
    private HttpTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.close();
        }
        server.stop(0);
    }

    @Test
    void postsJsonAndReturnsBodyVerbatim() {
        AtomicReference<String> received = new AtomicReference<>();
        AtomicReference<String> contentType = new AtomicReference<>();
        AtomicReference<String> method = new AtomicReference<>();
        server.createContext("/", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            method.set(exchange.getRequestMethod());
            respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":\"0x1\",\"id\":1}");
        });
        transport = HttpTransport.builder(baseUri.toString()).build();

        String reply = transport.send("{\"jsonrpc\":\"2.0\",\"method\":\"eth_chainId\",\"params\":[],\"id\":1}");

        assertEquals("{\"jsonrpc\":\"2.0\",\"result\":\"0x1\",\"id\":1}", reply);
        assertEquals("{\"jsonrpc\":\"2.0\",\"method\":\"eth_chainId\",\"params\":[],\"id\":1}", received.get());
        assertEquals("application/json", contentType.get());
        assertEquals("POST", method.get());
    }

    @Test
    void payloadLoggingShowsBodiesWithoutSecrets() {
        Logger debug = (Logger) LoggerFactory.getLogger("io.ethrpc.debug");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        debug.addAppender(appender);
        EthRpcDebug.setPayloadLogging(true);
        try {
            server.createContext("/", exchange -> respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":true,\"id\":3}"));
            transport = HttpTransport.builder(baseUri.toString()).build();

            transport.send("{\"jsonrpc\":\"2.0\",\"method\":\"personal_unlockAccount\","
                    + "\"params\":[\"0xabc\",\"hunter2\",300],\"id\":3}");

            List<String> lines = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
            assertTrue(lines.stream().anyMatch(
                    line -> line.startsWith("[HTTP-SEND] ") && line.contains("personal_unlockAccount")));
            assertTrue(lines.stream().anyMatch(
                    line -> line.startsWith("[HTTP-RECV] status=200 ") && line.contains("\"result\":true")));
            assertTrue(lines.stream().noneMatch(line -> line.contains("hunter2")));
        } finally {
            EthRpcDebug.setPayloadLogging(false);
            debug.detachAppender(appender);
        }
    }

    @Test
    void sendsConfiguredHeaders() {
        AtomicReference<String> auth = new AtomicReference<>();
        server.createContext("/", exchange -> {
            auth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, "{}");
        });
        transport = HttpTransport.builder(baseUri.toString()).header("Authorization", "Bearer abc").build();

        transport.send("{}");

        assertEquals("Bearer abc", auth.get());
    }

    @Test
    void nonSuccessStatusCarriesStatusAndBody() {
        server.createContext("/", exchange -> respond(exchange, 429, "slow down"));
        transport = HttpTransport.builder(baseUri.toString()).build();

        TransportException ex = assertThrows(TransportException.class, () -> transport.send("{}"));

        assertEquals(429, ex.status());
        assertEquals("slow down", ex.body());
        assertEquals("HTTP 429 error: slow down", ex.getMessage());
    }

    @Test
    void connectionFailureIsTransportError() throws IOException {
        server.stop(0);
        transport = HttpTransport.builder(baseUri.toString()).connectTimeout(Duration.ofSeconds(1)).build();

        TransportException ex = assertThrows(TransportException.class, () -> transport.send("{}"));

        assertNull(ex.status());
        assertInstanceOf(IOException.class, ex.getCause());
        server = HttpServer.create(new InetSocketAddress(0), 0);
    }

    @Test
    void sendAsyncCompletesWithBody() throws Exception {
        server.createContext("/", exchange -> respond(exchange, 200, "[]"));
        transport = HttpTransport.builder(baseUri.toString()).build();

        CompletableFuture<String> reply = transport.sendAsync("[]");

        assertEquals("[]", reply.get(5, TimeUnit.SECONDS));
    }

    @Test
    void sendAsyncReportsStatusThroughFuture() {
        server.createContext("/", exchange -> respond(exchange, 502, "bad gateway"));
        transport = HttpTransport.builder(baseUri.toString()).build();

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> transport.sendAsync("{}").get(5, TimeUnit.SECONDS));

        TransportException cause = assertInstanceOf(TransportException.class, ex.getCause());
        assertEquals(502, cause.status());
    }

    @Test
    void closedTransportRejectsRequests() {
        transport = HttpTransport.builder(baseUri.toString()).build();
        transport.close();

        assertThrows(IllegalStateException.class, () -> transport.send("{}"));
    }

    @Test
    void configAppliesDefaults() {
        transport = HttpTransport.builder(baseUri.toString()).readTimeout(null).build();

        assertEquals(Duration.ofSeconds(10), transport.config().connectTimeout());
        assertEquals(Duration.ofSeconds(30), transport.config().readTimeout());
        assertTrue(transport.config().headers().isEmpty());
        assertTrue(transport.supportsConcurrentRequests());
    }

    @Test
    void rejectsNonHttpUrls() {
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.withDefaults("ws://localhost:8546"));
        assertThrows(IllegalArgumentException.class,
                () -> new TransportConfig("http://localhost:8545", Duration.ZERO, null, null));
    }

    private static void respond(final HttpExchange exchange, final int statusCode, final String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
