package com.eden.gateway.proxy;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import lombok.Value;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Throwaway HTTP backend for proxy tests. Records what it receives and answers
 * with a fixed status, body and headers, optionally after a delay.
 */
public class TestBackend implements AutoCloseable {

    private final HttpServer server;
    private final BlockingQueue<Received> received = new LinkedBlockingQueue<>();
    private volatile int status = 200;
    private volatile String body = "{\"ok\":true}";
    private volatile Map<String, String> responseHeaders = Map.of("Content-Type", "application/json");
    private volatile Duration delay = Duration.ZERO;
    private volatile boolean chunked;

    public TestBackend() {
        try {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/", this::handle);
        server.start();
    }

    public TestBackend respondWith(int status, String body) {
        this.status = status;
        this.body = body;
        return this;
    }

    public TestBackend withHeaders(Map<String, String> headers) {
        this.responseHeaders = headers;
        return this;
    }

    public TestBackend withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public TestBackend withChunkedBody() {
        this.chunked = true;
        return this;
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + port();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    /**
     * Next request the backend received, waiting up to two seconds
     */
    public Received takeRequest() throws InterruptedException {
        Received next = received.poll(2, TimeUnit.SECONDS);
        if (next == null) {
            throw new AssertionError("backend received no request");
        }
        return next;
    }

    public boolean hasPendingRequests() {
        return !received.isEmpty();
    }

    /**
     * A local port nothing listens on
     */
    public static int unusedPort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        byte[] requestBody = exchange.getRequestBody().readAllBytes();
        received.add(new Received(exchange.getRequestMethod(), exchange.getRequestURI().toString(),
                exchange.getRequestHeaders(), new String(requestBody, StandardCharsets.UTF_8)));
        try {
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
            responseHeaders.forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            long length = chunked ? 0 : (bytes.length == 0 ? -1 : bytes.length);
            exchange.sendResponseHeaders(status, length);
            if (bytes.length > 0) {
                exchange.getResponseBody().write(bytes);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            // client gave up (timeout tests)
        } finally {
            exchange.close();
        }
    }

    @Value
    public static class Received {
        String method;
        String uri;
        Headers headers;
        String body;
    }
}
