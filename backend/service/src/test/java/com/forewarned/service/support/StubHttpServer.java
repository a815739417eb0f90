package com.forewarned.service.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Local HTTP endpoint that records every request and answers with queued or default responses per
 * path.
 */
public final class StubHttpServer implements AutoCloseable {
    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<StubResponse>> queued = new ConcurrentHashMap<>();
    private final Map<String, StubResponse> defaults = new ConcurrentHashMap<>();

    public StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(executor);
        server.createContext("/", this::handle);
        server.start();
    }

    public void respond(String path, int status, String body) {
        defaults.put(path, new StubResponse(status, body));
    }

    public void enqueue(String path, int status, String body) {
        queued.computeIfAbsent(path, ignored -> new ArrayDeque<>()).addLast(new StubResponse(status, body));
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body;
        try (InputStream in = exchange.getRequestBody()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        String path = exchange.getRequestURI().getPath();
        requests.add(new RecordedRequest(
                exchange.getRequestMethod(),
                path,
                exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders().getFirst("Authorization"),
                exchange.getRequestHeaders().getFirst("User-Agent"),
                body
        ));
        StubResponse response = next(path);
        byte[] payload = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), payload.length == 0 ? -1 : payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private StubResponse next(String path) {
        Deque<StubResponse> pending = queued.get(path);
        if (pending != null) {
            synchronized (pending) {
                StubResponse response = pending.pollFirst();
                if (response != null) {
                    return response;
                }
            }
        }
        return defaults.getOrDefault(path, new StubResponse(404, ""));
    }

    public record RecordedRequest(
            String method,
            String path,
            String query,
            String authorization,
            String userAgent,
            String body
    ) {
    }

    private record StubResponse(int status, String body) {
    }
}
