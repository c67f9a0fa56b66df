package space.ketterling.dataviento.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

/**
 * Local stand-in for the Open-Meteo hosts. Each path serves its queued
 * responses in order and repeats the last one once the queue is down to one.
 * Unknown paths answer 404.
 */
public final class FakeOpenMeteoServer implements AutoCloseable {
    private final HttpServer server;
    private final Map<String, Deque<Reply>> replies = new HashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();

    private record Reply(int status, String body) {
    }

    public FakeOpenMeteoServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newFixedThreadPool(4));
        server.createContext("/", this::handle);
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public synchronized FakeOpenMeteoServer reply(String path, int status, String body) {
        replies.computeIfAbsent(path, k -> new ArrayDeque<>()).addLast(new Reply(status, body));
        return this;
    }

    public FakeOpenMeteoServer replyFixture(String path, String fixture) {
        return reply(path, 200, FixtureUtils.read(fixture));
    }

    /**
     * Request URIs seen so far, path and query.
     */
    public List<String> requests() {
        return Collections.unmodifiableList(requests);
    }

    public long requestCount(String path) {
        return requests.stream().filter(r -> r.startsWith(path)).count();
    }

    private void handle(HttpExchange exchange) throws IOException {
        requests.add(exchange.getRequestURI().toString());
        Reply reply = next(exchange.getRequestURI().getPath());
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(reply.status(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private synchronized Reply next(String path) {
        Deque<Reply> queue = replies.get(path);
        if (queue == null || queue.isEmpty())
            return new Reply(404, "{\"error\":true,\"reason\":\"not found\"}");
        return queue.size() > 1 ? queue.pollFirst() : queue.peekFirst();
    }

    @Override
    public void close() {
        server.stop(0);
        ((java.util.concurrent.ExecutorService) server.getExecutor()).shutdownNow();
    }
}
