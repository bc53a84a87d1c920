package io.openpayments.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;

/**
 * Connection pool handle shared by the calls of one client component.
 *
 * <p>When built from timeouts the exchange owns its {@link HttpClient} and executor and
 * releases them on {@link #close()}. A caller-supplied client is only borrowed.
 */
@Slf4j
final class HttpExchange implements AutoCloseable {

    static final String AUTHORIZATION = "Authorization";
    static final String CONTENT_TYPE = "Content-Type";
    static final String ACCEPT = "Accept";
    static final String APPLICATION_JSON = "application/json";

    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final HttpClient http;
    private final ExecutorService executor;
    private final Duration requestTimeout;
    private final AtomicBoolean closed = new AtomicBoolean();

    HttpExchange(Duration connectTimeout, Duration requestTimeout) {
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "open-payments-http-" + THREAD_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.http = HttpClient.newBuilder()
            .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
            .executor(executor)
            .build();
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    HttpExchange(HttpClient http, Duration requestTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.executor = null;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    static HttpExchange withDefaults() {
        return new HttpExchange(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder(uri).timeout(requestTimeout);
    }

    HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("HTTP client has been closed");
        }
        log.debug("{} {}", request.method(), request.uri());
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
        return response;
    }

    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    static String gnap(String token) {
        return "GNAP " + token;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && executor != null) {
            executor.shutdownNow();
        }
    }
}
