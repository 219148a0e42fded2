// file: storage/src/main/java/io/chesslink/storage/gateway/HttpPersistenceGateway.java
package io.chesslink.storage.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chesslink.core.SessionIds;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PersistenceGateway talking to the document store server over HTTP.
 * <p>
 * Endpoints used:
 *   - GET /admin/health          readiness probe ({@link #initialize()})
 *   - PUT /games/{sessionId}     body = snapshot document JSON
 *   - GET /games/{sessionId}     200 {"sessionId","timestamp","state"} or 404
 * <p>
 * The gateway starts not-ready. While not ready, {@link #isReady()} starts a
 * background health probe (at most one per {@code reprobeInterval}), and a
 * save or load probes first and proceeds only if the store answers. A store
 * that comes up after the host is therefore picked up without a restart.
 * <p>
 * Every failure (connect error, timeout, non-2xx status, unparsable body) is
 * logged and turned into a status value.
 */
public final class HttpPersistenceGateway implements PersistenceGateway {
    private static final Logger log = Logger.getLogger(HttpPersistenceGateway.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final Duration DEFAULT_REPROBE = Duration.ofSeconds(5);

    private final URI baseUri;
    private final HttpClient client;
    private final Duration requestTimeout;
    private final long reprobeNanos;
    private final AtomicReference<CompletableFuture<Boolean>> probe = new AtomicReference<>();
    private volatile boolean ready;
    private volatile long lastProbeNanos;
    private volatile boolean probedOnce;

    public HttpPersistenceGateway(URI baseUri, Duration requestTimeout) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(requestTimeout).build(), requestTimeout, DEFAULT_REPROBE);
    }

    public HttpPersistenceGateway(URI baseUri, HttpClient client, Duration requestTimeout, Duration reprobeInterval) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.reprobeNanos = Objects.requireNonNull(reprobeInterval, "reprobeInterval").toNanos();
    }

    /**
     * Probe the store's health endpoint and update readiness. Concurrent
     * callers share the probe already in flight.
     *
     * @return future of the resulting readiness
     */
    public CompletableFuture<Boolean> initialize() {
        CompletableFuture<Boolean> mine = new CompletableFuture<>();
        if (!probe.compareAndSet(null, mine)) {
            CompletableFuture<Boolean> running = probe.get();
            if (running != null) {
                return running;
            }
            return initialize();
        }
        lastProbeNanos = System.nanoTime();
        probedOnce = true;
        probeHealth().whenComplete((up, err) -> {
            probe.set(null);
            mine.complete(up != null && up);
        });
        return mine;
    }

    private CompletableFuture<Boolean> probeHealth() {
        HttpRequest req = HttpRequest.newBuilder(baseUri.resolve("/admin/health"))
                .timeout(requestTimeout)
                .GET()
                .build();
        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        log.log(Level.WARNING, "document store at " + baseUri + " unreachable", err);
                        ready = false;
                    } else if (resp.statusCode() != 200) {
                        log.warning("document store at " + baseUri + " unhealthy: HTTP " + resp.statusCode());
                        ready = false;
                    } else {
                        log.info("document store at " + baseUri + " ready");
                        ready = true;
                    }
                    return ready;
                });
    }

    @Override
    public boolean isReady() {
        if (!ready && probeDue()) {
            initialize();
        }
        return ready;
    }

    private boolean probeDue() {
        return !probedOnce || System.nanoTime() - lastProbeNanos >= reprobeNanos;
    }

    /** Ready already, or a probe (if one is due) says the store is back. */
    private CompletableFuture<Boolean> ensureReady() {
        if (ready) {
            return CompletableFuture.completedFuture(true);
        }
        if (!probeDue() && probe.get() == null) {
            return CompletableFuture.completedFuture(false);
        }
        return initialize();
    }

    @Override
    public CompletableFuture<Boolean> save(String sessionId, String payload) {
        if (!SessionIds.isValid(sessionId) || payload == null) {
            log.warning("refusing save with invalid id or payload: " + sessionId);
            return CompletableFuture.completedFuture(false);
        }
        return ensureReady().thenCompose(up -> up
                ? put(sessionId, payload)
                : CompletableFuture.completedFuture(false));
    }

    private CompletableFuture<Boolean> put(String sessionId, String payload) {
        HttpRequest req = HttpRequest.newBuilder(gameUri(sessionId))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(payload))
                .build();

        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        log.log(Level.WARNING, "PUT /games/" + sessionId + " failed", err);
                        ready = false;
                        return false;
                    }
                    if (resp.statusCode() != 200) {
                        log.warning("PUT /games/" + sessionId + " -> HTTP " + resp.statusCode() + ": " + resp.body());
                        return false;
                    }
                    return true;
                });
    }

    @Override
    public CompletableFuture<LoadResult> load(String sessionId) {
        if (!SessionIds.isValid(sessionId)) {
            return CompletableFuture.completedFuture(LoadResult.failed("invalid session id: " + sessionId));
        }
        return ensureReady().thenCompose(up -> up
                ? get(sessionId)
                : CompletableFuture.completedFuture(LoadResult.failed("store not ready")));
    }

    private CompletableFuture<LoadResult> get(String sessionId) {
        HttpRequest req = HttpRequest.newBuilder(gameUri(sessionId))
                .timeout(requestTimeout)
                .GET()
                .build();

        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        log.log(Level.WARNING, "GET /games/" + sessionId + " failed", err);
                        ready = false;
                        return LoadResult.failed("store unreachable: " + err.getMessage());
                    }
                    if (resp.statusCode() == 404) {
                        return LoadResult.notFound();
                    }
                    if (resp.statusCode() != 200) {
                        log.warning("GET /games/" + sessionId + " -> HTTP " + resp.statusCode());
                        return LoadResult.failed("HTTP " + resp.statusCode());
                    }
                    return parseLoadBody(sessionId, resp.body());
                });
    }

    private static LoadResult parseLoadBody(String sessionId, String body) {
        try {
            JsonNode root = MAPPER.readTree(body);
            JsonNode state = root == null ? null : root.get("state");
            if (state == null || state.isNull()) {
                return LoadResult.failed("response for " + sessionId + " has no state");
            }
            return LoadResult.found(MAPPER.writeValueAsString(state));
        } catch (Exception e) {
            log.log(Level.WARNING, "unreadable response for " + sessionId, e);
            return LoadResult.failed("unreadable response: " + e.getMessage());
        }
    }

    private URI gameUri(String sessionId) {
        // validated ids are [A-Za-z0-9_-], no escaping needed
        return baseUri.resolve("/games/" + sessionId);
    }
}
