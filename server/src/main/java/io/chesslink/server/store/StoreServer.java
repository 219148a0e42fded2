// file: server/src/main/java/io/chesslink/server/store/StoreServer.java
package io.chesslink.server.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chesslink.core.SessionIds;
import io.chesslink.core.Snapshot;
import io.chesslink.server.dto.GameResponse;
import io.chesslink.server.dto.SaveResponse;
import io.chesslink.storage.RecordStore;
import io.chesslink.storage.SaveRecord;
import io.chesslink.storage.SnapshotDocuments;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP document store for saved games, over a {@link RecordStore}.
 * <p>
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Validate session ids and snapshot documents before storing anything.
 *  - Map IllegalArgumentException (incl. malformed documents) to 400,
 *    anything else to 500.
 *  - Log one line per request: verb, game id, status, latency, record store
 *    latency and piece count where known. 5xx at WARNING with the cause, 4xx at
 *    INFO with the reason, the rest at FINE.
 * <p>
 * Path layout:
 *   - PUT /games/{sessionId}   body = {"pieces":[...]}  -> 200 {"ok","sessionId","timestamp"}
 *   - GET /games/{sessionId}   -> 200 {"sessionId","timestamp","state"} | 404 {"found":false}
 *   - GET /admin/health        -> 200 {"status":"ok"}
 * <p>
 * Documents are stored in canonical form (pieces in scan order).
 */
public final class StoreServer {
    private static final Logger log = Logger.getLogger(StoreServer.class.getName());

    static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    private static final String GAMES = "/games/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final RecordStore store;
    private final Clock clock;

    public StoreServer(int port, RecordStore store) {
        this(port, store, Clock.systemUTC());
    }

    public StoreServer(int port, RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if (path.startsWith(GAMES)) {
                        String id = path.substring(GAMES.length());
                        if (id.isBlank()) {
                            reject(exchange, new RequestLog(method, path), 400, "session id must not be empty");
                            return;
                        }
                        if (!SessionIds.isValid(id)) {
                            reject(exchange, new RequestLog(method, path), 400, "invalid session id");
                            return;
                        }
                        switch (method) {
                            case "PUT" -> handlePut(exchange, id);
                            case "GET" -> handleGet(exchange, id);
                            default -> reject(exchange, new RequestLog(method, "game " + id), 405, "method not allowed");
                        }
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        new RequestLog(method, path).done(200, null);
                    } else {
                        reject(exchange, new RequestLog(method, path), 404, "not found");
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** GET /games/{sessionId} */
    private void handleGet(HttpServerExchange ex, String sessionId) {
        var req = new RequestLog("GET", "game " + sessionId);
        int status;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            SaveRecord r = store.get(sessionId);
            req.storeNanos = System.nanoTime() - sStart;

            if (r == null) {
                status = 404;
                send(ex, status, Map.of("found", false));
            } else {
                var dto = new GameResponse();
                dto.sessionId = r.sessionId();
                dto.timestamp = r.timestampMillis();
                dto.state = json.readTree(r.payload());
                req.pieces = dto.state.path("pieces").size();
                status = 200;
                send(ex, status, dto);
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        req.done(status, error);
    }

    /** PUT /games/{sessionId} */
    private void handlePut(HttpServerExchange ex, String sessionId) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    var req = new RequestLog("PUT", "game " + sessionId);
                    int status;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            JsonNode doc = json.readTree(data);
                            Snapshot snapshot = SnapshotDocuments.fromTree(doc);
                            req.pieces = snapshot.size();
                            long now = clock.millis();

                            long sStart = System.nanoTime();
                            store.put(new SaveRecord(sessionId, SnapshotDocuments.toJson(snapshot), now));
                            req.storeNanos = System.nanoTime() - sStart;

                            var dto = new SaveResponse();
                            dto.ok = true;
                            dto.sessionId = sessionId;
                            dto.timestamp = now;
                            status = 200;
                            send(exchange, status, dto);
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    }
                    req.done(status, error);
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    new RequestLog("PUT", "game " + sessionId).done(400, ioEx);
                }
        );
    }

    // ---------- helpers ----------

    private void reject(HttpServerExchange ex, RequestLog req, int status, String reason) {
        send(ex, status, Map.of("error", reason));
        req.done(status, new IllegalArgumentException(reason));
    }

    /** Collects what one request did and writes its log line. */
    static final class RequestLog {
        final String verb;
        final String target;
        final long startNanos = System.nanoTime();
        long storeNanos = -1L;
        int pieces = -1;

        RequestLog(String verb, String target) {
            this.verb = verb;
            this.target = target;
        }

        String line(int status) {
            var sb = new StringBuilder()
                    .append(verb).append(' ').append(target)
                    .append(" -> ").append(status)
                    .append(" in ").append(millis(System.nanoTime() - startNanos)).append("ms");
            if (storeNanos >= 0) {
                sb.append(", store ").append(millis(storeNanos)).append("ms");
            }
            if (pieces >= 0) {
                sb.append(", ").append(pieces).append(pieces == 1 ? " piece" : " pieces");
            }
            return sb.toString();
        }

        void done(int status, Throwable error) {
            if (status >= 500) {
                log.log(Level.WARNING, line(status), error);
            } else if (status >= 400) {
                String msg = line(status);
                log.info(() -> error == null ? msg : msg + ": " + error.getMessage());
            } else if (log.isLoggable(Level.FINE)) {
                log.fine(line(status));
            }
        }

        private static long millis(long nanos) {
            return nanos / 1_000_000L;
        }
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
