// file: storage/src/main/java/io/chesslink/storage/gateway/InMemoryPersistenceGateway.java
package io.chesslink.storage.gateway;

import io.chesslink.storage.InMemoryRecordStore;
import io.chesslink.storage.RecordStore;
import io.chesslink.storage.SaveRecord;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PersistenceGateway over a local {@link RecordStore}, completing immediately.
 * <p>
 * Used by the host when no store URL is configured and by tests. Readiness
 * can be toggled to exercise the "store not initialized" path.
 */
public final class InMemoryPersistenceGateway implements PersistenceGateway {
    private static final Logger log = Logger.getLogger(InMemoryPersistenceGateway.class.getName());

    private final RecordStore store;
    private final Clock clock;
    private volatile boolean ready = true;

    public InMemoryPersistenceGateway() {
        this(new InMemoryRecordStore(), Clock.systemUTC());
    }

    public InMemoryPersistenceGateway(RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public CompletableFuture<Boolean> save(String sessionId, String payload) {
        if (!ready) {
            return CompletableFuture.completedFuture(false);
        }
        try {
            store.put(new SaveRecord(sessionId, payload, clock.millis()));
            return CompletableFuture.completedFuture(true);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "save of " + sessionId + " failed", e);
            return CompletableFuture.completedFuture(false);
        }
    }

    @Override
    public CompletableFuture<LoadResult> load(String sessionId) {
        if (!ready) {
            return CompletableFuture.completedFuture(LoadResult.failed("store not ready"));
        }
        try {
            SaveRecord r = store.get(sessionId);
            return CompletableFuture.completedFuture(r == null ? LoadResult.notFound() : LoadResult.found(r.payload()));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "load of " + sessionId + " failed", e);
            return CompletableFuture.completedFuture(LoadResult.failed(e.getMessage()));
        }
    }
}
