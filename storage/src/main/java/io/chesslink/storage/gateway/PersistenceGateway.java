// file: storage/src/main/java/io/chesslink/storage/gateway/PersistenceGateway.java
package io.chesslink.storage.gateway;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous save/load of one named record against the document store.
 * <p>
 * Contract:
 *  - Returned futures always complete normally. Unreachable store, HTTP
 *    errors and unreadable responses are reported as {@code false} or a
 *    failed {@link LoadResult}, never as an exceptional completion.
 *  - Callers check {@link #isReady()} before every call.
 *  - No retry, queueing or buffering happens behind this interface.
 *  - Completion may happen on any thread.
 */
public interface PersistenceGateway {

    boolean isReady();

    /**
     * Write {@code payload} (the snapshot document JSON) under {@code sessionId}.
     *
     * @return future of true if the store acknowledged the write
     */
    CompletableFuture<Boolean> save(String sessionId, String payload);

    CompletableFuture<LoadResult> load(String sessionId);
}
