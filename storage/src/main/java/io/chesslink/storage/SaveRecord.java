// file: storage/src/main/java/io/chesslink/storage/SaveRecord.java
package io.chesslink.storage;

import io.chesslink.core.SessionIds;

import java.util.Objects;

/**
 * One persisted game, keyed by session id.
 *
 * @param sessionId       owning session (validated with {@link SessionIds#requireValid(String)})
 * @param payload         snapshot document as JSON text (see {@link SnapshotDocuments})
 * @param timestampMillis wall-clock time the store accepted the write
 */
public record SaveRecord(String sessionId, String payload, long timestampMillis) {

    public SaveRecord {
        SessionIds.requireValid(sessionId);
        Objects.requireNonNull(payload, "payload");
    }
}
