// file: storage/src/main/java/io/chesslink/storage/RecordStore.java
package io.chesslink.storage;

/**
 * Keyed storage for save records. Last write for a session id wins.
 */
public interface RecordStore {

    void put(SaveRecord record);

    /** @return the record for {@code sessionId}, or null if none was ever written */
    SaveRecord get(String sessionId);
}
