// file: storage/src/main/java/io/chesslink/storage/InMemoryRecordStore.java
package io.chesslink.storage;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Non-durable RecordStore for tests and throwaway local runs. */
public final class InMemoryRecordStore implements RecordStore {
    private final Map<String, SaveRecord> records = new ConcurrentHashMap<>();

    @Override
    public void put(SaveRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.sessionId(), record);
    }

    @Override
    public SaveRecord get(String sessionId) {
        return records.get(sessionId);
    }

    public int size() {
        return records.size();
    }
}
