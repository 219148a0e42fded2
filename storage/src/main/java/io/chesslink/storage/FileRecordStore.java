// file: storage/src/main/java/io/chesslink/storage/FileRecordStore.java
package io.chesslink.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chesslink.core.SessionIds;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Durable RecordStore: one JSON file per session id under a data directory.
 * <p>
 * File layout: {@code <dir>/<sessionId>.json} holding
 * {@code {"sessionId":..., "payload":..., "timestampMillis":...}}.
 * <p>
 * Atomicity:
 *   - each write goes to {@code <sessionId>.json.tmp} first,
 *   - then replaces the live file with ATOMIC_MOVE,
 *   so a crash mid-write leaves the previous record readable.
 * <p>
 * Session ids are validated before they touch the filesystem, which keeps
 * path separators and dot segments out of file names.
 */
public final class FileRecordStore implements RecordStore {
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper json = new ObjectMapper();

    public FileRecordStore(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new RuntimeException(e); }
    }

    @Override
    public synchronized void put(SaveRecord record) {
        Path tmp = dir.resolve(record.sessionId() + SUFFIX + ".tmp");
        Path dst = dir.resolve(record.sessionId() + SUFFIX);
        try (var out = Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            json.writeValue(out, record);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write save record " + record.sessionId(), e);
        }

        try { Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING); }
        catch (IOException e) { throw new RuntimeException("Failed to publish save record " + record.sessionId(), e); }
    }

    @Override
    public synchronized SaveRecord get(String sessionId) {
        SessionIds.requireValid(sessionId);
        Path file = dir.resolve(sessionId + SUFFIX);
        try {
            byte[] bytes = Files.readAllBytes(file);
            return json.readValue(bytes, SaveRecord.class);
        } catch (NoSuchFileException missing) {
            return null;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read save record " + sessionId, e);
        }
    }
}
