// file: server/src/main/java/io/chesslink/server/replication/ReplicationEvent.java
package io.chesslink.server.replication;

import io.chesslink.core.Snapshot;

import java.util.Objects;

/**
 * Host-to-peer events. Every event is idempotent on receipt: applying it twice
 * leaves the replica as applying it once would.
 */
public interface ReplicationEvent {

    /** The host adopted {@code sessionId} (new game or load of a stored id). */
    record SessionIdAssigned(String sessionId) implements ReplicationEvent {
        public SessionIdAssigned {
            Objects.requireNonNull(sessionId, "sessionId");
        }
    }

    /** A save of {@code sessionId} was acknowledged by the store. */
    record SaveCompleted(String sessionId) implements ReplicationEvent {
        public SaveCompleted {
            Objects.requireNonNull(sessionId, "sessionId");
        }
    }

    /** The authoritative board was replaced by {@code snapshot}. */
    record StateLoaded(Snapshot snapshot) implements ReplicationEvent {
        public StateLoaded {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }
}
