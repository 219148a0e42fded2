// file: server/src/main/java/io/chesslink/server/replication/ReplicaView.java
package io.chesslink.server.replication;

import io.chesslink.core.Snapshot;

/**
 * Read-only projection of the host's session as seen by one peer.
 *
 * @param sessionId           last assigned session id, or null
 * @param snapshot            last loaded board, or null if none was received
 * @param lastSavedSessionId  id from the last SaveCompleted, or null
 * @param lastAppliedSequence sequence of the last applied message, 0 if none
 */
public record ReplicaView(
        String sessionId,
        Snapshot snapshot,
        String lastSavedSessionId,
        long lastAppliedSequence
) {}
