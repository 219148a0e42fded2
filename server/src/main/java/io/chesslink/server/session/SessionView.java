// file: server/src/main/java/io/chesslink/server/session/SessionView.java
package io.chesslink.server.session;

import io.chesslink.core.Snapshot;

/**
 * Immutable copy of the host's session state at one instant.
 *
 * @param sessionId          current session id, null before the first start
 * @param snapshot           last captured or loaded board
 * @param halfMoveIndex      latest half-move index reported by the board
 * @param lastSavedMoveIndex half-move index captured by the latest successful save
 * @param lastSavedSessionId id written by the latest successful save in this session, or null
 * @param phase              lifecycle phase
 */
public record SessionView(
        String sessionId,
        Snapshot snapshot,
        int halfMoveIndex,
        int lastSavedMoveIndex,
        String lastSavedSessionId,
        Phase phase
) {}
