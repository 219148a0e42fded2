// file: server/src/main/java/io/chesslink/server/session/SessionState.java
package io.chesslink.server.session;

import io.chesslink.core.Snapshot;

/**
 * The single authoritative, mutable session state. Owned by
 * {@link SessionCoordinator}; never handed out, only copied into a
 * {@link SessionView}.
 */
final class SessionState {
    String sessionId;
    Snapshot snapshot = Snapshot.empty();
    int halfMoveIndex;
    int lastSavedMoveIndex;
    String lastSavedSessionId;

    void reset(String newSessionId, Snapshot captured) {
        this.sessionId = newSessionId;
        this.snapshot = captured;
        this.halfMoveIndex = 0;
        this.lastSavedMoveIndex = 0;
        this.lastSavedSessionId = null;
    }

    SessionView toView(Phase phase) {
        return new SessionView(sessionId, snapshot, halfMoveIndex, lastSavedMoveIndex, lastSavedSessionId, phase);
    }
}
