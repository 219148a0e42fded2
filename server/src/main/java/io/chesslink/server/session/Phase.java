// file: server/src/main/java/io/chesslink/server/session/Phase.java
package io.chesslink.server.session;

/**
 * Session lifecycle:
 * <pre>
 *   UNINITIALIZED -> ACTIVE -> (SAVING | LOADING)* -> ACTIVE -> ENDED
 * </pre>
 * ENDED is terminal.
 */
public enum Phase {
    UNINITIALIZED,
    ACTIVE,
    SAVING,
    LOADING,
    ENDED;

    /** True while a session id exists and the session has not ended. */
    public boolean isLive() {
        return this == ACTIVE || this == SAVING || this == LOADING;
    }

    public boolean isBusy() {
        return this == SAVING || this == LOADING;
    }
}
