// file: server/src/main/java/io/chesslink/server/session/SessionListener.java
package io.chesslink.server.session;

/**
 * State-changed notifications from {@link SessionCoordinator}.
 * Called on the session thread, after the state change is complete.
 */
public interface SessionListener {

    /** A session started, including "new game" over a live session. */
    default void onSessionStarted(SessionView view) {}

    default void onMoveRecorded(SessionView view) {}

    default void onSaved(SessionView view) {}

    default void onLoaded(SessionView view) {}

    default void onSessionEnded(SessionView view) {}
}
