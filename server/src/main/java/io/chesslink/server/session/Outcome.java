// file: server/src/main/java/io/chesslink/server/session/Outcome.java
package io.chesslink.server.session;

/**
 * Status of a coordinator operation. Everything except {@link #OK} leaves the
 * session state exactly as it was before the call.
 */
public enum Outcome {
    OK,
    /** Caller is not the host. */
    NOT_AUTHORIZED,
    /** A save or load is already pending; the request is not queued. */
    OPERATION_IN_PROGRESS,
    /** Store not ready at call time; no network call was made. */
    PERSISTENCE_UNAVAILABLE,
    /** Store reachable but the save/load failed, or the record does not exist. */
    PERSISTENCE_FAILURE,
    /** Loaded document could not be decoded. */
    MALFORMED_SNAPSHOT,
    /** Completion arrived after the session ended or moved to a new game. */
    STALE_COMPLETION,
    /** No live session (not started yet, or ended). */
    SESSION_NOT_ACTIVE,
    /** Bad argument, e.g. an ill-formed session id. */
    INVALID_ARGUMENT
}
