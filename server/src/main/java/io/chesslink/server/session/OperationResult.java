// file: server/src/main/java/io/chesslink/server/session/OperationResult.java
package io.chesslink.server.session;

import java.util.Objects;

/**
 * Result of a coordinator operation.
 *
 * @param outcome   status
 * @param sessionId session id the operation acted on (may be null before a session exists)
 * @param message   human-readable detail for logs and the console
 */
public record OperationResult(Outcome outcome, String sessionId, String message) {

    public OperationResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(message, "message");
    }

    public static OperationResult ok(String sessionId, String message) {
        return new OperationResult(Outcome.OK, sessionId, message);
    }

    public static OperationResult rejected(Outcome outcome, String sessionId, String message) {
        return new OperationResult(outcome, sessionId, message);
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
