// file: core/src/main/java/io/chesslink/core/MalformedSnapshotException.java
package io.chesslink.core;

/**
 * Raised when a snapshot (records, wire text or persisted document) cannot be
 * decoded: duplicate squares, out-of-range coordinates, unknown kinds/owners,
 * bad syntax.
 */
public final class MalformedSnapshotException extends IllegalArgumentException {

    public MalformedSnapshotException(String message) {
        super(message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
