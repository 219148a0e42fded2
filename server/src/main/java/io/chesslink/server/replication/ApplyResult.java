// file: server/src/main/java/io/chesslink/server/replication/ApplyResult.java
package io.chesslink.server.replication;

/**
 * What a {@link SessionReplica} did with one message.
 */
public enum ApplyResult {
    /** Next expected sequence; applied. */
    APPLIED,
    /** Sequence already seen; dropped. */
    DUPLICATE,
    /** Applied, but earlier sequences never arrived (e.g. the replica restarted). */
    APPLIED_AFTER_GAP;

    public boolean applied() {
        return this != DUPLICATE;
    }
}
