// file: server/src/main/java/io/chesslink/server/replication/ReplicationMessage.java
package io.chesslink.server.replication;

import java.util.Objects;

/**
 * An event as it travels: stamped with the emitting channel's id and a
 * sequence number that counts 1, 2, 3, ... per receiver.
 * <p>
 * Receivers use (channelId, sequence) to drop redeliveries and to spot gaps;
 * a new channelId means the host restarted and sequences start over.
 */
public record ReplicationMessage(String channelId, long sequence, ReplicationEvent event) {

    public ReplicationMessage {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(event, "event");
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be > 0");
        }
    }
}
