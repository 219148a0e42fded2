// file: server/src/main/java/io/chesslink/server/replication/LocalPeerLink.java
package io.chesslink.server.replication;

import java.util.Objects;

/**
 * PeerLink into a replica in the same process. Used in tests and demos where
 * spinning up gRPC servers is unnecessary.
 */
public final class LocalPeerLink implements PeerLink {

    private final SessionReplica replica;

    public LocalPeerLink(SessionReplica replica) {
        this.replica = Objects.requireNonNull(replica, "replica");
    }

    @Override
    public DeliveryReceipt deliver(ReplicationMessage message) {
        return DeliveryReceipt.of(replica.apply(message));
    }
}
