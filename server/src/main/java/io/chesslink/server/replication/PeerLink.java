// file: server/src/main/java/io/chesslink/server/replication/PeerLink.java
package io.chesslink.server.replication;

/**
 * Transport to one peer.
 * <p>
 *  - LocalPeerLink hands messages to an in-process replica.
 *  - GrpcPeerLink calls the peer's PeerReplication service.
 * <p>
 * {@link #deliver} returns once the peer has the message and throws if the
 * peer could not be reached. It may block; the channel only calls it from
 * its delivery executor, one message at a time per peer. A link may deliver
 * the same message more than once.
 */
public interface PeerLink {

    DeliveryReceipt deliver(ReplicationMessage message);

    /** Release transport resources. */
    default void close() {}
}
