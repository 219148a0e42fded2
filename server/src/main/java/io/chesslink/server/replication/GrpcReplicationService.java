// file: server/src/main/java/io/chesslink/server/replication/GrpcReplicationService.java
package io.chesslink.server.replication;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import java.util.Objects;

/**
 * Peer-side endpoint of the replication channel.
 * <p>
 * Responsibilities:
 *  - Decode incoming messages and apply them to the local {@link SessionReplica}.
 *  - Ack with whether the message was new and whether a catch-up is needed.
 *  - Map IllegalArgumentException to INVALID_ARGUMENT, everything else to INTERNAL.
 */
public final class GrpcReplicationService extends PeerReplicationGrpc.PeerReplicationImplBase {

    private final SessionReplica replica;

    public GrpcReplicationService(SessionReplica replica) {
        this.replica = Objects.requireNonNull(replica, "replica");
    }

    @Override
    public void deliver(
            ReplicationProto.ReplicationMessage request,
            StreamObserver<ReplicationProto.DeliveryAck> responseObserver
    ) {
        try {
            ReplicationMessage msg = ReplicationProtos.fromProto(request);
            ApplyResult result = replica.apply(msg);

            responseObserver.onNext(ReplicationProto.DeliveryAck.newBuilder()
                    .setApplied(result.applied())
                    .setResyncRequested(result == ApplyResult.APPLIED_AFTER_GAP)
                    .setLastAppliedSequence(replica.lastAppliedSequence())
                    .build());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }
}
