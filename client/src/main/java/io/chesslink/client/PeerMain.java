// file: client/src/main/java/io/chesslink/client/PeerMain.java
package io.chesslink.client;

import io.chesslink.core.InMemoryBoard;
import io.chesslink.core.SnapshotCodec;
import io.chesslink.server.replication.GrpcReplicationService;
import io.chesslink.server.replication.ReplicaView;
import io.chesslink.server.replication.SessionReplica;
import io.grpc.Server;
import io.grpc.ServerBuilder;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for a peer node: a read-only replica of the host's session.
 *
 * Responsibilities:
 *  - Hold a SessionReplica over a local board.
 *  - Expose the PeerReplication gRPC endpoint the host delivers to.
 *  - Print the replica view whenever a new event is applied.
 */
public final class PeerMain {

    private PeerMain() {
        // no-op
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        var cfg = PeerConfig.fromArgs(args);

        var board = InMemoryBoard.empty();
        var replica = new SessionReplica(cfg.peerId(), board);
        replica.addListener(PeerMain::printView);

        Server grpcServer = ServerBuilder
                .forPort(cfg.grpcPort())
                .addService(new GrpcReplicationService(replica))
                .build()
                .start();

        System.out.printf("Peer %s listening on grpc://localhost:%d%n", cfg.peerId(), cfg.grpcPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            grpcServer.shutdown();
            try {
                grpcServer.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
        }));

        grpcServer.awaitTermination();
    }

    static String describe(ReplicaView v) {
        return String.format("[seq %d] session=%s lastSaved=%s board=%s",
                v.lastAppliedSequence(),
                v.sessionId(),
                v.lastSavedSessionId(),
                v.snapshot() == null ? "(none)" : SnapshotCodec.format(v.snapshot()));
    }

    private static void printView(ReplicaView v) {
        System.out.println(describe(v));
    }
}
