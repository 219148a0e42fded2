// file: server/src/main/java/io/chesslink/server/replication/GrpcPeerLink.java
package io.chesslink.server.replication;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * gRPC-based PeerLink.
 * <p>
 * One instance represents one remote peer (host:port). A call that fails with
 * UNAVAILABLE or DEADLINE_EXCEEDED is resent up to {@code maxAttempts} times;
 * a resend after a lost ack is why peers must tolerate duplicates. Any other
 * status fails immediately.
 * <p>
 * Calls block, including the backoff between attempts. The channel runs them
 * on its delivery executor, never on the session thread.
 */
public final class GrpcPeerLink implements PeerLink {
    private static final Logger log = Logger.getLogger(GrpcPeerLink.class.getName());

    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(2);
    private static final Duration DEFAULT_BACKOFF = Duration.ofMillis(100);

    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final PeerReplicationGrpc.PeerReplicationBlockingStub stub;
    private final int maxAttempts;
    private final Duration deadline;
    private final Duration backoff;

    public GrpcPeerLink(String host, int port) {
        this(host + ":" + port,
                ManagedChannelBuilder.forAddress(host, port).usePlaintext().build(),
                DEFAULT_MAX_ATTEMPTS, DEFAULT_DEADLINE, DEFAULT_BACKOFF);
    }

    /**
     * Constructor taking a pre-built channel (e.g., in-process for tests).
     */
    public GrpcPeerLink(String target, ManagedChannel channel, int maxAttempts, Duration deadline, Duration backoff) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.target = target;
        this.channel = channel;
        this.stub = PeerReplicationGrpc.newBlockingStub(channel);
        this.maxAttempts = maxAttempts;
        this.deadline = deadline;
        this.backoff = backoff;
    }

    @Override
    public DeliveryReceipt deliver(ReplicationMessage message) {
        ReplicationProto.ReplicationMessage req = ReplicationProtos.toProto(message);
        StatusRuntimeException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ReplicationProto.DeliveryAck ack = stub
                        .withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS)
                        .deliver(req);
                if (!ack.getApplied()) {
                    log.fine(() -> "peer " + target + " already had seq=" + message.sequence());
                }
                return new DeliveryReceipt(ack.getApplied(), ack.getResyncRequested());
            } catch (StatusRuntimeException sre) {
                last = sre;
                if (!isRetryable(sre.getStatus().getCode()) || attempt == maxAttempts) {
                    break;
                }
                int n = attempt;
                log.fine(() -> "redelivering seq=" + message.sequence() + " to " + target
                        + " after " + sre.getStatus().getCode() + " (attempt " + n + ")");
                sleep(backoff.multipliedBy(attempt));
            }
        }
        throw new RuntimeException("gRPC deliver to peer " + target + " failed", last);
    }

    private static boolean isRetryable(Status.Code code) {
        return code == Status.Code.UNAVAILABLE || code == Status.Code.DEADLINE_EXCEEDED;
    }

    private static void sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("interrupted while redelivering", e);
        }
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
