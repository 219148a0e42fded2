// file: server/src/main/java/io/chesslink/server/replication/SessionReplica.java
package io.chesslink.server.replication;

import io.chesslink.core.BoardModel;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A peer's copy of the session, updated only by applying replication messages.
 * <p>
 * Semantics:
 *  - Messages with a sequence not greater than the last applied one (for the
 *    same channel) are dropped, so redeliveries are no-ops.
 *  - A sequence beyond the next expected one is applied but reported as
 *    {@link ApplyResult#APPLIED_AFTER_GAP}; the host answers with a catch-up.
 *  - A message from a different channel id resets the sequence watermark.
 *  - StateLoaded is applied to the optional board collaborator; applying the
 *    same snapshot again yields the same board.
 * <p>
 * Thread-safe: transports may call {@link #apply} from their own threads.
 */
public final class SessionReplica {
    private static final Logger log = Logger.getLogger(SessionReplica.class.getName());

    private final String peerId;
    private final BoardModel board; // may be null
    private final List<Consumer<ReplicaView>> listeners = new CopyOnWriteArrayList<>();

    private String channelId;
    private long lastApplied;
    private ReplicaView view = new ReplicaView(null, null, null, 0L);

    public SessionReplica(String peerId) {
        this(peerId, null);
    }

    public SessionReplica(String peerId, BoardModel board) {
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.board = board;
    }

    public String peerId() {
        return peerId;
    }

    public void addListener(Consumer<ReplicaView> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Apply a message if it is new.
     *
     * @return whether it was applied, dropped, or applied after missing messages
     */
    public ApplyResult apply(ReplicationMessage message) {
        Objects.requireNonNull(message, "message");
        ReplicaView updated;
        ApplyResult result;
        synchronized (this) {
            if (!message.channelId().equals(channelId)) {
                if (channelId != null) {
                    log.info(() -> "[" + peerId + "] host channel changed " + channelId + " -> "
                            + message.channelId() + ", resetting sequence");
                }
                channelId = message.channelId();
                lastApplied = 0L;
            }
            if (message.sequence() <= lastApplied) {
                log.log(Level.FINE, "[{0}] dropping seq={1} (last applied {2})",
                        new Object[]{peerId, message.sequence(), lastApplied});
                return ApplyResult.DUPLICATE;
            }
            if (message.sequence() != lastApplied + 1) {
                long from = lastApplied + 1;
                log.info(() -> "[" + peerId + "] missed seq " + from + ".." + (message.sequence() - 1)
                        + ", asking for catch-up");
                result = ApplyResult.APPLIED_AFTER_GAP;
            } else {
                result = ApplyResult.APPLIED;
            }

            view = applyEvent(message.event(), message.sequence());
            lastApplied = message.sequence();
            updated = view;
        }
        for (Consumer<ReplicaView> l : listeners) {
            l.accept(updated);
        }
        return result;
    }

    private ReplicaView applyEvent(ReplicationEvent event, long seq) {
        if (event instanceof ReplicationEvent.SessionIdAssigned assigned) {
            return new ReplicaView(assigned.sessionId(), view.snapshot(), view.lastSavedSessionId(), seq);
        }
        if (event instanceof ReplicationEvent.SaveCompleted saved) {
            return new ReplicaView(view.sessionId(), view.snapshot(), saved.sessionId(), seq);
        }
        if (event instanceof ReplicationEvent.StateLoaded loaded) {
            if (board != null) {
                board.applySnapshot(loaded.snapshot());
            }
            return new ReplicaView(view.sessionId(), loaded.snapshot(), view.lastSavedSessionId(), seq);
        }
        throw new IllegalArgumentException("unknown event type: " + event.getClass().getName());
    }

    public synchronized ReplicaView view() {
        return view;
    }

    public synchronized long lastAppliedSequence() {
        return lastApplied;
    }
}
