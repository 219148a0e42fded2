// file: server/src/main/java/io/chesslink/server/replication/ReplicationChannel.java
package io.chesslink.server.replication;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.HashMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Routes host events to peers.
 * <p>
 * Responsibilities:
 *  - Keep one {@link PeerOutbox} per peer: consecutive sequence numbers,
 *    delivery in emission order, nothing dropped while the peer is registered.
 *  - {@link #broadcast}: enqueue for every current peer, then hand the event
 *    to local listeners (the host's own view) synchronously.
 *  - {@link #sendTo}: enqueue for one peer only (catch-up).
 *  - Forward a peer's catch-up request to the handler set with
 *    {@link #onResyncRequested}.
 * <p>
 * broadcast/sendTo never block on the network: links run on the delivery
 * executor. The channel holds no session state. Peer table methods are meant
 * for the session thread.
 */
public final class ReplicationChannel {

    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(250);

    private final String channelId;
    private final Executor deliveryExecutor;
    private final ScheduledExecutorService retryTimer;
    private final Duration retryBackoff;
    private final boolean ownsExecutors;

    private final Map<String, PeerOutbox> peers = new LinkedHashMap<>();
    // Kept after a peer leaves so a rejoin continues its sequence.
    private final Map<String, AtomicLong> sequences = new HashMap<>();
    private final List<Consumer<ReplicationMessage>> localListeners = new CopyOnWriteArrayList<>();
    private volatile Consumer<String> resyncHandler = peerId -> { };
    private long localSequence;

    public ReplicationChannel() {
        this(UUID.randomUUID().toString());
    }

    public ReplicationChannel(String channelId) {
        this(channelId,
                Executors.newCachedThreadPool(daemon("replication-delivery")),
                Executors.newSingleThreadScheduledExecutor(daemon("replication-retry")),
                DEFAULT_RETRY_BACKOFF,
                true);
    }

    /**
     * Channel on caller-owned executors (e.g. a direct executor in tests).
     * {@link #close()} does not shut them down.
     */
    public ReplicationChannel(String channelId,
                              Executor deliveryExecutor,
                              ScheduledExecutorService retryTimer,
                              Duration retryBackoff) {
        this(channelId, deliveryExecutor, retryTimer, retryBackoff, false);
    }

    private ReplicationChannel(String channelId,
                               Executor deliveryExecutor,
                               ScheduledExecutorService retryTimer,
                               Duration retryBackoff,
                               boolean ownsExecutors) {
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.retryTimer = Objects.requireNonNull(retryTimer, "retryTimer");
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
        this.ownsExecutors = ownsExecutors;
    }

    public String channelId() {
        return channelId;
    }

    /** Register or replace the link for {@code peerId}. A replaced link loses its queue. */
    public void addPeer(String peerId, PeerLink link) {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(link, "link");
        PeerOutbox previous = peers.put(peerId, new PeerOutbox(peerId, channelId, link,
                sequences.computeIfAbsent(peerId, id -> new AtomicLong()),
                deliveryExecutor, retryTimer, retryBackoff, id -> resyncHandler.accept(id)));
        if (previous != null) {
            previous.close();
        }
    }

    public void removePeer(String peerId) {
        PeerOutbox outbox = peers.remove(peerId);
        if (outbox != null) {
            outbox.close();
        }
    }

    public Set<String> peers() {
        return Set.copyOf(peers.keySet());
    }

    /** Messages queued for {@code peerId} and not yet delivered; 0 for unknown peers. */
    public int pendingFor(String peerId) {
        PeerOutbox outbox = peers.get(peerId);
        return outbox == null ? 0 : outbox.pendingCount();
    }

    public void addLocalListener(Consumer<ReplicationMessage> listener) {
        localListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Called with a peer id, on a delivery thread, when that peer asks for a catch-up. */
    public void onResyncRequested(Consumer<String> handler) {
        this.resyncHandler = Objects.requireNonNull(handler, "handler");
    }

    /** Queue {@code event} for all peers, then deliver it to local listeners. */
    public void broadcast(ReplicationEvent event) {
        Objects.requireNonNull(event, "event");
        for (PeerOutbox outbox : List.copyOf(peers.values())) {
            outbox.enqueue(event);
        }
        if (!localListeners.isEmpty()) {
            ReplicationMessage local = new ReplicationMessage(channelId, ++localSequence, event);
            for (Consumer<ReplicationMessage> l : localListeners) {
                l.accept(local);
            }
        }
    }

    /**
     * Queue {@code event} for a single peer.
     *
     * @throws IllegalArgumentException if {@code peerId} is not registered
     */
    public void sendTo(String peerId, ReplicationEvent event) {
        Objects.requireNonNull(event, "event");
        PeerOutbox outbox = peers.get(peerId);
        if (outbox == null) {
            throw new IllegalArgumentException("unknown peer: " + peerId);
        }
        outbox.enqueue(event);
    }

    public void close() {
        for (PeerOutbox outbox : peers.values()) {
            outbox.close();
        }
        peers.clear();
        if (ownsExecutors) {
            ((ExecutorService) deliveryExecutor).shutdownNow();
            retryTimer.shutdownNow();
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
