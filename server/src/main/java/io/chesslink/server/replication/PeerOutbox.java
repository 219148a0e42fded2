// file: server/src/main/java/io/chesslink/server/replication/PeerOutbox.java
package io.chesslink.server.replication;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered, at-least-once queue of messages for one peer.
 * <p>
 * Semantics:
 *  - Messages get consecutive sequence numbers in enqueue order, from a
 *    counter the channel keeps per peer id across link replacements.
 *  - A message leaves the queue only once the link has delivered it; a failed
 *    delivery keeps it at the head and retries it, after a backoff or as soon
 *    as something new is enqueued, whichever is first.
 *  - At most one drain runs at a time, so the link sees one message at a time
 *    in sequence order even on a multi-threaded executor.
 *  - A receipt asking for a catch-up is passed to {@code onResync}.
 */
final class PeerOutbox {
    private static final Logger log = Logger.getLogger(PeerOutbox.class.getName());

    private static final int MAX_BACKOFF_FACTOR = 32;

    private final String peerId;
    private final String channelId;
    private final PeerLink link;
    private final AtomicLong sequence;
    private final Executor deliveryExecutor;
    private final ScheduledExecutorService retryTimer;
    private final Duration backoff;
    private final Consumer<String> onResync;

    private final Deque<ReplicationMessage> pending = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;
    private int failures;
    private ScheduledFuture<?> retry;

    PeerOutbox(String peerId,
               String channelId,
               PeerLink link,
               AtomicLong sequence,
               Executor deliveryExecutor,
               ScheduledExecutorService retryTimer,
               Duration backoff,
               Consumer<String> onResync) {
        this.peerId = peerId;
        this.channelId = channelId;
        this.link = link;
        this.sequence = sequence;
        this.deliveryExecutor = deliveryExecutor;
        this.retryTimer = retryTimer;
        this.backoff = backoff;
        this.onResync = onResync;
    }

    void enqueue(ReplicationEvent event) {
        boolean start;
        synchronized (this) {
            if (closed) {
                return;
            }
            pending.addLast(new ReplicationMessage(channelId, sequence.incrementAndGet(), event));
            start = claimDrain();
        }
        if (start) {
            deliveryExecutor.execute(this::drain);
        }
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    void close() {
        synchronized (this) {
            closed = true;
            pending.clear();
            cancelRetry();
        }
        link.close();
    }

    // ---------- internals ----------

    /** Caller holds the lock. True if the caller must start a drain. */
    private boolean claimDrain() {
        if (draining || closed || pending.isEmpty()) {
            return false;
        }
        cancelRetry();
        draining = true;
        return true;
    }

    private void drain() {
        while (true) {
            ReplicationMessage next;
            synchronized (this) {
                next = closed ? null : pending.peekFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }

            DeliveryReceipt receipt;
            try {
                receipt = link.deliver(next);
            } catch (RuntimeException e) {
                backOff(next, e);
                return;
            }

            int recoveredAfter;
            synchronized (this) {
                if (pending.peekFirst() == next) {
                    pending.pollFirst();
                }
                recoveredAfter = failures;
                failures = 0;
            }
            if (recoveredAfter > 0) {
                log.info(() -> "peer " + peerId + " reachable again after " + recoveredAfter + " failed attempts");
            }
            if (receipt != null && receipt.resyncRequested()) {
                log.info(() -> "peer " + peerId + " reported missed messages at seq=" + next.sequence());
                onResync.accept(peerId);
            }
        }
    }

    private void backOff(ReplicationMessage failed, RuntimeException e) {
        int n;
        long delayMs;
        synchronized (this) {
            draining = false;
            if (closed) {
                return;
            }
            n = ++failures;
            delayMs = backoff.toMillis() * Math.min(1L << Math.min(n - 1, 5), MAX_BACKOFF_FACTOR);
            retry = retryTimer.schedule(this::retryNow, delayMs, TimeUnit.MILLISECONDS);
        }
        if (n == 1) {
            log.log(Level.WARNING, "delivery of seq=" + failed.sequence() + " to peer " + peerId
                    + " failed; keeping it queued", e);
        } else {
            log.fine(() -> "delivery to peer " + peerId + " still failing (attempt " + n
                    + "), next retry in " + delayMs + "ms");
        }
    }

    private void retryNow() {
        boolean start;
        synchronized (this) {
            retry = null;
            start = claimDrain();
        }
        if (start) {
            deliveryExecutor.execute(this::drain);
        }
    }

    private void cancelRetry() {
        if (retry != null) {
            retry.cancel(false);
            retry = null;
        }
    }
}
