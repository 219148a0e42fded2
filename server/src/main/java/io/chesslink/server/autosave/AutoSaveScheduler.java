// file: server/src/main/java/io/chesslink/server/autosave/AutoSaveScheduler.java
package io.chesslink.server.autosave;

import io.chesslink.server.session.Outcome;
import io.chesslink.server.session.OperationResult;
import io.chesslink.server.session.SessionCoordinator;
import io.chesslink.server.session.SessionListener;
import io.chesslink.server.session.SessionView;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host-side auto-save driver.
 * <p>
 * Two triggers, both routed through {@link SessionCoordinator#save(String)}:
 *  - Interval: every {@code interval} while enabled and a session is live.
 *    Disabling, ending the session or {@link #close()} cancels the pending
 *    timer immediately.
 *  - Move count: on every half-move index that is a positive multiple of
 *    {@code everyMoves}, at most once per index, and not for an index the
 *    session has already saved at.
 * <p>
 * A trigger rejected with OPERATION_IN_PROGRESS is dropped, not retried.
 * <p>
 * Register with {@link SessionCoordinator#addListener}. Timer ticks run on
 * {@code sessionExecutor}, which must be the session thread.
 */
public final class AutoSaveScheduler implements SessionListener, AutoCloseable {
    private static final Logger log = Logger.getLogger(AutoSaveScheduler.class.getName());

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_EVERY_MOVES = 5;

    private final SessionCoordinator coordinator;
    private final ScheduledExecutorService sessionExecutor;
    private final Duration interval;
    private final int everyMoves;

    private final AtomicInteger triggered = new AtomicInteger();
    private volatile boolean enabled;
    private boolean sessionLive;
    private int lastTriggeredMoveIndex = -1;
    private ScheduledFuture<?> timer;

    public AutoSaveScheduler(SessionCoordinator coordinator,
                             ScheduledExecutorService sessionExecutor,
                             Duration interval,
                             int everyMoves,
                             boolean enabled) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (everyMoves <= 0) {
            throw new IllegalArgumentException("everyMoves must be > 0");
        }
        this.everyMoves = everyMoves;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Turn auto-save on or off. Turning it off cancels the pending timer at once. */
    public synchronized void setEnabled(boolean on) {
        if (enabled == on) {
            return;
        }
        enabled = on;
        log.info(() -> "auto-save " + (on ? "enabled" : "disabled"));
        if (on && sessionLive) {
            arm();
        } else {
            cancel();
        }
    }

    /** Number of saves this scheduler has requested (accepted or not). */
    public int triggeredCount() {
        return triggered.get();
    }

    public synchronized boolean timerPending() {
        return timer != null && !timer.isDone();
    }

    // ---------- SessionListener ----------

    @Override
    public synchronized void onSessionStarted(SessionView view) {
        sessionLive = true;
        lastTriggeredMoveIndex = -1;
        cancel();
        if (enabled) {
            arm();
        }
    }

    @Override
    public void onMoveRecorded(SessionView view) {
        if (!enabled) {
            return;
        }
        int idx = view.halfMoveIndex();
        if (idx <= 0 || idx % everyMoves != 0) {
            return;
        }
        synchronized (this) {
            if (idx == view.lastSavedMoveIndex() || idx == lastTriggeredMoveIndex) {
                log.fine(() -> "move " + idx + " already saved or triggered, skipping");
                return;
            }
            lastTriggeredMoveIndex = idx;
        }
        trigger("move " + idx);
    }

    @Override
    public synchronized void onSessionEnded(SessionView view) {
        sessionLive = false;
        cancel();
    }

    @Override
    public void close() {
        synchronized (this) {
            sessionLive = false;
            cancel();
        }
    }

    // ---------- internals ----------

    private void arm() {
        cancel();
        long ms = interval.toMillis();
        timer = sessionExecutor.scheduleAtFixedRate(this::tick, ms, ms, TimeUnit.MILLISECONDS);
    }

    private void cancel() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private void tick() {
        try {
            if (!enabled) {
                return;
            }
            trigger("interval");
        } catch (Exception e) {
            // keep the timer alive; scheduleAtFixedRate stops on an escaped exception
            log.log(Level.WARNING, "auto-save tick failed", e);
        }
    }

    private void trigger(String reason) {
        triggered.incrementAndGet();
        log.fine(() -> "auto-save triggered by " + reason);
        coordinator.save(coordinator.hostPeerId()).thenAccept(r -> report(reason, r));
    }

    private static void report(String reason, OperationResult r) {
        if (r.isOk()) {
            log.info(() -> "auto-save (" + reason + ") of " + r.sessionId() + " done");
        } else if (r.outcome() == Outcome.OPERATION_IN_PROGRESS) {
            log.fine(() -> "auto-save (" + reason + ") dropped: operation in progress");
        } else {
            log.warning("auto-save (" + reason + ") failed: " + r.outcome() + " " + r.message());
        }
    }
}
