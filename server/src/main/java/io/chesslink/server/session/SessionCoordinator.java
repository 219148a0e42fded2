// file: server/src/main/java/io/chesslink/server/session/SessionCoordinator.java
package io.chesslink.server.session;

import io.chesslink.core.BoardModel;
import io.chesslink.core.MalformedSnapshotException;
import io.chesslink.core.SessionIds;
import io.chesslink.core.Snapshot;
import io.chesslink.core.SnapshotCodec;
import io.chesslink.server.replication.PeerLink;
import io.chesslink.server.replication.ReplicationChannel;
import io.chesslink.server.replication.ReplicationEvent;
import io.chesslink.storage.SnapshotDocuments;
import io.chesslink.storage.gateway.LoadResult;
import io.chesslink.storage.gateway.PersistenceGateway;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owner of the authoritative session: session id, current snapshot, move
 * counters, lifecycle phase.
 * <p>
 * Responsibilities:
 *  - Reject every mutating call whose caller is not the host (NOT_AUTHORIZED).
 *  - Allow at most one pending save/load (OPERATION_IN_PROGRESS otherwise).
 *  - Check gateway readiness before any persistence call (PERSISTENCE_UNAVAILABLE).
 *  - Resume gateway completions on the session executor and drop those that
 *    belong to an older session epoch (STALE_COMPLETION).
 *  - Broadcast SessionIdAssigned / SaveCompleted / StateLoaded through the channel.
 *  - Catch up a (re)joining peer, or one that reports missed messages,
 *    without mutating anything.
 * <p>
 * Threading: not thread-safe. Every method must be called on the session
 * thread, which is also the {@code sessionExecutor} passed in.
 */
public final class SessionCoordinator {
    private static final Logger log = Logger.getLogger(SessionCoordinator.class.getName());

    private final String hostPeerId;
    private final BoardModel board;
    private final PersistenceGateway gateway;
    private final ReplicationChannel channel;
    private final Executor sessionExecutor;
    private final Supplier<String> idGenerator;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private final SessionState state = new SessionState();
    private Phase phase = Phase.UNINITIALIZED;
    // Bumped on every start/new game/end; pending completions compare against it.
    private long epoch;

    public SessionCoordinator(String hostPeerId,
                              BoardModel board,
                              PersistenceGateway gateway,
                              ReplicationChannel channel,
                              Executor sessionExecutor) {
        this(hostPeerId, board, gateway, channel, sessionExecutor, SessionIds::generate);
    }

    public SessionCoordinator(String hostPeerId,
                              BoardModel board,
                              PersistenceGateway gateway,
                              ReplicationChannel channel,
                              Executor sessionExecutor,
                              Supplier<String> idGenerator) {
        this.hostPeerId = Objects.requireNonNull(hostPeerId, "hostPeerId");
        this.board = Objects.requireNonNull(board, "board");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        channel.onResyncRequested(peerId -> sessionExecutor.execute(() -> resync(peerId)));
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ---------- accessors ----------

    public String hostPeerId() {
        return hostPeerId;
    }

    public String currentSessionId() {
        return state.sessionId;
    }

    public Phase phase() {
        return phase;
    }

    public SessionView view() {
        return state.toView(phase);
    }

    // ---------- lifecycle ----------

    /**
     * Start a session, or start a new game over a live one. Generates a fresh
     * session id, captures the board and resets move counters. Any pending
     * save/load from before becomes stale.
     */
    public OperationResult startSession(String callerId) {
        if (!isHost(callerId)) {
            return notAuthorized("startSession", callerId);
        }
        if (phase == Phase.ENDED) {
            return reject(Outcome.SESSION_NOT_ACTIVE, "startSession", "session has ended");
        }

        Snapshot captured;
        try {
            captured = SnapshotCodec.encode(board);
        } catch (MalformedSnapshotException e) {
            return reject(Outcome.MALFORMED_SNAPSHOT, "startSession", e.getMessage());
        }

        String previous = state.sessionId;
        String id = idGenerator.get();
        epoch++;
        state.reset(id, captured);
        phase = Phase.ACTIVE;

        if (previous == null) {
            log.info(() -> "session " + id + " started by " + hostPeerId);
        } else {
            log.info(() -> "new game: session " + previous + " replaced by " + id);
        }
        channel.broadcast(new ReplicationEvent.SessionIdAssigned(id));
        SessionView v = view();
        for (SessionListener l : listeners) {
            l.onSessionStarted(v);
        }
        return OperationResult.ok(id, "session started");
    }

    /**
     * Record that the board reached {@code halfMoveIndex}. Captures the board
     * and notifies listeners (the auto-save scheduler counts moves here).
     */
    public OperationResult recordMove(String callerId, int halfMoveIndex) {
        if (!isHost(callerId)) {
            return notAuthorized("recordMove", callerId);
        }
        if (!phase.isLive()) {
            return reject(Outcome.SESSION_NOT_ACTIVE, "recordMove", "no live session");
        }
        if (halfMoveIndex < 0) {
            return reject(Outcome.INVALID_ARGUMENT, "recordMove", "halfMoveIndex must be >= 0");
        }

        Snapshot captured;
        try {
            captured = SnapshotCodec.encode(board);
        } catch (MalformedSnapshotException e) {
            return reject(Outcome.MALFORMED_SNAPSHOT, "recordMove", e.getMessage());
        }
        state.snapshot = captured;
        state.halfMoveIndex = halfMoveIndex;

        SessionView v = view();
        for (SessionListener l : listeners) {
            l.onMoveRecorded(v);
        }
        return OperationResult.ok(state.sessionId, "move " + halfMoveIndex + " recorded");
    }

    /** End the session. Terminal: later save/load/start calls are rejected. */
    public OperationResult endSession(String callerId) {
        if (!isHost(callerId)) {
            return notAuthorized("endSession", callerId);
        }
        if (phase == Phase.ENDED) {
            return reject(Outcome.SESSION_NOT_ACTIVE, "endSession", "session already ended");
        }
        epoch++;
        phase = Phase.ENDED;
        log.info(() -> "session " + state.sessionId + " ended");

        SessionView v = view();
        for (SessionListener l : listeners) {
            l.onSessionEnded(v);
        }
        return OperationResult.ok(state.sessionId, "session ended");
    }

    // ---------- persistence ----------

    /**
     * Capture the board and write it under the current session id.
     * On success lastSavedMoveIndex advances to the captured move index and
     * SaveCompleted is broadcast. On failure nothing changes.
     */
    public CompletableFuture<OperationResult> save(String callerId) {
        OperationResult gate = checkPersistenceGate("save", callerId);
        if (gate != null) {
            return CompletableFuture.completedFuture(gate);
        }

        Snapshot captured;
        try {
            captured = SnapshotCodec.encode(board);
        } catch (MalformedSnapshotException e) {
            return CompletableFuture.completedFuture(reject(Outcome.MALFORMED_SNAPSHOT, "save", e.getMessage()));
        }

        String id = state.sessionId;
        int moveIndexAtCapture = state.halfMoveIndex;
        long epochAtStart = epoch;
        String payload = SnapshotDocuments.toJson(captured);

        phase = Phase.SAVING;
        log.fine(() -> "saving session " + id + " at move " + moveIndexAtCapture);

        return callGateway(() -> gateway.save(id, payload), false)
                .handleAsync((ok, err) -> completeSave(id, captured, moveIndexAtCapture, epochAtStart,
                        err == null && Boolean.TRUE.equals(ok)), sessionExecutor);
    }

    private OperationResult completeSave(String id, Snapshot captured, int moveIndexAtCapture,
                                         long epochAtStart, boolean ok) {
        if (epochAtStart != epoch || phase != Phase.SAVING) {
            log.fine(() -> "dropping stale save completion for " + id);
            return OperationResult.rejected(Outcome.STALE_COMPLETION, id, "session moved on during save");
        }
        phase = Phase.ACTIVE;
        if (!ok) {
            log.warning("save of session " + id + " failed");
            return OperationResult.rejected(Outcome.PERSISTENCE_FAILURE, id, "store rejected or did not acknowledge save");
        }

        state.snapshot = captured;
        state.lastSavedMoveIndex = Math.max(state.lastSavedMoveIndex, moveIndexAtCapture);
        state.lastSavedSessionId = id;
        log.info(() -> "session " + id + " saved at move " + moveIndexAtCapture);

        channel.broadcast(new ReplicationEvent.SaveCompleted(id));
        SessionView v = view();
        for (SessionListener l : listeners) {
            l.onSaved(v);
        }
        return OperationResult.ok(id, "saved at move " + moveIndexAtCapture);
    }

    /**
     * Read {@code sessionId} from the store, decode it, apply it to the board
     * and adopt the id. Not found and malformed records leave everything as it was.
     */
    public CompletableFuture<OperationResult> load(String callerId, String sessionId) {
        if (!isHost(callerId)) {
            return CompletableFuture.completedFuture(notAuthorized("load", callerId));
        }
        if (!SessionIds.isValid(sessionId)) {
            return CompletableFuture.completedFuture(
                    reject(Outcome.INVALID_ARGUMENT, "load", "invalid session id: '" + sessionId + "'"));
        }
        OperationResult gate = checkPersistenceGate("load", callerId);
        if (gate != null) {
            return CompletableFuture.completedFuture(gate);
        }

        long epochAtStart = epoch;
        phase = Phase.LOADING;
        log.fine(() -> "loading session " + sessionId);

        return callGateway(() -> gateway.load(sessionId), LoadResult.failed("gateway threw"))
                .handleAsync((result, err) -> completeLoad(sessionId, epochAtStart,
                        err != null ? LoadResult.failed(err.getMessage()) : result), sessionExecutor);
    }

    private OperationResult completeLoad(String sessionId, long epochAtStart, LoadResult result) {
        if (epochAtStart != epoch || phase != Phase.LOADING) {
            log.fine(() -> "dropping stale load completion for " + sessionId);
            return OperationResult.rejected(Outcome.STALE_COMPLETION, sessionId, "session moved on during load");
        }
        phase = Phase.ACTIVE;

        if (result == null || result.failed()) {
            String why = result == null ? "no result" : result.error();
            log.warning("load of session " + sessionId + " failed: " + why);
            return OperationResult.rejected(Outcome.PERSISTENCE_FAILURE, sessionId, "load failed: " + why);
        }
        if (!result.found()) {
            log.warning("load of session " + sessionId + " failed: not found");
            return OperationResult.rejected(Outcome.PERSISTENCE_FAILURE, sessionId, "no saved game " + sessionId);
        }

        Snapshot loaded;
        try {
            loaded = SnapshotDocuments.fromJson(result.payload());
        } catch (MalformedSnapshotException e) {
            log.warning("saved game " + sessionId + " is malformed: " + e.getMessage());
            return OperationResult.rejected(Outcome.MALFORMED_SNAPSHOT, sessionId, e.getMessage());
        }

        try {
            board.applySnapshot(loaded);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "board rejected loaded snapshot for " + sessionId, e);
            return OperationResult.rejected(Outcome.MALFORMED_SNAPSHOT, sessionId, "board rejected snapshot: " + e.getMessage());
        }

        boolean idChanged = !sessionId.equals(state.sessionId);
        state.snapshot = loaded;
        if (idChanged) {
            state.sessionId = sessionId;
            state.lastSavedSessionId = null;
        }
        log.info(() -> "session " + sessionId + " loaded (" + loaded.size() + " pieces)");

        if (idChanged) {
            channel.broadcast(new ReplicationEvent.SessionIdAssigned(sessionId));
        }
        channel.broadcast(new ReplicationEvent.StateLoaded(loaded));
        SessionView v = view();
        for (SessionListener l : listeners) {
            l.onLoaded(v);
        }
        return OperationResult.ok(sessionId, "loaded " + loaded.size() + " pieces");
    }

    // ---------- peers ----------

    /**
     * Register a (re)joining peer and bring it up to date: SessionIdAssigned,
     * StateLoaded with the current snapshot, then SaveCompleted if this
     * session has been saved. Session state is not touched.
     */
    public void peerJoined(String peerId, PeerLink link) {
        channel.addPeer(peerId, link);
        log.info(() -> "peer " + peerId + " joined");
        sendCatchUp(peerId);
    }

    public void peerLeft(String peerId) {
        channel.removePeer(peerId);
        log.info(() -> "peer " + peerId + " left");
    }

    /** A peer saw a sequence gap (typically it restarted); resend the current state. */
    private void resync(String peerId) {
        if (!channel.peers().contains(peerId)) {
            return;
        }
        log.info(() -> "catching up peer " + peerId + " after missed messages");
        sendCatchUp(peerId);
    }

    private void sendCatchUp(String peerId) {
        if (!phase.isLive() || state.sessionId == null) {
            return;
        }
        channel.sendTo(peerId, new ReplicationEvent.SessionIdAssigned(state.sessionId));
        channel.sendTo(peerId, new ReplicationEvent.StateLoaded(state.snapshot));
        if (state.lastSavedSessionId != null) {
            channel.sendTo(peerId, new ReplicationEvent.SaveCompleted(state.lastSavedSessionId));
        }
    }

    // ---------- helpers ----------

    private boolean isHost(String callerId) {
        return hostPeerId.equals(callerId);
    }

    /** Common checks for save/load after authorization. Null means "go ahead". */
    private OperationResult checkPersistenceGate(String op, String callerId) {
        if (!isHost(callerId)) {
            return notAuthorized(op, callerId);
        }
        if (!phase.isLive()) {
            return reject(Outcome.SESSION_NOT_ACTIVE, op, "no live session");
        }
        if (phase.isBusy()) {
            return reject(Outcome.OPERATION_IN_PROGRESS, op, phase + " already pending");
        }
        if (!gateway.isReady()) {
            return reject(Outcome.PERSISTENCE_UNAVAILABLE, op, "persistence store not ready");
        }
        return null;
    }

    private static <T> CompletableFuture<T> callGateway(Supplier<CompletableFuture<T>> call, T onThrow) {
        try {
            CompletableFuture<T> f = call.get();
            return f != null ? f : CompletableFuture.completedFuture(onThrow);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "persistence gateway threw instead of reporting", e);
            return CompletableFuture.completedFuture(onThrow);
        }
    }

    private OperationResult notAuthorized(String op, String callerId) {
        log.warning(op + " rejected: caller " + callerId + " is not the host");
        return OperationResult.rejected(Outcome.NOT_AUTHORIZED, state.sessionId, "only the host may " + op);
    }

    private OperationResult reject(Outcome outcome, String op, String message) {
        log.warning(op + " rejected (" + outcome + "): " + message);
        return OperationResult.rejected(outcome, state.sessionId, message);
    }
}
