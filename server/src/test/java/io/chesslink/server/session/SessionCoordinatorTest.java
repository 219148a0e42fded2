package io.chesslink.server.session;

import io.chesslink.core.InMemoryBoard;
import io.chesslink.core.PieceKind;
import io.chesslink.core.Side;
import io.chesslink.core.Snapshot;
import io.chesslink.core.SnapshotCodec;
import io.chesslink.core.Square;
import io.chesslink.server.autosave.AutoSaveScheduler;
import io.chesslink.server.replication.DeliveryReceipt;
import io.chesslink.server.replication.LocalPeerLink;
import io.chesslink.server.replication.PeerLink;
import io.chesslink.server.replication.ReplicationChannel;
import io.chesslink.server.replication.ReplicationEvent;
import io.chesslink.server.replication.ReplicationMessage;
import io.chesslink.server.replication.SessionReplica;
import io.chesslink.storage.InMemoryRecordStore;
import io.chesslink.storage.SaveRecord;
import io.chesslink.storage.SnapshotDocuments;
import io.chesslink.storage.gateway.InMemoryPersistenceGateway;
import io.chesslink.storage.gateway.LoadResult;
import io.chesslink.storage.gateway.PersistenceGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coordinator behaviour with a direct session executor, so every completion
 * runs on the test thread as soon as its future completes.
 */
class SessionCoordinatorTest {

    private static final String HOST = "host";
    private static final Executor DIRECT = Runnable::run;

    private final ScheduledExecutorService retryTimer = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        retryTimer.shutdownNow();
    }

    /** Deliveries run inline; a failed one waits for the next event. */
    private ReplicationChannel directChannel() {
        return new ReplicationChannel("ch", DIRECT, retryTimer, Duration.ofHours(1));
    }

    // ---------- scenarios ----------

    @Test
    void move_five_triggers_autosave_under_assigned_id() {
        // --- arrange ---
        var records = new InMemoryRecordStore();
        var gateway = new InMemoryPersistenceGateway(records, Clock.fixed(Instant.ofEpochMilli(1_000L), ZoneOffset.UTC));
        var board = InMemoryBoard.standard();
        var channel = directChannel();
        var coordinator = new SessionCoordinator(HOST, board, gateway, channel, DIRECT, () -> "a1b2c3d4");

        ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
        var autosave = new AutoSaveScheduler(coordinator, timers, Duration.ofHours(1), 5, true);
        coordinator.addListener(autosave);

        try {
            // --- act ---
            assertTrue(coordinator.startSession(HOST).isOk());
            assertEquals("a1b2c3d4", coordinator.currentSessionId());
            for (int i = 1; i <= 4; i++) {
                coordinator.recordMove(HOST, i);
            }
            assertNull(records.get("a1b2c3d4"), "no save before move 5");

            board.move(Square.parse("e2"), Square.parse("e4"));
            coordinator.recordMove(HOST, 5);

            // --- assert ---
            SaveRecord saved = records.get("a1b2c3d4");
            assertNotNull(saved);
            assertEquals("a1b2c3d4", saved.sessionId());
            assertEquals(SnapshotCodec.encode(board), SnapshotDocuments.fromJson(saved.payload()));
            assertEquals(1, autosave.triggeredCount());
            assertEquals(5, coordinator.view().lastSavedMoveIndex());
            assertEquals("a1b2c3d4", coordinator.view().lastSavedSessionId());
        } finally {
            autosave.close();
            timers.shutdownNow();
        }
    }

    @Test
    void non_host_load_is_rejected_and_nothing_is_broadcast() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        h.peer.received.clear();

        OperationResult r = h.coordinator.load("client-1", "a1b2c3d4").join();

        assertEquals(Outcome.NOT_AUTHORIZED, r.outcome());
        assertTrue(h.peer.received.isEmpty());
        assertEquals(0, h.gateway.loadCalls);
        assertEquals(Phase.ACTIVE, h.coordinator.phase());
    }

    @Test
    void load_of_missing_game_keeps_prior_state() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        h.coordinator.recordMove(HOST, 3);
        SessionView before = h.coordinator.view();
        h.peer.received.clear();

        CompletableFuture<OperationResult> f = h.coordinator.load(HOST, "missing");
        assertEquals(Phase.LOADING, h.coordinator.phase());
        h.gateway.pendingLoad.complete(LoadResult.notFound());

        OperationResult r = f.join();
        assertEquals(Outcome.PERSISTENCE_FAILURE, r.outcome());
        assertEquals(Phase.ACTIVE, h.coordinator.phase());
        assertEquals(before.sessionId(), h.coordinator.currentSessionId());
        assertEquals(before.snapshot(), h.coordinator.view().snapshot());
        assertEquals(0, h.board.applyCount());
        assertTrue(h.peer.received.isEmpty());
    }

    @Test
    void second_rapid_save_is_rejected_and_only_one_record_written() {
        var h = new Harness();
        h.coordinator.startSession(HOST);

        CompletableFuture<OperationResult> first = h.coordinator.save(HOST);
        OperationResult second = h.coordinator.save(HOST).join();

        assertEquals(Outcome.OPERATION_IN_PROGRESS, second.outcome());
        assertEquals(1, h.gateway.saveCalls);

        h.gateway.pendingSave.complete(true);
        assertTrue(first.join().isOk());
        assertEquals(Phase.ACTIVE, h.coordinator.phase());
    }

    // ---------- authority ----------

    @Test
    void random_non_host_calls_never_change_state() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        h.coordinator.recordMove(HOST, 2);
        SessionView before = h.coordinator.view();
        h.peer.received.clear();

        Random rnd = new Random(42);
        for (int i = 0; i < 200; i++) {
            String caller = "peer-" + rnd.nextInt(5);
            OperationResult r = switch (rnd.nextInt(5)) {
                case 0 -> h.coordinator.startSession(caller);
                case 1 -> h.coordinator.recordMove(caller, rnd.nextInt(20));
                case 2 -> h.coordinator.save(caller).join();
                case 3 -> h.coordinator.load(caller, "g" + rnd.nextInt(3)).join();
                default -> h.coordinator.endSession(caller);
            };
            assertEquals(Outcome.NOT_AUTHORIZED, r.outcome());
        }

        assertEquals(before, h.coordinator.view());
        assertTrue(h.peer.received.isEmpty());
        assertEquals(0, h.gateway.saveCalls);
        assertEquals(0, h.gateway.loadCalls);
    }

    // ---------- gating ----------

    @Test
    void save_while_loading_is_rejected() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        h.coordinator.load(HOST, "other");

        OperationResult r = h.coordinator.save(HOST).join();

        assertEquals(Outcome.OPERATION_IN_PROGRESS, r.outcome());
        assertEquals(0, h.gateway.saveCalls);
    }

    @Test
    void save_before_start_and_after_end_is_not_active() {
        var h = new Harness();
        assertEquals(Outcome.SESSION_NOT_ACTIVE, h.coordinator.save(HOST).join().outcome());

        h.coordinator.startSession(HOST);
        h.coordinator.endSession(HOST);

        assertEquals(Outcome.SESSION_NOT_ACTIVE, h.coordinator.save(HOST).join().outcome());
        assertEquals(Outcome.SESSION_NOT_ACTIVE, h.coordinator.startSession(HOST).outcome());
        assertEquals(Outcome.SESSION_NOT_ACTIVE, h.coordinator.endSession(HOST).outcome());
    }

    @Test
    void store_not_ready_is_persistence_unavailable() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        h.gateway.ready = false;

        assertEquals(Outcome.PERSISTENCE_UNAVAILABLE, h.coordinator.save(HOST).join().outcome());
        assertEquals(Outcome.PERSISTENCE_UNAVAILABLE, h.coordinator.load(HOST, "abc").join().outcome());
        assertEquals(0, h.gateway.saveCalls);
        assertEquals(Phase.ACTIVE, h.coordinator.phase());
    }

    @Test
    void invalid_arguments_are_rejected() {
        var h = new Harness();
        h.coordinator.startSession(HOST);

        assertEquals(Outcome.INVALID_ARGUMENT, h.coordinator.load(HOST, "").join().outcome());
        assertEquals(Outcome.INVALID_ARGUMENT, h.coordinator.load(HOST, "../etc").join().outcome());
        assertEquals(Outcome.INVALID_ARGUMENT, h.coordinator.recordMove(HOST, -1).outcome());
        assertEquals(0, h.gateway.loadCalls);
    }

    @Test
    void failed_save_changes_nothing() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        h.coordinator.recordMove(HOST, 4);
        h.peer.received.clear();

        CompletableFuture<OperationResult> f = h.coordinator.save(HOST);
        h.gateway.pendingSave.complete(false);

        assertEquals(Outcome.PERSISTENCE_FAILURE, f.join().outcome());
        assertEquals(0, h.coordinator.view().lastSavedMoveIndex());
        assertNull(h.coordinator.view().lastSavedSessionId());
        assertTrue(h.peer.received.isEmpty());
    }

    // ---------- staleness ----------

    @Test
    void save_completing_after_new_game_is_stale() {
        var ids = List.of("game1", "game2").iterator();
        var h = new Harness(ids::next);
        h.coordinator.startSession(HOST);
        h.coordinator.recordMove(HOST, 6);

        CompletableFuture<OperationResult> f = h.coordinator.save(HOST);
        h.coordinator.startSession(HOST);
        h.peer.received.clear();
        h.gateway.pendingSave.complete(true);

        OperationResult r = f.join();
        assertEquals(Outcome.STALE_COMPLETION, r.outcome());
        assertEquals("game2", h.coordinator.currentSessionId());
        assertEquals(0, h.coordinator.view().lastSavedMoveIndex());
        assertNull(h.coordinator.view().lastSavedSessionId());
        assertTrue(h.peer.received.isEmpty());
    }

    @Test
    void load_completing_after_end_is_stale() {
        var h = new Harness();
        h.coordinator.startSession(HOST);

        CompletableFuture<OperationResult> f = h.coordinator.load(HOST, "saved1");
        h.coordinator.endSession(HOST);
        h.gateway.pendingLoad.complete(LoadResult.found(SnapshotDocuments.toJson(kingsOnly())));

        assertEquals(Outcome.STALE_COMPLETION, f.join().outcome());
        assertEquals(Phase.ENDED, h.coordinator.phase());
        assertEquals(0, h.board.applyCount());
    }

    // ---------- load ----------

    @Test
    void load_of_other_game_adopts_id_and_broadcasts_it() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        h.peer.received.clear();

        CompletableFuture<OperationResult> f = h.coordinator.load(HOST, "saved1");
        h.gateway.pendingLoad.complete(LoadResult.found(SnapshotDocuments.toJson(kingsOnly())));

        assertTrue(f.join().isOk());
        assertEquals("saved1", h.coordinator.currentSessionId());
        assertEquals(kingsOnly(), SnapshotCodec.encode(h.board));
        assertEquals(2, h.peer.received.size());
        assertEquals(new ReplicationEvent.SessionIdAssigned("saved1"), h.peer.received.get(0).event());
        assertEquals(new ReplicationEvent.StateLoaded(kingsOnly()), h.peer.received.get(1).event());
    }

    @Test
    void load_of_current_game_broadcasts_state_only() {
        var h = new Harness(() -> "same1");
        h.coordinator.startSession(HOST);
        h.peer.received.clear();

        CompletableFuture<OperationResult> f = h.coordinator.load(HOST, "same1");
        h.gateway.pendingLoad.complete(LoadResult.found(SnapshotDocuments.toJson(kingsOnly())));

        assertTrue(f.join().isOk());
        assertEquals(1, h.peer.received.size());
        assertInstanceOf(ReplicationEvent.StateLoaded.class, h.peer.received.get(0).event());
    }

    @Test
    void malformed_saved_game_is_rejected_without_touching_board() {
        var h = new Harness();
        h.coordinator.startSession(HOST);
        String id = h.coordinator.currentSessionId();

        CompletableFuture<OperationResult> f = h.coordinator.load(HOST, "broken");
        h.gateway.pendingLoad.complete(LoadResult.found(
                "{\"pieces\":[{\"pieceType\":\"Dragon\",\"color\":\"White\",\"position\":\"a1\"}]}"));

        assertEquals(Outcome.MALFORMED_SNAPSHOT, f.join().outcome());
        assertEquals(id, h.coordinator.currentSessionId());
        assertEquals(0, h.board.applyCount());
        assertEquals(Phase.ACTIVE, h.coordinator.phase());
    }

    @Test
    void gateway_failure_on_load_is_persistence_failure() {
        var h = new Harness();
        h.coordinator.startSession(HOST);

        CompletableFuture<OperationResult> f = h.coordinator.load(HOST, "x1");
        h.gateway.pendingLoad.complete(LoadResult.failed("connection refused"));

        assertEquals(Outcome.PERSISTENCE_FAILURE, f.join().outcome());
    }

    // ---------- peers ----------

    @Test
    void rejoining_peer_is_caught_up_in_order() {
        var h = new Harness(() -> "g1");
        h.coordinator.startSession(HOST);
        CompletableFuture<OperationResult> f = h.coordinator.save(HOST);
        h.gateway.pendingSave.complete(true);
        assertTrue(f.join().isOk());

        var late = new RecordingLink();
        h.coordinator.peerJoined("late", late);

        assertEquals(3, late.received.size());
        assertEquals(new ReplicationEvent.SessionIdAssigned("g1"), late.received.get(0).event());
        assertInstanceOf(ReplicationEvent.StateLoaded.class, late.received.get(1).event());
        assertEquals(new ReplicationEvent.SaveCompleted("g1"), late.received.get(2).event());
        assertTrue(late.received.get(0).sequence() < late.received.get(2).sequence());
    }

    @Test
    void replica_rejoining_after_missed_events_converges() {
        var ids = List.of("g1", "g2").iterator();
        var h = new Harness(ids::next);
        var replicaBoard = InMemoryBoard.empty();
        var replica = new SessionReplica("spectator", replicaBoard);
        h.coordinator.peerJoined("spectator", new LocalPeerLink(replica));

        h.coordinator.startSession(HOST);
        h.coordinator.peerLeft("spectator");

        // missed while away: new game, a move and a save
        h.coordinator.startSession(HOST);
        h.board.move(Square.parse("g1"), Square.parse("f3"));
        h.coordinator.recordMove(HOST, 1);
        CompletableFuture<OperationResult> f = h.coordinator.save(HOST);
        h.gateway.pendingSave.complete(true);
        assertTrue(f.join().isOk());
        assertEquals("g1", replica.view().sessionId());

        h.coordinator.peerJoined("spectator", new LocalPeerLink(replica));

        assertEquals("g2", replica.view().sessionId());
        assertEquals("g2", replica.view().lastSavedSessionId());
        assertEquals(h.coordinator.view().snapshot(), replica.view().snapshot());
        assertEquals(SnapshotCodec.encode(h.board), SnapshotCodec.encode(replicaBoard));
    }

    @Test
    void delivery_failure_is_recovered_on_the_next_event() {
        var h = new Harness(() -> "g1");
        var replicaBoard = InMemoryBoard.empty();
        var replica = new SessionReplica("spectator", replicaBoard);
        var link = new FlakyLink(new LocalPeerLink(replica));
        h.coordinator.startSession(HOST);
        h.coordinator.peerJoined("spectator", link);

        link.failNext = true;
        CompletableFuture<OperationResult> load = h.coordinator.load(HOST, "g1");
        h.gateway.pendingLoad.complete(LoadResult.found(SnapshotDocuments.toJson(kingsOnly())));
        assertTrue(load.join().isOk());
        assertEquals(1, h.channel.pendingFor("spectator"));

        CompletableFuture<OperationResult> save = h.coordinator.save(HOST);
        h.gateway.pendingSave.complete(true);
        assertTrue(save.join().isOk());

        assertEquals(0, h.channel.pendingFor("spectator"));
        assertEquals(kingsOnly(), replica.view().snapshot());
        assertEquals(kingsOnly(), SnapshotCodec.encode(replicaBoard));
        assertEquals("g1", replica.view().lastSavedSessionId());
    }

    @Test
    void restarted_replica_is_caught_up_after_reporting_a_gap() {
        var h = new Harness(() -> "g1");
        var link = new SwappableLink(new LocalPeerLink(new SessionReplica("spectator")));
        h.coordinator.peerJoined("spectator", link);
        h.coordinator.startSession(HOST);
        h.board.move(Square.parse("b1"), Square.parse("c3"));
        h.coordinator.recordMove(HOST, 1);

        // the peer process restarts behind the same connection
        var freshBoard = InMemoryBoard.empty();
        var fresh = new SessionReplica("spectator", freshBoard);
        link.target = new LocalPeerLink(fresh);

        CompletableFuture<OperationResult> f = h.coordinator.save(HOST);
        h.gateway.pendingSave.complete(true);
        assertTrue(f.join().isOk());

        assertEquals("g1", fresh.view().sessionId());
        assertEquals("g1", fresh.view().lastSavedSessionId());
        assertEquals(h.coordinator.view().snapshot(), fresh.view().snapshot());
        assertEquals(SnapshotCodec.encode(h.board), SnapshotCodec.encode(freshBoard));
    }

    @Test
    void peer_joining_before_start_gets_nothing() {
        var h = new Harness();
        var early = new RecordingLink();

        h.coordinator.peerJoined("early", early);

        assertTrue(early.received.isEmpty());
        assertEquals(Phase.UNINITIALIZED, h.coordinator.phase());
    }

    // ---------- fakes ----------

    private static Snapshot kingsOnly() {
        var b = InMemoryBoard.empty();
        b.place(Square.parse("e1"), PieceKind.KING, Side.WHITE);
        b.place(Square.parse("e8"), PieceKind.KING, Side.BLACK);
        return SnapshotCodec.encode(b);
    }

    private final class Harness {
        final InMemoryBoard board = InMemoryBoard.standard();
        final ManualGateway gateway = new ManualGateway();
        final ReplicationChannel channel = directChannel();
        final RecordingLink peer = new RecordingLink();
        final SessionCoordinator coordinator;

        Harness() {
            this(() -> "s" + Long.toHexString(System.nanoTime()));
        }

        Harness(Supplier<String> ids) {
            coordinator = new SessionCoordinator(HOST, board, gateway, channel, DIRECT, ids);
            coordinator.peerJoined("peer-1", peer);
        }
    }

    /** Gateway whose futures the test completes by hand. */
    private static final class ManualGateway implements PersistenceGateway {
        boolean ready = true;
        int saveCalls;
        int loadCalls;
        CompletableFuture<Boolean> pendingSave;
        CompletableFuture<LoadResult> pendingLoad;

        @Override
        public boolean isReady() {
            return ready;
        }

        @Override
        public CompletableFuture<Boolean> save(String sessionId, String payload) {
            saveCalls++;
            pendingSave = new CompletableFuture<>();
            return pendingSave;
        }

        @Override
        public CompletableFuture<LoadResult> load(String sessionId) {
            loadCalls++;
            pendingLoad = new CompletableFuture<>();
            return pendingLoad;
        }
    }

    private static final class RecordingLink implements PeerLink {
        final List<ReplicationMessage> received = new ArrayList<>();

        @Override
        public DeliveryReceipt deliver(ReplicationMessage message) {
            received.add(message);
            return DeliveryReceipt.APPLIED;
        }
    }

    /** Fails the next call when {@code failNext} is set. */
    private static final class FlakyLink implements PeerLink {
        final PeerLink delegate;
        boolean failNext;

        FlakyLink(PeerLink delegate) {
            this.delegate = delegate;
        }

        @Override
        public DeliveryReceipt deliver(ReplicationMessage message) {
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("connection reset");
            }
            return delegate.deliver(message);
        }
    }

    private static final class SwappableLink implements PeerLink {
        PeerLink target;

        SwappableLink(PeerLink target) {
            this.target = target;
        }

        @Override
        public DeliveryReceipt deliver(ReplicationMessage message) {
            return target.deliver(message);
        }
    }
}
