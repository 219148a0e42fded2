package io.chesslink.server.replication;

import io.chesslink.core.InMemoryBoard;
import io.chesslink.core.Snapshot;
import io.chesslink.core.SnapshotCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionReplicaTest {

    private static final Snapshot KINGS = SnapshotCodec.parse("Kw@e1,Kb@e8");

    @Test
    void applies_events_in_order_and_tracks_view() {
        var board = InMemoryBoard.empty();
        var replica = new SessionReplica("peer-1", board);

        assertEquals(ApplyResult.APPLIED, replica.apply(msg("ch", 1, new ReplicationEvent.SessionIdAssigned("g1"))));
        assertEquals(ApplyResult.APPLIED, replica.apply(msg("ch", 2, new ReplicationEvent.StateLoaded(KINGS))));
        assertEquals(ApplyResult.APPLIED, replica.apply(msg("ch", 3, new ReplicationEvent.SaveCompleted("g1"))));

        ReplicaView v = replica.view();
        assertEquals("g1", v.sessionId());
        assertEquals(KINGS, v.snapshot());
        assertEquals("g1", v.lastSavedSessionId());
        assertEquals(3L, v.lastAppliedSequence());
        assertEquals(KINGS, SnapshotCodec.encode(board));
    }

    @Test
    void duplicate_or_older_sequence_is_dropped() {
        var board = InMemoryBoard.empty();
        var replica = new SessionReplica("peer-1", board);
        var loaded = msg("ch", 1, new ReplicationEvent.StateLoaded(KINGS));

        assertEquals(ApplyResult.APPLIED, replica.apply(loaded));
        assertEquals(ApplyResult.DUPLICATE, replica.apply(loaded));
        assertEquals(ApplyResult.APPLIED, replica.apply(msg("ch", 2, new ReplicationEvent.SessionIdAssigned("g2"))));
        assertEquals(ApplyResult.DUPLICATE, replica.apply(msg("ch", 1, new ReplicationEvent.SessionIdAssigned("old"))));

        assertEquals("g2", replica.view().sessionId());
        assertEquals(1, board.applyCount());
        assertEquals(KINGS, SnapshotCodec.encode(board));
    }

    @Test
    void new_channel_resets_watermark() {
        var replica = new SessionReplica("peer-1");
        replica.apply(msg("old-host", 1, new ReplicationEvent.SessionIdAssigned("g1")));
        replica.apply(msg("old-host", 2, new ReplicationEvent.SaveCompleted("g1")));

        assertEquals(ApplyResult.APPLIED, replica.apply(msg("new-host", 1, new ReplicationEvent.SessionIdAssigned("g2"))));
        assertEquals("g2", replica.view().sessionId());
        assertEquals(1L, replica.lastAppliedSequence());
    }

    @Test
    void skipped_sequence_is_applied_but_reported_as_gap() {
        var board = InMemoryBoard.empty();
        var replica = new SessionReplica("peer-1", board);

        assertEquals(ApplyResult.APPLIED, replica.apply(msg("ch", 1, new ReplicationEvent.SessionIdAssigned("g1"))));
        // seq 2 (StateLoaded) never arrived
        ApplyResult result = replica.apply(msg("ch", 3, new ReplicationEvent.SaveCompleted("g1")));

        assertEquals(ApplyResult.APPLIED_AFTER_GAP, result);
        assertTrue(result.applied());
        assertEquals("g1", replica.view().lastSavedSessionId());
        assertNull(replica.view().snapshot());
        assertEquals(3L, replica.lastAppliedSequence());

        // the catch-up that follows is contiguous again
        assertEquals(ApplyResult.APPLIED, replica.apply(msg("ch", 4, new ReplicationEvent.StateLoaded(KINGS))));
        assertEquals(KINGS, SnapshotCodec.encode(board));
    }

    @Test
    void first_message_of_a_channel_after_a_late_join_is_a_gap() {
        var replica = new SessionReplica("peer-1");

        assertEquals(ApplyResult.APPLIED_AFTER_GAP,
                replica.apply(msg("ch", 5, new ReplicationEvent.SessionIdAssigned("g1"))));
        assertEquals(ApplyResult.APPLIED,
                replica.apply(msg("ch", 6, new ReplicationEvent.SaveCompleted("g1"))));
    }

    @Test
    void listeners_see_only_applied_updates() {
        var replica = new SessionReplica("peer-1");
        List<ReplicaView> seen = new ArrayList<>();
        replica.addListener(seen::add);

        var m = msg("ch", 1, new ReplicationEvent.SessionIdAssigned("g1"));
        replica.apply(m);
        replica.apply(m);

        assertEquals(1, seen.size());
        assertEquals("g1", seen.get(0).sessionId());
    }

    private static ReplicationMessage msg(String channel, long seq, ReplicationEvent e) {
        return new ReplicationMessage(channel, seq, e);
    }
}
