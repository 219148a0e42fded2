// file: server/src/main/java/io/chesslink/server/replication/ReplicationProtos.java
package io.chesslink.server.replication;

import io.chesslink.core.SnapshotCodec;

/**
 * Conversion between {@link ReplicationMessage} and its protobuf form.
 */
final class ReplicationProtos {

    private ReplicationProtos() {
        // utility
    }

    static ReplicationProto.ReplicationMessage toProto(ReplicationMessage msg) {
        var b = ReplicationProto.ReplicationMessage.newBuilder()
                .setChannelId(msg.channelId())
                .setSequence(msg.sequence());

        ReplicationEvent event = msg.event();
        if (event instanceof ReplicationEvent.SessionIdAssigned assigned) {
            b.setSessionIdAssigned(ReplicationProto.SessionIdAssigned.newBuilder()
                    .setSessionId(assigned.sessionId()));
        } else if (event instanceof ReplicationEvent.SaveCompleted saved) {
            b.setSaveCompleted(ReplicationProto.SaveCompleted.newBuilder()
                    .setSessionId(saved.sessionId()));
        } else if (event instanceof ReplicationEvent.StateLoaded loaded) {
            b.setStateLoaded(ReplicationProto.StateLoaded.newBuilder()
                    .setSnapshotPayload(SnapshotCodec.format(loaded.snapshot())));
        } else {
            throw new IllegalArgumentException("unknown event type: " + event.getClass().getName());
        }
        return b.build();
    }

    /**
     * @throws IllegalArgumentException if no event is set or the snapshot payload is malformed
     */
    static ReplicationMessage fromProto(ReplicationProto.ReplicationMessage proto) {
        ReplicationEvent event = switch (proto.getEventCase()) {
            case SESSION_ID_ASSIGNED -> new ReplicationEvent.SessionIdAssigned(
                    proto.getSessionIdAssigned().getSessionId());
            case SAVE_COMPLETED -> new ReplicationEvent.SaveCompleted(
                    proto.getSaveCompleted().getSessionId());
            case STATE_LOADED -> new ReplicationEvent.StateLoaded(
                    SnapshotCodec.parse(proto.getStateLoaded().getSnapshotPayload()));
            case EVENT_NOT_SET -> throw new IllegalArgumentException("replication message has no event");
        };
        return new ReplicationMessage(proto.getChannelId(), proto.getSequence(), event);
    }
}
