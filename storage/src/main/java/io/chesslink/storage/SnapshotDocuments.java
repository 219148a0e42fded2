// file: storage/src/main/java/io/chesslink/storage/SnapshotDocuments.java
package io.chesslink.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chesslink.core.MalformedSnapshotException;
import io.chesslink.core.PieceKind;
import io.chesslink.core.PieceRecord;
import io.chesslink.core.Side;
import io.chesslink.core.Snapshot;
import io.chesslink.core.Square;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps a {@link Snapshot} to the persisted JSON document and back.
 * <p>
 * Pieces are written in scan order. Reading validates the whole document
 * before returning: unknown pieceType/color, a bad position, a duplicate
 * position or invalid JSON all raise {@link MalformedSnapshotException}.
 */
public final class SnapshotDocuments {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SnapshotDocuments() {
        // utility
    }

    public static SnapshotDocument toDocument(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        SnapshotDocument doc = new SnapshotDocument();
        doc.pieces = new ArrayList<>(snapshot.size());
        for (PieceRecord r : snapshot.pieces()) {
            SnapshotDocument.PieceEntry e = new SnapshotDocument.PieceEntry();
            e.pieceType = r.kind().displayName();
            e.color = r.owner().displayName();
            e.position = r.square().toString();
            doc.pieces.add(e);
        }
        return doc;
    }

    public static Snapshot fromDocument(SnapshotDocument doc) {
        if (doc == null || doc.pieces == null) {
            throw new MalformedSnapshotException("document has no pieces array");
        }
        List<PieceRecord> records = new ArrayList<>(doc.pieces.size());
        for (SnapshotDocument.PieceEntry e : doc.pieces) {
            if (e == null) {
                throw new MalformedSnapshotException("null piece entry");
            }
            records.add(new PieceRecord(
                    PieceKind.fromDisplayName(e.pieceType),
                    Side.fromDisplayName(e.color),
                    Square.parse(e.position)
            ));
        }
        return Snapshot.of(records);
    }

    public static String toJson(Snapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(toDocument(snapshot));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("snapshot document not serializable", e);
        }
    }

    public static Snapshot fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedSnapshotException("empty document");
        }
        try {
            return fromDocument(MAPPER.readValue(json, SnapshotDocument.class));
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException("invalid document JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Snapshot fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedSnapshotException("document must be a JSON object");
        }
        try {
            return fromDocument(MAPPER.treeToValue(node, SnapshotDocument.class));
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException("invalid document JSON: " + e.getOriginalMessage(), e);
        }
    }
}
