// file: storage/src/main/java/io/chesslink/storage/SnapshotDocument.java
package io.chesslink.storage;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Jackson shape of a persisted board:
 * <pre>
 * {
 *   "pieces": [
 *     { "pieceType": "Rook", "color": "White", "position": "a1" },
 *     ...
 *   ]
 * }
 * </pre>
 */
public class SnapshotDocument {
    public List<PieceEntry> pieces;

    @JsonPropertyOrder({"pieceType", "color", "position"})
    public static class PieceEntry {
        public String pieceType;
        public String color;
        public String position;
    }
}
