// file: core/src/main/java/io/chesslink/core/SnapshotCodec.java
package io.chesslink.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pure conversion between a board, its {@link Snapshot}, and the flat textual
 * wire form used by replication messages.
 * <p>
 * Wire form: comma-separated tokens {@code <kind><owner>@<square>}, e.g.
 * {@code Rw@a1,Pw@a2,Pb@a7}. Kind letter is upper case (K Q R B N P), owner
 * letter is lower case (w, b). The empty string is the empty snapshot.
 * <p>
 * Every decode path validates the full input before returning anything, so a
 * malformed input never yields a partial result.
 */
public final class SnapshotCodec {

    private SnapshotCodec() {
        // utility
    }

    /** Capture the board. Output is in scan order whatever order the board visits in. */
    public static Snapshot encode(BoardModel board) {
        Objects.requireNonNull(board, "board");
        List<PieceRecord> records = new ArrayList<>(32);
        board.forEachOccupiedSquare((square, kind, owner) -> records.add(new PieceRecord(kind, owner, square)));
        return Snapshot.of(records);
    }

    /** Board-apply instructions for a snapshot, in scan order. */
    public static List<Placement> decode(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        List<Placement> out = new ArrayList<>(snapshot.size());
        for (PieceRecord r : snapshot.pieces()) {
            out.add(new Placement(r.square(), r.kind(), r.owner()));
        }
        return List.copyOf(out);
    }

    /**
     * Validate raw records and produce placements.
     *
     * @throws MalformedSnapshotException on duplicate squares or null entries
     */
    public static List<Placement> decode(List<PieceRecord> records) {
        if (records == null) {
            throw new MalformedSnapshotException("records must not be null");
        }
        for (PieceRecord r : records) {
            if (r == null) {
                throw new MalformedSnapshotException("null piece record");
            }
        }
        return decode(Snapshot.of(records));
    }

    /** Render the wire form. */
    public static String format(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        StringBuilder sb = new StringBuilder(snapshot.size() * 6);
        for (PieceRecord r : snapshot.pieces()) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(r.kind().letter()).append(r.owner().letter()).append('@').append(r.square());
        }
        return sb.toString();
    }

    /**
     * Parse the wire form.
     *
     * @throws MalformedSnapshotException on bad tokens, unknown letters,
     *                                    out-of-range squares or duplicates
     */
    public static Snapshot parse(String text) {
        if (text == null) {
            throw new MalformedSnapshotException("snapshot text must not be null");
        }
        if (text.isEmpty()) {
            return Snapshot.empty();
        }
        String[] tokens = text.split(",", -1);
        List<PieceRecord> records = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            records.add(parseToken(token));
        }
        return Snapshot.of(records);
    }

    private static PieceRecord parseToken(String token) {
        // "Kw@e1"
        if (token.length() != 5 || token.charAt(2) != '@') {
            throw new MalformedSnapshotException("bad token: '" + token + "'");
        }
        PieceKind kind = PieceKind.fromLetter(token.charAt(0));
        Side owner = Side.fromLetter(token.charAt(1));
        Square square = Square.parse(token.substring(3));
        return new PieceRecord(kind, owner, square);
    }
}
