// file: core/src/main/java/io/chesslink/core/Snapshot.java
package io.chesslink.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable capture of every occupied square on the board.
 * <p>
 * Invariants:
 *  - Records are held in board scan order (file 1..8, then rank 1..8).
 *  - No two records share a square.
 */
public final class Snapshot {
    private static final Snapshot EMPTY = new Snapshot(List.of());

    private final List<PieceRecord> pieces;

    private Snapshot(List<PieceRecord> sortedPieces) {
        this.pieces = sortedPieces;
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    /**
     * Build a snapshot from records in any order.
     *
     * @throws MalformedSnapshotException if two records share a square
     */
    public static Snapshot of(List<PieceRecord> records) {
        Objects.requireNonNull(records, "records");
        List<PieceRecord> sorted = new ArrayList<>(records);
        for (PieceRecord r : sorted) {
            Objects.requireNonNull(r, "record");
        }
        sorted.sort(Comparator.comparing(PieceRecord::square));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).square().equals(sorted.get(i - 1).square())) {
                throw new MalformedSnapshotException("duplicate square: " + sorted.get(i).square());
            }
        }
        return sorted.isEmpty() ? EMPTY : new Snapshot(List.copyOf(sorted));
    }

    public List<PieceRecord> pieces() {
        return pieces;
    }

    public int size() {
        return pieces.size();
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot other)) return false;
        return pieces.equals(other.pieces);
    }

    @Override
    public int hashCode() {
        return pieces.hashCode();
    }

    @Override
    public String toString() {
        return "Snapshot[" + SnapshotCodec.format(this) + "]";
    }
}
