// file: core/src/main/java/io/chesslink/core/InMemoryBoard.java
package io.chesslink.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Minimal board used by the console host and by tests.
 * <p>
 * Knows nothing about legality: {@link #move(Square, Square)} just relocates
 * whatever sits on {@code from}, capturing anything on {@code to}.
 * Iteration order is unspecified.
 */
public final class InMemoryBoard implements BoardModel {

    private record Piece(PieceKind kind, Side owner) {}

    private static final PieceKind[] BACK_RANK = {
            PieceKind.ROOK, PieceKind.KNIGHT, PieceKind.BISHOP, PieceKind.QUEEN,
            PieceKind.KING, PieceKind.BISHOP, PieceKind.KNIGHT, PieceKind.ROOK
    };

    private final Map<Square, Piece> squares = new HashMap<>();
    private int applyCount;

    public static InMemoryBoard empty() {
        return new InMemoryBoard();
    }

    public static InMemoryBoard standard() {
        InMemoryBoard b = new InMemoryBoard();
        for (int file = 1; file <= 8; file++) {
            b.place(Square.of(file, 1), BACK_RANK[file - 1], Side.WHITE);
            b.place(Square.of(file, 2), PieceKind.PAWN, Side.WHITE);
            b.place(Square.of(file, 7), PieceKind.PAWN, Side.BLACK);
            b.place(Square.of(file, 8), BACK_RANK[file - 1], Side.BLACK);
        }
        return b;
    }

    public synchronized void place(Square square, PieceKind kind, Side owner) {
        squares.put(Objects.requireNonNull(square, "square"), new Piece(
                Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(owner, "owner")));
    }

    /**
     * Move the piece on {@code from} to {@code to}.
     *
     * @throws IllegalArgumentException if {@code from} is empty
     */
    public synchronized void move(Square from, Square to) {
        Piece p = squares.remove(Objects.requireNonNull(from, "from"));
        if (p == null) {
            throw new IllegalArgumentException("no piece on " + from);
        }
        squares.put(Objects.requireNonNull(to, "to"), p);
    }

    public synchronized Optional<PieceRecord> pieceAt(Square square) {
        Piece p = squares.get(square);
        return p == null ? Optional.empty() : Optional.of(new PieceRecord(p.kind(), p.owner(), square));
    }

    public synchronized int pieceCount() {
        return squares.size();
    }

    /** Number of times {@link #applySnapshot(Snapshot)} has been called. */
    public synchronized int applyCount() {
        return applyCount;
    }

    @Override
    public synchronized void forEachOccupiedSquare(SquareVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (Map.Entry<Square, Piece> e : squares.entrySet()) {
            visitor.visit(e.getKey(), e.getValue().kind(), e.getValue().owner());
        }
    }

    @Override
    public synchronized void applySnapshot(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        squares.clear();
        for (Placement p : SnapshotCodec.decode(snapshot)) {
            squares.put(p.square(), new Piece(p.kind(), p.owner()));
        }
        applyCount++;
    }
}
