// file: core/src/main/java/io/chesslink/core/BoardModel.java
package io.chesslink.core;

/**
 * Board collaborator seen by the session layer.
 * <p>
 * The session layer only ever reads the board through
 * {@link #forEachOccupiedSquare(SquareVisitor)} (once per capture) and writes
 * it through {@link #applySnapshot(Snapshot)} (once per successful load).
 * Move legality, rendering and input are the board's own business.
 */
public interface BoardModel {

    /** Visit every occupied square, in any order. */
    void forEachOccupiedSquare(SquareVisitor visitor);

    /** Replace the whole position with the given snapshot. */
    void applySnapshot(Snapshot snapshot);

    @FunctionalInterface
    interface SquareVisitor {
        void visit(Square square, PieceKind kind, Side owner);
    }
}
