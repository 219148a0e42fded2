// file: core/src/main/java/io/chesslink/core/PieceRecord.java
package io.chesslink.core;

import java.util.Objects;

/**
 * One occupied square of a captured board: which piece, whose, and where.
 */
public record PieceRecord(PieceKind kind, Side owner, Square square) {

    public PieceRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(square, "square");
    }
}
