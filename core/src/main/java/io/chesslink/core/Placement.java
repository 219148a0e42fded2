// file: core/src/main/java/io/chesslink/core/Placement.java
package io.chesslink.core;

import java.util.Objects;

/** Instruction for a board collaborator: put this piece on this square. */
public record Placement(Square square, PieceKind kind, Side owner) {

    public Placement {
        Objects.requireNonNull(square, "square");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(owner, "owner");
    }
}
