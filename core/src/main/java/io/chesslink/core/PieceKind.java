// file: core/src/main/java/io/chesslink/core/PieceKind.java
package io.chesslink.core;

/**
 * The six chess piece kinds, with their document name and wire letter.
 */
public enum PieceKind {
    PAWN("Pawn", 'P'),
    KNIGHT("Knight", 'N'),
    BISHOP("Bishop", 'B'),
    ROOK("Rook", 'R'),
    QUEEN("Queen", 'Q'),
    KING("King", 'K');

    private final String displayName;
    private final char letter;

    PieceKind(String displayName, char letter) {
        this.displayName = displayName;
        this.letter = letter;
    }

    public String displayName() { return displayName; }

    public char letter() { return letter; }

    public static PieceKind fromDisplayName(String name) {
        for (PieceKind k : values()) {
            if (k.displayName.equals(name)) {
                return k;
            }
        }
        throw new MalformedSnapshotException("unknown pieceType: " + name);
    }

    public static PieceKind fromLetter(char c) {
        for (PieceKind k : values()) {
            if (k.letter == c) {
                return k;
            }
        }
        throw new MalformedSnapshotException("unknown piece letter: " + c);
    }
}
