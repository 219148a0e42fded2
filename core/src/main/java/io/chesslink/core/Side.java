// file: core/src/main/java/io/chesslink/core/Side.java
package io.chesslink.core;

/**
 * Owner of a piece.
 * <p>
 * {@link #displayName()} is the spelling used in persisted documents
 * ("White" / "Black"); {@link #letter()} is the one-character form used by the
 * textual wire encoding.
 */
public enum Side {
    WHITE("White", 'w'),
    BLACK("Black", 'b');

    private final String displayName;
    private final char letter;

    Side(String displayName, char letter) {
        this.displayName = displayName;
        this.letter = letter;
    }

    public String displayName() { return displayName; }

    public char letter() { return letter; }

    public static Side fromDisplayName(String name) {
        for (Side s : values()) {
            if (s.displayName.equals(name)) {
                return s;
            }
        }
        throw new MalformedSnapshotException("unknown color: " + name);
    }

    public static Side fromLetter(char c) {
        for (Side s : values()) {
            if (s.letter == c) {
                return s;
            }
        }
        throw new MalformedSnapshotException("unknown owner letter: " + c);
    }
}
