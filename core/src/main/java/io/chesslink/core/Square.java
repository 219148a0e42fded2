// file: core/src/main/java/io/chesslink/core/Square.java
package io.chesslink.core;

/**
 * A board square addressed by file and rank, both in 1..8.
 * <p>
 * File 1 is the a-file, rank 1 is White's back rank. {@link #toString()}
 * returns algebraic notation ("e4").
 */
public record Square(int file, int rank) implements Comparable<Square> {

    public Square {
        if (file < 1 || file > 8) {
            throw new MalformedSnapshotException("file out of range: " + file);
        }
        if (rank < 1 || rank > 8) {
            throw new MalformedSnapshotException("rank out of range: " + rank);
        }
    }

    public static Square of(int file, int rank) {
        return new Square(file, rank);
    }

    /**
     * Parse algebraic notation ("a1" .. "h8").
     *
     * @throws MalformedSnapshotException for anything else
     */
    public static Square parse(String algebraic) {
        if (algebraic == null || algebraic.length() != 2) {
            throw new MalformedSnapshotException("bad square: " + algebraic);
        }
        char f = algebraic.charAt(0);
        char r = algebraic.charAt(1);
        if (f < 'a' || f > 'h' || r < '1' || r > '8') {
            throw new MalformedSnapshotException("bad square: " + algebraic);
        }
        return new Square(f - 'a' + 1, r - '0');
    }

    /** Position in board scan order: file-major, rank-minor, 0..63. */
    public int scanIndex() {
        return (file - 1) * 8 + (rank - 1);
    }

    @Override
    public int compareTo(Square other) {
        return Integer.compare(scanIndex(), other.scanIndex());
    }

    @Override
    public String toString() {
        return "" + (char) ('a' + file - 1) + (char) ('0' + rank);
    }
}
