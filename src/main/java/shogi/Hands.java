package shogi;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable captured-piece counts for both players, one counter per droppable kind.
 *
 * <p>Counts are never negative and a King never sits in a hand; both are rejected as caller
 * errors.
 */
public final class Hands {
  private static final int KINDS = PieceKind.KING.ordinal(); // P..R, King excluded

  private static final Hands EMPTY = new Hands(new int[Side.values().length][KINDS]);

  private final int[][] counts; // [side][kind]

  private Hands(int[][] counts) {
    this.counts = counts;
  }

  public static Hands empty() {
    return EMPTY;
  }

  public int count(Side side, PieceKind kind) {
    Objects.requireNonNull(side, "side must not be null");
    return kind.isDroppable() ? counts[side.ordinal()][kind.ordinal()] : 0;
  }

  public boolean isEmpty(Side side) {
    for (int c : counts[side.ordinal()]) {
      if (c != 0) return false;
    }
    return true;
  }

  public boolean isEmpty() {
    return isEmpty(Side.SENTE) && isEmpty(Side.GOTE);
  }

  public Builder toBuilder() {
    return new Builder(copy(counts));
  }

  public static Builder builder() {
    return new Builder(new int[Side.values().length][KINDS]);
  }

  private static int[][] copy(int[][] src) {
    int[][] out = new int[src.length][];
    for (int i = 0; i < src.length; i++) out[i] = src[i].clone();
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Hands other)) return false;
    return Arrays.deepEquals(counts, other.counts);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(counts);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Side side : Side.values()) {
      sb.append(side).append('{');
      for (PieceKind kind : PieceKind.HAND_ORDER) {
        int n = counts[side.ordinal()][kind.ordinal()];
        if (n > 0) sb.append(kind.letter()).append('=').append(n).append(' ');
      }
      if (sb.charAt(sb.length() - 1) == ' ') sb.setLength(sb.length() - 1);
      sb.append("} ");
    }
    return sb.toString().trim();
  }

  /** Mutable scratch copy of a pair of hands. */
  public static final class Builder {
    private final int[][] counts;

    private Builder(int[][] counts) {
      this.counts = counts;
    }

    /** Adds {@code delta} (may be negative) to a counter; the result must stay non-negative. */
    public Builder add(Side side, PieceKind kind, int delta) {
      Objects.requireNonNull(side, "side must not be null");
      if (!kind.isDroppable()) {
        throw new IllegalArgumentException(kind + " cannot be held in hand");
      }
      int next = counts[side.ordinal()][kind.ordinal()] + delta;
      if (next < 0) {
        throw new IllegalArgumentException(
            "hand count for " + side + " " + kind + " would become " + next);
      }
      counts[side.ordinal()][kind.ordinal()] = next;
      return this;
    }

    public Builder set(Side side, PieceKind kind, int count) {
      if (count < 0) throw new IllegalArgumentException("negative hand count: " + count);
      return add(side, kind, count - get(side, kind));
    }

    public int get(Side side, PieceKind kind) {
      return kind.isDroppable() ? counts[side.ordinal()][kind.ordinal()] : 0;
    }

    public Hands build() {
      return new Hands(copy(counts));
    }
  }
}
