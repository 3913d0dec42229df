package shogi;

import java.util.Objects;

/**
 * Immutable identity of a piece on the board: base kind, owner and promotion state.
 *
 * <p>Promoting or demoting yields a new value. A promoted Gold or King cannot be built.
 */
public record Piece(PieceKind kind, Side owner, boolean promoted) {

  public Piece {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(owner, "owner must not be null");
    if (promoted && !kind.canPromote()) {
      throw new IllegalArgumentException(kind + " has no promoted form");
    }
  }

  public static Piece of(PieceKind kind, Side owner) {
    return new Piece(kind, owner, false);
  }

  public Piece promote() {
    return promoted ? this : new Piece(kind, owner, true);
  }

  public Piece demote() {
    return promoted ? new Piece(kind, owner, false) : this;
  }

  /** SFEN spelling: optional {@code +}, then the letter in the owner's case. */
  public String toSfen() {
    char c = owner == Side.SENTE ? kind.letter() : Character.toLowerCase(kind.letter());
    return promoted ? "+" + c : String.valueOf(c);
  }

  @Override
  public String toString() {
    return toSfen();
  }
}
