package shogi;

import java.util.Objects;

/** Moves the piece on {@code from} to {@code to}, promoting it if {@code promote} is set. */
public record BoardMove(Square from, Square to, boolean promote) implements Move {

  public BoardMove {
    Objects.requireNonNull(from, "from must not be null");
    Objects.requireNonNull(to, "to must not be null");
  }

  public BoardMove(Square from, Square to) {
    this(from, to, false);
  }

  @Override
  public boolean isDrop() {
    return false;
  }
}
