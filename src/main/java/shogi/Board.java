package shogi;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Immutable 9x9 grid of optional {@link Piece}s.
 *
 * <p>Cells are addressed by {@link Square}; an empty cell reads as {@code null}. Edits go through
 * {@link Builder}, which copies the cells so a built board is never aliased by its builder.
 */
public final class Board {
  public static final int CELLS = Square.SIZE * Square.SIZE;

  private static final Board EMPTY = new Board(new Piece[CELLS]);

  private final Piece[] cells; // row-major, index = y * 9 + x

  private Board(Piece[] cells) {
    this.cells = cells;
  }

  public static Board empty() {
    return EMPTY;
  }

  /** @return the piece on {@code square}, or {@code null} if the cell is empty */
  public Piece get(Square square) {
    return cells[square.index()];
  }

  public Piece get(int x, int y) {
    return cells[Square.of(x, y).index()];
  }

  public boolean isEmpty(Square square) {
    return cells[square.index()] == null;
  }

  /** Visits every occupied cell in row-major order. */
  public void forEachPiece(BiConsumer<Square, Piece> action) {
    for (int i = 0; i < CELLS; i++) {
      if (cells[i] != null) action.accept(Square.ofIndex(i), cells[i]);
    }
  }

  public int pieceCount() {
    int n = 0;
    for (Piece p : cells) {
      if (p != null) n++;
    }
    return n;
  }

  public Builder toBuilder() {
    return new Builder(cells.clone());
  }

  public static Builder builder() {
    return new Builder(new Piece[CELLS]);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Board other)) return false;
    return Arrays.equals(cells, other.cells);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(cells);
  }

  /** Rows top to bottom, one line each, {@code .} for empty cells. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(CELLS * 3);
    for (int y = 0; y < Square.SIZE; y++) {
      for (int x = 0; x < Square.SIZE; x++) {
        Piece p = cells[y * Square.SIZE + x];
        String s = p == null ? "." : p.toSfen();
        sb.append(s.length() == 1 ? " " + s : s).append(' ');
      }
      sb.setLength(sb.length() - 1);
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Mutable scratch copy of a board. */
  public static final class Builder {
    private final Piece[] cells;

    private Builder(Piece[] cells) {
      this.cells = cells;
    }

    public Builder put(Square square, Piece piece) {
      cells[square.index()] = Objects.requireNonNull(piece, "piece must not be null");
      return this;
    }

    public Builder remove(Square square) {
      cells[square.index()] = null;
      return this;
    }

    public Piece get(Square square) {
      return cells[square.index()];
    }

    public Board build() {
      return new Board(cells.clone());
    }
  }
}
