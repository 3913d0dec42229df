package shogi.contracts;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import shogi.Board;
import shogi.Piece;
import shogi.PieceKind;
import shogi.Side;
import shogi.Square;

public interface MovementGenerator {

  /**
   * Squares {@code piece} standing on {@code from} controls on {@code board}, own pieces included.
   * Sliders stop at, and include, the first occupied square. The stream is lazy and single-use.
   */
  Stream<Square> attacks(Board board, Square from, Piece piece);

  /** {@link #attacks} without the squares held by the piece's own side. */
  Stream<Square> reachable(Board board, Square from, Piece piece);

  Set<Square> attackSet(Board board, Side side);

  boolean isAttacked(Board board, Square square, Side bySide);

  /** True iff a piece of {@code owner}, other than the one on {@code square}, attacks it. */
  boolean isDefended(Board board, Square square, Side owner);

  /** Empty squares where {@code side} may drop {@code kind} under the rank rule. */
  List<Square> dropTargets(Board board, PieceKind kind, Side side);

  /**
   * Squares holding {@code side}'s {@code kind} (with the given promotion state) that can reach
   * {@code to}, nearest first, then same file, then same rank.
   */
  List<Square> sources(Board board, PieceKind kind, boolean promoted, Square to, Side side);
}
