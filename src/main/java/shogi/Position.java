package shogi;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a game: board, both hands and the side to move.
 *
 * <p>Every operation that "changes" a position returns a new one, so a caller's position survives
 * any rejected move untouched.
 */
public record Position(Board board, Hands hands, Side sideToMove) {

  public Position {
    Objects.requireNonNull(board, "board must not be null");
    Objects.requireNonNull(hands, "hands must not be null");
    Objects.requireNonNull(sideToMove, "sideToMove must not be null");
  }

  /** @return the piece on {@code square}, or {@code null} */
  public Piece pieceAt(Square square) {
    return board.get(square);
  }

  public int handCount(Side side, PieceKind kind) {
    return hands.count(side, kind);
  }

  /** Equal, independent copy. The components are immutable, so nothing is shared mutably. */
  public Position copy() {
    return new Position(board.toBuilder().build(), hands.toBuilder().build(), sideToMove);
  }

  public Position withSideToMove(Side side) {
    return side == sideToMove ? this : new Position(board, hands, side);
  }

  /**
   * Kinds whose total count, on the board and in both hands, exceeds a full set. Any entry means
   * the position could not have been reached by play.
   *
   * @return kind to actual total, only for kinds over the limit
   */
  public Map<PieceKind, Integer> materialExcess() {
    Map<PieceKind, Integer> totals = new EnumMap<>(PieceKind.class);
    board.forEachPiece((sq, p) -> totals.merge(p.kind(), 1, Integer::sum));
    for (Side side : Side.values()) {
      for (PieceKind kind : PieceKind.HAND_ORDER) {
        int n = hands.count(side, kind);
        if (n > 0) totals.merge(kind, n, Integer::sum);
      }
    }
    totals.entrySet().removeIf(e -> e.getValue() <= e.getKey().materialCount());
    return totals;
  }
}
