package shogi.contracts;

import shogi.BoardMove;
import shogi.Move;
import shogi.Position;
import shogi.records.MoveResult;

public interface MoveApplicator {
  /**
   * Applies {@code move} for {@code position.sideToMove()}.
   *
   * @return the next position with the turn flipped, or the untouched {@code position} and the
   *     reason the move was refused
   */
  MoveResult apply(Position position, Move move);

  /**
   * Decodes {@code token} and applies it.
   *
   * @throws shogi.NotationException if {@code token} is malformed
   */
  MoveResult apply(Position position, String token);

  /** Whether the piece on the source of {@code move} may choose to promote. Informational only. */
  boolean canPromote(Position position, BoardMove move);
}
