package shogi.impl;

import java.util.Objects;
import shogi.Board;
import shogi.BoardMove;
import shogi.Drop;
import shogi.Hands;
import shogi.Move;
import shogi.MoveError;
import shogi.Piece;
import shogi.Position;
import shogi.Side;
import shogi.contracts.CoreOptions;
import shogi.contracts.MoveApplicator;
import shogi.contracts.MovementGenerator;
import shogi.contracts.NotationCodec;
import shogi.records.MoveResult;

/**
 * Applies one move to a position. Checks are limited to ownership, occupancy, hand contents, the
 * drop rank rule and, when {@link CoreOptions#checkPieceMovement()} is on, the piece's movement
 * pattern. There is no check or mate detection, so the turn always passes on success.
 */
public final class MoveApplicatorImpl implements MoveApplicator {
  private final NotationCodec codec;
  private final MovementGenerator gen;
  private final CoreOptions opts;

  public MoveApplicatorImpl(NotationCodec codec, MovementGenerator gen, CoreOptions opts) {
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.gen = Objects.requireNonNull(gen, "gen must not be null");
    this.opts = Objects.requireNonNull(opts, "opts must not be null");
  }

  @Override
  public MoveResult apply(Position position, String token) {
    return apply(position, codec.parseMove(token));
  }

  @Override
  public MoveResult apply(Position position, Move move) {
    Objects.requireNonNull(position, "position must not be null");
    Objects.requireNonNull(move, "move must not be null");
    return move instanceof BoardMove bm ? applyBoardMove(position, bm) : applyDrop(position, (Drop) move);
  }

  private MoveResult applyBoardMove(Position pos, BoardMove move) {
    Side mover = pos.sideToMove();
    Board board = pos.board();

    Piece piece = board.get(move.from());
    if (piece == null) return MoveResult.failure(pos, MoveError.EMPTY_SOURCE);
    if (piece.owner() != mover) return MoveResult.failure(pos, MoveError.WRONG_OWNER);

    Piece target = board.get(move.to());
    if (target != null && target.owner() == mover) {
      return MoveResult.failure(pos, MoveError.OCCUPIED_BY_SELF);
    }
    if (move.promote() && !piece.kind().canPromote()) {
      return MoveResult.failure(pos, MoveError.UNPROMOTABLE_PIECE);
    }
    if (opts.checkPieceMovement()
        && gen.reachable(board, move.from(), piece).noneMatch(move.to()::equals)) {
      return MoveResult.failure(pos, MoveError.UNREACHABLE_SQUARE);
    }

    Hands hands = pos.hands();
    if (target != null && target.kind().isDroppable()) { // a captured King leaves the game
      hands = hands.toBuilder().add(mover, target.kind(), 1).build();
    }
    Board next = board.toBuilder()
        .remove(move.from())
        .put(move.to(), move.promote() ? piece.promote() : piece)
        .build();
    return MoveResult.success(new Position(next, hands, mover.opposite()));
  }

  private MoveResult applyDrop(Position pos, Drop drop) {
    Side mover = pos.sideToMove();
    if (pos.handCount(mover, drop.kind()) <= 0) {
      return MoveResult.failure(pos, MoveError.NO_PIECE_IN_HAND);
    }
    if (!pos.board().isEmpty(drop.to())) {
      return MoveResult.failure(pos, MoveError.OCCUPIED);
    }
    if (!RuleChecks.isDropRankAllowed(drop.kind(), mover, drop.to().y())) {
      return MoveResult.failure(pos, MoveError.ILLEGAL_DROP_RANK);
    }

    Board next = pos.board().toBuilder().put(drop.to(), Piece.of(drop.kind(), mover)).build();
    Hands hands = pos.hands().toBuilder().add(mover, drop.kind(), -1).build();
    return MoveResult.success(new Position(next, hands, mover.opposite()));
  }

  @Override
  public boolean canPromote(Position position, BoardMove move) {
    Piece piece = position.pieceAt(move.from());
    return piece != null && RuleChecks.canPromote(piece, move.from(), move.to());
  }
}
