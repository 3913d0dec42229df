package shogi.impl;

import static shogi.constants.CoreConstants.*;

import shogi.Piece;
import shogi.PieceKind;
import shogi.Side;
import shogi.Square;

/**
 * Rank-based rules shared by the applicator and the generator: promotion zones, forced promotion
 * and drop restrictions. Only these narrow checks exist; there is no check or mate detection.
 */
public final class RuleChecks {
  private RuleChecks() {}

  /** Whether row {@code y} lies in {@code side}'s promotion zone (the far three ranks). */
  public static boolean inPromotionZone(Side side, int y) {
    return side == Side.SENTE ? y < PROMOTION_ZONE_DEPTH : y >= BOARD_SIZE - PROMOTION_ZONE_DEPTH;
  }

  /** Distance of row {@code y} from {@code side}'s far edge: 0 on the last rank. */
  static int ranksFromFarEdge(Side side, int y) {
    return side == Side.SENTE ? y : BOARD_SIZE - 1 - y;
  }

  /**
   * Whether {@code piece} moving {@code from -> to} may choose to promote: it has a promoted form,
   * is not promoted yet, and either end of the move lies in its owner's zone.
   */
  public static boolean canPromote(Piece piece, Square from, Square to) {
    if (!piece.kind().canPromote() || piece.promoted()) return false;
    return inPromotionZone(piece.owner(), from.y()) || inPromotionZone(piece.owner(), to.y());
  }

  /**
   * Whether an unpromoted {@code piece} arriving on {@code to} would have no move left: Pawn and
   * Lance on the last rank, Knight on the last two.
   */
  public static boolean mustPromote(Piece piece, Square to) {
    if (piece.promoted()) return false;
    return !hasForwardRoom(piece.kind(), ranksFromFarEdge(piece.owner(), to.y()));
  }

  /** Drop rank rule: the same room test as {@link #mustPromote}, applied to a dropped piece. */
  public static boolean isDropRankAllowed(PieceKind kind, Side side, int y) {
    return hasForwardRoom(kind, ranksFromFarEdge(side, y));
  }

  private static boolean hasForwardRoom(PieceKind kind, int fromFarEdge) {
    return switch (kind) {
      case PAWN, LANCE -> fromFarEdge >= 1;
      case KNIGHT -> fromFarEdge >= 2;
      default -> true;
    };
  }
}
