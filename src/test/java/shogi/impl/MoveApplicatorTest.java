package shogi.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import shogi.Board;
import shogi.BoardMove;
import shogi.Drop;
import shogi.MoveError;
import shogi.NotationException;
import shogi.Piece;
import shogi.PieceKind;
import shogi.Position;
import shogi.Side;
import shogi.Square;
import shogi.contracts.MoveApplicator;
import shogi.contracts.NotationCodec;
import shogi.records.MoveResult;

public class MoveApplicatorTest {

  /* ── wiring ───────────────────────────────────────────────────── */
  private static final NotationCodec CODEC = new NotationCodecImpl();
  private static final MoveApplicator APPLY =
      new MoveApplicatorImpl(CODEC, new MovementGeneratorImpl(), new CoreOptionsImpl());
  private static final Position START = NotationCodecImpl.startPosition();

  private static Position sfen(String s) {
    return CODEC.parsePosition("sfen " + s).position();
  }

  private static void assertRefused(Position before, String move, MoveError expected) {
    MoveResult r = APPLY.apply(before, move);
    assertFalse(r.isSuccess(), move);
    assertEquals(expected, r.error(), move);
    assertSame(before, r.position(), "refused move must hand back the input position");
  }

  /* ── board moves ──────────────────────────────────────────────── */

  @Test
  void pawnPushFlipsTheTurn() {
    MoveResult r = APPLY.apply(START, "7g7f");
    assertTrue(r.isSuccess());
    Position next = r.position();
    assertNull(next.pieceAt(Square.of(2, 6)));
    assertEquals(Piece.of(PieceKind.PAWN, Side.SENTE), next.pieceAt(Square.of(2, 5)));
    assertEquals(Side.GOTE, next.sideToMove());
    assertTrue(next.hands().isEmpty());
    assertEquals("lnsgkgsnl/1r5b1/ppppppppp/9/9/2P6/PP1PPPPPP/1B5R1/LNSGKGSNL",
        CODEC.formatBoard(next.board()));
    // input untouched
    assertEquals(Piece.of(PieceKind.PAWN, Side.SENTE), START.pieceAt(Square.of(2, 6)));
  }

  @Test
  void captureGoesToHandDemoted() {
    Position before = sfen("4k4/9/4+p4/9/4R4/9/9/9/4K4 b - 1");
    MoveResult r = APPLY.apply(before, "5e5c");
    assertTrue(r.isSuccess());
    assertEquals(1, r.position().handCount(Side.SENTE, PieceKind.PAWN));
    assertEquals(Piece.of(PieceKind.ROOK, Side.SENTE), r.position().pieceAt(Square.of(4, 2)));
  }

  @Test
  void promotionFlagPromotes() {
    Position after = APPLY.apply(APPLY.apply(START, "7g7f").position(), "3c3d").position();
    MoveResult r = APPLY.apply(after, "8h2b+");
    assertTrue(r.isSuccess());
    assertEquals(new Piece(PieceKind.BISHOP, Side.SENTE, true), r.position().pieceAt(Square.of(7, 1)));
    assertEquals(1, r.position().handCount(Side.SENTE, PieceKind.BISHOP));
  }

  @Test
  void promotionFlagOnPromotedPieceIsIgnored() {
    Position before = sfen("4k4/9/9/9/4+R4/9/9/9/4K4 b - 1");
    MoveResult r = APPLY.apply(before, "5e5d+");
    assertTrue(r.isSuccess());
    assertEquals(new Piece(PieceKind.ROOK, Side.SENTE, true), r.position().pieceAt(Square.of(4, 3)));
  }

  @Test
  void capturedKingLeavesTheGame() {
    Position before = sfen("4k4/4R4/9/9/9/9/9/9/4K4 b - 1");
    MoveResult r = APPLY.apply(before, "5b5a");
    assertTrue(r.isSuccess());
    assertEquals(Piece.of(PieceKind.ROOK, Side.SENTE), r.position().pieceAt(Square.of(4, 0)));
    assertTrue(r.position().hands().isEmpty());
    assertEquals(2, r.position().board().pieceCount());
  }

  @Test
  void boardMoveRefusals() {
    assertRefused(START, "5e5d", MoveError.EMPTY_SOURCE);
    assertRefused(START, "3c3d", MoveError.WRONG_OWNER);
    assertRefused(START, "9i9g", MoveError.OCCUPIED_BY_SELF);
    assertRefused(START, "6i5h+", MoveError.UNPROMOTABLE_PIECE);
    assertRefused(START, "5i5h+", MoveError.UNPROMOTABLE_PIECE);
    assertRefused(START, "7g7e", MoveError.UNREACHABLE_SQUARE);
    assertRefused(START, "8h4d", MoveError.UNREACHABLE_SQUARE);
    assertRefused(START, "2h2c", MoveError.UNREACHABLE_SQUARE);
  }

  @Test
  void movementCheckCanBeTurnedOff() {
    CoreOptionsImpl opts = new CoreOptionsImpl();
    opts.setOption(CoreOptionsImpl.CHECK_PIECE_MOVEMENT, "false");
    MoveApplicator lenient = new MoveApplicatorImpl(CODEC, new MovementGeneratorImpl(), opts);

    MoveResult r = lenient.apply(START, "7g7e");
    assertTrue(r.isSuccess());
    assertEquals(Piece.of(PieceKind.PAWN, Side.SENTE), r.position().pieceAt(Square.of(2, 4)));
    // ownership and occupancy still apply
    assertEquals(MoveError.WRONG_OWNER, lenient.apply(START, "3c3d").error());
    assertEquals(MoveError.OCCUPIED_BY_SELF, lenient.apply(START, "9i9g").error());
  }

  /* ── drops ────────────────────────────────────────────────────── */

  @Test
  void dropFromHand() {
    Position before = sfen("4k4/9/9/9/9/9/9/9/4K4 b 2P 1");
    MoveResult r = APPLY.apply(before, new Drop(PieceKind.PAWN, Square.of(4, 4)));
    assertTrue(r.isSuccess());
    assertEquals(Piece.of(PieceKind.PAWN, Side.SENTE), r.position().pieceAt(Square.of(4, 4)));
    assertEquals(1, r.position().handCount(Side.SENTE, PieceKind.PAWN));
    assertEquals(Side.GOTE, r.position().sideToMove());
  }

  @Test
  void dropWithEmptyHand() {
    assertRefused(START, "P*5e", MoveError.NO_PIECE_IN_HAND);
    // Gote's pawn does not help Sente
    assertRefused(sfen("4k4/9/9/9/9/9/9/9/4K4 b p 1"), "P*5e", MoveError.NO_PIECE_IN_HAND);
  }

  @Test
  void dropOnOccupiedSquare() {
    assertRefused(sfen("4k4/9/9/9/9/9/9/9/4K4 b P 1"), "P*5a", MoveError.OCCUPIED);
  }

  @Test
  void dropRankRule() {
    Position sente = sfen("4k4/9/9/9/9/9/9/9/4K4 b PLN 1");
    assertRefused(sente, "P*3a", MoveError.ILLEGAL_DROP_RANK);
    assertRefused(sente, "L*3a", MoveError.ILLEGAL_DROP_RANK);
    assertRefused(sente, "N*3a", MoveError.ILLEGAL_DROP_RANK);
    assertRefused(sente, "N*3b", MoveError.ILLEGAL_DROP_RANK);
    assertTrue(APPLY.apply(sente, "N*3c").isSuccess());
    assertTrue(APPLY.apply(sente, "P*3b").isSuccess());

    Position gote = sfen("4k4/9/9/9/9/9/9/9/4K4 w pn 1");
    assertRefused(gote, "P*3i", MoveError.ILLEGAL_DROP_RANK);
    assertRefused(gote, "N*3h", MoveError.ILLEGAL_DROP_RANK);
    assertTrue(APPLY.apply(gote, "N*3g").isSuccess());
  }

  @Test
  void malformedTokenThrows() {
    assertThrows(NotationException.class, () -> APPLY.apply(START, "7g7"));
    assertThrows(NotationException.class, () -> APPLY.apply(START, "K*5e"));
  }

  /* ── promotion hint ───────────────────────────────────────────── */

  @Test
  void canPromoteReportsZoneEntry() {
    Position open = APPLY.apply(APPLY.apply(START, "7g7f").position(), "3c3d").position();
    assertTrue(APPLY.canPromote(open, new BoardMove(Square.of(1, 7), Square.of(7, 1))));
    assertFalse(APPLY.canPromote(START, new BoardMove(Square.of(2, 6), Square.of(2, 5))));
    assertFalse(APPLY.canPromote(START, new BoardMove(Square.of(3, 8), Square.of(4, 7))));
    assertFalse(APPLY.canPromote(START, new BoardMove(Square.of(4, 4), Square.of(4, 3))));
  }

  @Test
  void boardIsNeverSharedWithTheResult() {
    Board before = START.board();
    APPLY.apply(START, "2g2f");
    assertEquals(before, START.board());
    assertEquals(NotationCodecImpl.startPosition(), START);
  }
}
