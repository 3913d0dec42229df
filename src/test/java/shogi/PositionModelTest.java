package shogi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import shogi.records.MoveResult;
import shogi.records.Timeline;

public class PositionModelTest {

  private static Position kings() {
    Board b = Board.builder()
        .put(Square.of(4, 0), Piece.of(PieceKind.KING, Side.GOTE))
        .put(Square.of(4, 8), Piece.of(PieceKind.KING, Side.SENTE))
        .build();
    return new Position(b, Hands.empty(), Side.SENTE);
  }

  /* ── squares & pieces ─────────────────────────────────────────── */

  @Test
  void squareCoordinates() {
    Square sq = Square.of(2, 6);
    assertEquals(7, sq.file());
    assertEquals(7, sq.rank());
    assertEquals(sq, Square.ofIndex(sq.index()));
    assertSame(Square.of(8, 8), Square.ofIndex(80));
    assertThrows(IllegalArgumentException.class, () -> Square.of(9, 0));
    assertThrows(IllegalArgumentException.class, () -> new Square(0, -1));
  }

  @Test
  void pieceValidation() {
    assertThrows(IllegalArgumentException.class, () -> new Piece(PieceKind.GOLD, Side.SENTE, true));
    assertThrows(IllegalArgumentException.class, () -> new Piece(PieceKind.KING, Side.GOTE, true));
    assertThrows(NullPointerException.class, () -> new Piece(null, Side.GOTE, false));

    Piece p = Piece.of(PieceKind.SILVER, Side.GOTE);
    assertEquals("s", p.toSfen());
    assertEquals("+s", p.promote().toSfen());
    assertEquals(p, p.promote().demote());
    assertSame(p, p.demote());
  }

  @Test
  void kindLookup() {
    assertEquals(PieceKind.KNIGHT, PieceKind.fromLetter('n'));
    assertEquals(PieceKind.ROOK, PieceKind.fromLetter('R'));
    assertNull(PieceKind.fromLetter('x'));
    assertFalse(PieceKind.KING.isDroppable());
    assertEquals("馬", PieceKind.BISHOP.japaneseName(true));
    assertEquals(List.of(PieceKind.ROOK, PieceKind.BISHOP, PieceKind.GOLD, PieceKind.SILVER,
        PieceKind.KNIGHT, PieceKind.LANCE, PieceKind.PAWN), PieceKind.HAND_ORDER);
  }

  @Test
  void kingCannotBeDropped() {
    assertThrows(IllegalArgumentException.class, () -> new Drop(PieceKind.KING, Square.of(0, 0)));
  }

  /* ── board & hands ────────────────────────────────────────────── */

  @Test
  void builderDoesNotAliasBuiltBoard() {
    Board.Builder b = Board.builder().put(Square.of(0, 0), Piece.of(PieceKind.LANCE, Side.GOTE));
    Board first = b.build();
    b.remove(Square.of(0, 0));
    assertEquals(1, first.pieceCount());
    assertEquals(Board.empty(), b.build());
  }

  @Test
  void handsRejectKingAndNegativeCounts() {
    assertThrows(IllegalArgumentException.class,
        () -> Hands.builder().add(Side.SENTE, PieceKind.KING, 1));
    assertThrows(IllegalArgumentException.class,
        () -> Hands.builder().add(Side.SENTE, PieceKind.PAWN, -1));
    Hands h = Hands.builder().set(Side.GOTE, PieceKind.GOLD, 3).build();
    assertEquals(3, h.count(Side.GOTE, PieceKind.GOLD));
    assertTrue(h.isEmpty(Side.SENTE));
    assertFalse(h.isEmpty());
    assertEquals(0, h.count(Side.GOTE, PieceKind.KING));
  }

  /* ── position ─────────────────────────────────────────────────── */

  @Test
  void copyIsEqualAndIndependent() {
    Position p = kings();
    Position c = p.copy();
    assertEquals(p, c);
    assertNotSame(p.board(), c.board());
    assertEquals(p.hashCode(), c.hashCode());
    assertEquals(Side.GOTE, p.withSideToMove(Side.GOTE).sideToMove());
    assertSame(p, p.withSideToMove(Side.SENTE));
  }

  @Test
  void materialExcessCountsBoardAndHands() {
    assertTrue(kings().materialExcess().isEmpty());

    Board.Builder b = kings().board().toBuilder();
    for (int x = 0; x < 9; x++) b.put(Square.of(x, 6), Piece.of(PieceKind.PAWN, Side.SENTE));
    Hands h = Hands.builder()
        .add(Side.SENTE, PieceKind.PAWN, 5)
        .add(Side.GOTE, PieceKind.PAWN, 5)
        .add(Side.GOTE, PieceKind.ROOK, 2)
        .build();
    Position crowded = new Position(b.build(), h, Side.SENTE);
    assertEquals(Map.of(PieceKind.PAWN, 19), crowded.materialExcess());
  }

  /* ── value records ────────────────────────────────────────────── */

  @Test
  void moveResultKeepsInputOnFailure() {
    Position p = kings();
    MoveResult r = MoveResult.failure(p, MoveError.EMPTY_SOURCE);
    assertFalse(r.isSuccess());
    assertSame(p, r.position());
    assertTrue(MoveResult.success(p).isSuccess());
  }

  @Test
  void timelineNeedsOneSnapshotPerPly() {
    Position p = kings();
    assertThrows(IllegalArgumentException.class,
        () -> new Timeline("startpos", List.of(p), List.of("5i5h"), null));
    Timeline t = new Timeline("startpos", List.of(p), List.of(), null);
    assertEquals(0, t.plyCount());
    assertFalse(t.isFinished());
    assertEquals("position startpos", t.commandAt(-3));
  }

  @Test
  void exceptionsCarryTheirInput() {
    ReplayException e = new ReplayException(4, "P*5e", MoveError.NO_PIECE_IN_HAND);
    assertEquals(4, e.ply());
    assertTrue(e.getMessage().contains("P*5e"));
    assertEquals("9z", new InvalidSquareException("9z").input());
    assertInstanceOf(NotationException.class, new UnsupportedPositionException("kif"));
  }
}
