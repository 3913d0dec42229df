package shogi.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import shogi.Board;
import shogi.Piece;
import shogi.PieceKind;
import shogi.Side;
import shogi.Square;
import shogi.contracts.MovementGenerator;

/**
 * Table-driven movement generator. Every piece is a list of directions, each either a single step
 * or a slide; one ray walker handles all of them, so blocking behaves the same for every slider.
 */
public final class MovementGeneratorImpl implements MovementGenerator {

  /** One movement direction in Sente's frame (negative dy is forward). */
  private record Direction(int dx, int dy, boolean slide) {}

  /* ── direction tables ─────────────────────────────────────────── */
  private static final List<Direction> GOLD_STEPS = steps(-1, -1, 0, -1, 1, -1, -1, 0, 1, 0, 0, 1);
  private static final List<Direction> KING_STEPS =
      steps(-1, -1, 0, -1, 1, -1, -1, 0, 1, 0, -1, 1, 0, 1, 1, 1);
  private static final List<Direction> SILVER_STEPS = steps(-1, -1, 0, -1, 1, -1, -1, 1, 1, 1);
  private static final List<Direction> KNIGHT_JUMPS = steps(-1, -2, 1, -2);
  private static final List<Direction> DIAGONAL_SLIDES = slides(-1, -1, 1, -1, -1, 1, 1, 1);
  private static final List<Direction> ORTHOGONAL_SLIDES = slides(0, -1, -1, 0, 1, 0, 0, 1);
  private static final List<Direction> DIAGONAL_STEPS = steps(-1, -1, 1, -1, -1, 1, 1, 1);
  private static final List<Direction> ORTHOGONAL_STEPS = steps(0, -1, -1, 0, 1, 0, 0, 1);

  private static final Map<PieceKind, List<Direction>> BASE = new EnumMap<>(PieceKind.class);
  private static final Map<PieceKind, List<Direction>> PROMOTED = new EnumMap<>(PieceKind.class);

  static {
    BASE.put(PieceKind.PAWN, steps(0, -1));
    BASE.put(PieceKind.LANCE, slides(0, -1));
    BASE.put(PieceKind.KNIGHT, KNIGHT_JUMPS);
    BASE.put(PieceKind.SILVER, SILVER_STEPS);
    BASE.put(PieceKind.GOLD, GOLD_STEPS);
    BASE.put(PieceKind.BISHOP, DIAGONAL_SLIDES);
    BASE.put(PieceKind.ROOK, ORTHOGONAL_SLIDES);
    BASE.put(PieceKind.KING, KING_STEPS);

    PROMOTED.put(PieceKind.PAWN, GOLD_STEPS);
    PROMOTED.put(PieceKind.LANCE, GOLD_STEPS);
    PROMOTED.put(PieceKind.KNIGHT, GOLD_STEPS);
    PROMOTED.put(PieceKind.SILVER, GOLD_STEPS);
    PROMOTED.put(PieceKind.BISHOP, concat(DIAGONAL_SLIDES, ORTHOGONAL_STEPS)); // horse
    PROMOTED.put(PieceKind.ROOK, concat(ORTHOGONAL_SLIDES, DIAGONAL_STEPS)); // dragon
  }

  private static List<Direction> steps(int... d) {
    return directions(false, d);
  }

  private static List<Direction> slides(int... d) {
    return directions(true, d);
  }

  private static List<Direction> directions(boolean slide, int... d) {
    List<Direction> out = new ArrayList<>(d.length / 2);
    for (int i = 0; i < d.length; i += 2) out.add(new Direction(d[i], d[i + 1], slide));
    return List.copyOf(out);
  }

  private static List<Direction> concat(List<Direction> a, List<Direction> b) {
    List<Direction> out = new ArrayList<>(a);
    out.addAll(b);
    return List.copyOf(out);
  }

  private static List<Direction> directionsOf(Piece piece) {
    return piece.promoted() ? PROMOTED.get(piece.kind()) : BASE.get(piece.kind());
  }

  /* ── ray walker ───────────────────────────────────────────────── */

  /**
   * Walks each direction in turn from the origin. A ray ends at the board edge or on the first
   * occupied square, which is still yielded.
   */
  private static final class RayIterator implements Iterator<Square> {
    private final Board board;
    private final Square from;
    private final int sign;
    private final Iterator<Direction> dirs;

    private Direction dir;
    private int dist;
    private Square next;

    RayIterator(Board board, Square from, Piece piece) {
      this.board = board;
      this.from = from;
      this.sign = piece.owner() == Side.SENTE ? 1 : -1;
      this.dirs = directionsOf(piece).iterator();
      advance();
    }

    private void advance() {
      next = null;
      while (next == null) {
        if (dir == null || !dir.slide() || rayBlocked()) {
          if (!dirs.hasNext()) return;
          dir = dirs.next();
          dist = 0;
        }
        dist++;
        int x = from.x() + dir.dx() * dist;
        int y = from.y() + dir.dy() * dist * sign;
        if (Square.onBoard(x, y)) {
          next = Square.of(x, y);
        } else {
          dir = null;
        }
      }
    }

    /** True once the previous square of the current slide was occupied or off the board. */
    private boolean rayBlocked() {
      int x = from.x() + dir.dx() * dist;
      int y = from.y() + dir.dy() * dist * sign;
      return !Square.onBoard(x, y) || !board.isEmpty(Square.of(x, y));
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public Square next() {
      if (next == null) throw new NoSuchElementException();
      Square out = next;
      advance();
      return out;
    }
  }

  /* ── MovementGenerator ────────────────────────────────────────── */

  @Override
  public Stream<Square> attacks(Board board, Square from, Piece piece) {
    Iterator<Square> it = new RayIterator(board, from, piece);
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            it, Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
        false);
  }

  @Override
  public Stream<Square> reachable(Board board, Square from, Piece piece) {
    return attacks(board, from, piece).filter(sq -> {
      Piece target = board.get(sq);
      return target == null || target.owner() != piece.owner();
    });
  }

  @Override
  public Set<Square> attackSet(Board board, Side side) {
    Set<Square> out = new HashSet<>();
    board.forEachPiece((sq, p) -> {
      if (p.owner() == side) attacks(board, sq, p).forEach(out::add);
    });
    return Collections.unmodifiableSet(out);
  }

  @Override
  public boolean isAttacked(Board board, Square square, Side bySide) {
    return anyAttacker(board, square, bySide, null);
  }

  @Override
  public boolean isDefended(Board board, Square square, Side owner) {
    return anyAttacker(board, square, owner, square);
  }

  private boolean anyAttacker(Board board, Square target, Side side, Square skip) {
    for (int i = 0; i < Board.CELLS; i++) {
      Square sq = Square.ofIndex(i);
      Piece p = board.get(sq);
      if (p == null || p.owner() != side || sq.equals(skip)) continue;
      if (attacks(board, sq, p).anyMatch(target::equals)) return true;
    }
    return false;
  }

  @Override
  public List<Square> dropTargets(Board board, PieceKind kind, Side side) {
    if (!kind.isDroppable()) return List.of();
    List<Square> out = new ArrayList<>();
    for (int i = 0; i < Board.CELLS; i++) {
      Square sq = Square.ofIndex(i);
      if (board.isEmpty(sq) && RuleChecks.isDropRankAllowed(kind, side, sq.y())) out.add(sq);
    }
    return out;
  }

  @Override
  public List<Square> sources(Board board, PieceKind kind, boolean promoted, Square to, Side side) {
    Piece wanted = new Piece(kind, side, promoted);
    List<Square> out = new ArrayList<>();
    board.forEachPiece((sq, p) -> {
      if (p.equals(wanted) && reachable(board, sq, p).anyMatch(to::equals)) out.add(sq);
    });
    out.sort(Comparator
        .comparingInt((Square sq) -> Math.abs(sq.x() - to.x()) + Math.abs(sq.y() - to.y()))
        .thenComparing(sq -> sq.x() != to.x())
        .thenComparing(sq -> sq.y() != to.y()));
    return out;
  }
}
