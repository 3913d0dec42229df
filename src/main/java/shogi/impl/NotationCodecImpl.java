package shogi.impl;

import static shogi.constants.CoreConstants.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import shogi.Board;
import shogi.BoardMove;
import shogi.Drop;
import shogi.Hands;
import shogi.InvalidSquareException;
import shogi.Move;
import shogi.NotationException;
import shogi.Piece;
import shogi.PieceKind;
import shogi.Position;
import shogi.Side;
import shogi.Square;
import shogi.UnsupportedPositionException;
import shogi.contracts.NotationCodec;
import shogi.records.ParsedPosition;

/**
 * SFEN/USI codec. Files 9..1 map to x 0..8 and ranks a..i to y 0..8 here and nowhere else.
 */
public final class NotationCodecImpl implements NotationCodec {

  private static final Board START_BOARD = parseBoardField(STARTPOS_BOARD);
  private static final Position START_POSITION =
      new Position(START_BOARD, Hands.empty(), Side.SENTE);

  /** The standard opening position, Sente to move, empty hands. */
  public static Position startPosition() {
    return START_POSITION;
  }

  /* ────── board ────── */

  @Override
  public Board parseBoard(String layout) {
    Objects.requireNonNull(layout, "layout must not be null");
    return parseBoardField(layout);
  }

  private static Board parseBoardField(String layout) {
    String[] rows = layout.split("/", -1);
    if (rows.length != Square.SIZE) {
      throw new NotationException("Board must have 9 rows, got " + rows.length, layout);
    }
    Board.Builder b = Board.builder();
    for (int y = 0; y < Square.SIZE; y++) {
      String row = rows[y];
      int x = 0;
      for (int i = 0; i < row.length(); i++) {
        char c = row.charAt(i);
        if (c >= '1' && c <= '9') {
          x += c - '0';
          if (x > Square.SIZE) throw new NotationException("Row wider than 9 cells", row);
          continue;
        }
        boolean promoted = false;
        if (c == '+') {
          if (++i >= row.length()) throw new NotationException("Dangling '+' in row", row);
          c = row.charAt(i);
          promoted = true;
        }
        if (x >= Square.SIZE) throw new NotationException("Row wider than 9 cells", row);
        b.put(Square.of(x, y), pieceOf(c, promoted, row));
        x++;
      }
      if (x != Square.SIZE) {
        throw new NotationException("Row does not expand to 9 cells", row);
      }
    }
    return b.build();
  }

  private static Piece pieceOf(char c, boolean promoted, String context) {
    PieceKind kind = PieceKind.fromLetter(c);
    if (kind == null) throw new NotationException("Unknown piece letter '" + c + "'", context);
    if (promoted && !kind.canPromote()) {
      throw new NotationException(kind + " cannot be promoted", context);
    }
    Side owner = Character.isUpperCase(c) ? Side.SENTE : Side.GOTE;
    return new Piece(kind, owner, promoted);
  }

  @Override
  public String formatBoard(Board board) {
    StringBuilder sb = new StringBuilder(96);
    for (int y = 0; y < Square.SIZE; y++) {
      if (y > 0) sb.append('/');
      int empty = 0;
      for (int x = 0; x < Square.SIZE; x++) {
        Piece p = board.get(x, y);
        if (p == null) {
          empty++;
          continue;
        }
        if (empty > 0) {
          sb.append(empty);
          empty = 0;
        }
        sb.append(p.toSfen());
      }
      if (empty > 0) sb.append(empty);
    }
    return sb.toString();
  }

  /* ────── hands ────── */

  @Override
  public Hands parseHands(String token) {
    Objects.requireNonNull(token, "token must not be null");
    if (token.equals(EMPTY_HAND)) return Hands.empty();
    if (token.isEmpty()) throw new NotationException("Empty hands field", token);

    Hands.Builder h = Hands.builder();
    int i = 0;
    while (i < token.length()) {
      int start = i;
      while (i < token.length() && Character.isDigit(token.charAt(i))) i++;
      int count;
      try {
        count = i > start ? Integer.parseInt(token.substring(start, i)) : 1;
      } catch (NumberFormatException e) {
        throw new NotationException("Bad hand count", token);
      }
      if (i >= token.length()) throw new NotationException("Hand count without a piece", token);
      char c = token.charAt(i++);
      PieceKind kind = PieceKind.fromLetter(c);
      if (kind == null) throw new NotationException("Unknown piece letter '" + c + "'", token);
      if (!kind.isDroppable()) throw new NotationException("King cannot be held in hand", token);
      Side side = Character.isUpperCase(c) ? Side.SENTE : Side.GOTE;
      if ((long) h.get(side, kind) + count > Integer.MAX_VALUE) {
        throw new NotationException("Hand count too large", token);
      }
      h.add(side, kind, count);
    }
    return h.build();
  }

  @Override
  public String formatHands(Hands hands) {
    if (hands.isEmpty()) return EMPTY_HAND;
    StringBuilder sb = new StringBuilder();
    for (Side side : Side.values()) {
      for (PieceKind kind : PieceKind.HAND_ORDER) {
        int n = hands.count(side, kind);
        if (n == 0) continue;
        if (n > 1) sb.append(n);
        sb.append(side == Side.SENTE ? kind.letter() : Character.toLowerCase(kind.letter()));
      }
    }
    return sb.toString();
  }

  /* ────── position command ────── */

  @Override
  public ParsedPosition parsePosition(String command) {
    Objects.requireNonNull(command, "command must not be null");
    List<String> tokens = headTokens(command);

    int movesAt = indexOfMoves(tokens);
    List<String> base = movesAt < 0 ? tokens : tokens.subList(0, movesAt);
    List<String> moves = movesAt < 0 ? List.of() : tokens.subList(movesAt + 1, tokens.size());

    if (base.isEmpty() || base.get(0).equalsIgnoreCase(KW_STARTPOS)) {
      if (base.size() > 1) throw new NotationException("Unexpected token after startpos", command);
      return new ParsedPosition(KW_STARTPOS, START_POSITION, 1, moves);
    }
    if (!base.get(0).equalsIgnoreCase(KW_SFEN)) {
      throw new UnsupportedPositionException(base.get(0));
    }
    if (base.size() < 2) throw new NotationException("sfen without a board", command);
    if (base.size() > 5) throw new NotationException("Too many sfen fields", command);

    Board board = parseBoard(base.get(1));
    Side side = base.size() > 2 ? parseSide(base.get(2)) : Side.SENTE;
    Hands hands = base.size() > 3 ? parseHands(base.get(3)) : Hands.empty();
    int moveNumber = base.size() > 4 ? parseMoveNumber(base.get(4)) : 1;

    Position position = new Position(board, hands, side);
    return new ParsedPosition(formatPosition(position, moveNumber), position, moveNumber, moves);
  }

  /** Tokens with a leading {@code position} removed; a bare {@code moves} list gets {@code startpos}. */
  private static List<String> headTokens(String command) {
    String trimmed = command.trim();
    List<String> tokens = new ArrayList<>();
    if (!trimmed.isEmpty()) tokens.addAll(Arrays.asList(trimmed.split("\\s+")));
    if (!tokens.isEmpty() && tokens.get(0).equalsIgnoreCase(KW_POSITION)) tokens.remove(0);
    if (!tokens.isEmpty() && tokens.get(0).equalsIgnoreCase(KW_MOVES)) tokens.add(0, KW_STARTPOS);
    return tokens;
  }

  private static int indexOfMoves(List<String> tokens) {
    for (int i = 0; i < tokens.size(); i++) {
      if (tokens.get(i).equalsIgnoreCase(KW_MOVES)) return i;
    }
    return -1;
  }

  private static Side parseSide(String token) {
    if (token.equalsIgnoreCase("b")) return Side.SENTE;
    if (token.equalsIgnoreCase("w")) return Side.GOTE;
    throw new NotationException("Invalid side to move", token);
  }

  private static int parseMoveNumber(String token) {
    try {
      int n = Integer.parseUnsignedInt(token);
      if (n < 1) throw new NumberFormatException();
      return n;
    } catch (NumberFormatException e) {
      throw new NotationException("Invalid move number", token);
    }
  }

  @Override
  public String formatPosition(Position position, int moveNumber) {
    if (moveNumber < 1) throw new IllegalArgumentException("move number must be >= 1: " + moveNumber);
    return KW_SFEN + ' ' + formatBoard(position.board()) + ' ' + position.sideToMove().sfenToken()
        + ' ' + formatHands(position.hands()) + ' ' + moveNumber;
  }

  @Override
  public String truncateCommand(String command, int ply) {
    Objects.requireNonNull(command, "command must not be null");
    List<String> tokens = headTokens(command);
    if (tokens.isEmpty()) tokens.add(KW_STARTPOS);

    int movesAt = indexOfMoves(tokens);
    List<String> head = movesAt < 0 ? tokens : tokens.subList(0, movesAt);
    StringBuilder sb = new StringBuilder(KW_POSITION).append(' ').append(String.join(" ", head));
    if (movesAt < 0 || ply <= 0 || movesAt + 1 == tokens.size()) return sb.toString();

    int end = Math.min(tokens.size(), movesAt + 1 + ply);
    sb.append(' ').append(KW_MOVES);
    for (int i = movesAt + 1; i < end; i++) sb.append(' ').append(tokens.get(i));
    return sb.toString();
  }

  /* ────── moves & squares ────── */

  @Override
  public Move parseMove(String token) {
    Objects.requireNonNull(token, "token must not be null");
    if (token.length() == 4 && token.charAt(1) == '*') {
      PieceKind kind = PieceKind.fromLetter(token.charAt(0));
      if (kind == null) throw new NotationException("Unknown drop piece", token);
      if (!kind.isDroppable()) throw new NotationException("King cannot be dropped", token);
      return new Drop(kind, parseSquare(token.substring(2)));
    }
    boolean promote = token.length() == 5 && token.charAt(4) == '+';
    if (token.length() != 4 && !promote) {
      throw new NotationException("Malformed move", token);
    }
    return new BoardMove(parseSquare(token.substring(0, 2)), parseSquare(token.substring(2, 4)), promote);
  }

  @Override
  public String formatMove(Move move) {
    if (move instanceof BoardMove bm) {
      return formatSquare(bm.from()) + formatSquare(bm.to()) + (bm.promote() ? "+" : "");
    }
    Drop drop = (Drop) move;
    return drop.kind().letter() + "*" + formatSquare(drop.to());
  }

  @Override
  public Square parseSquare(String token) {
    Objects.requireNonNull(token, "token must not be null");
    if (token.length() != 2) throw new InvalidSquareException(token);
    char f = token.charAt(0);
    char r = token.charAt(1);
    if (f < '1' || f > '9' || r < 'a' || r > 'i') throw new InvalidSquareException(token);
    return Square.of(Square.SIZE - (f - '0'), r - 'a');
  }

  @Override
  public String formatSquare(Square square) {
    return String.valueOf(square.file()) + (char) ('a' + square.y());
  }
}
