package shogi.contracts;

import shogi.Board;
import shogi.Hands;
import shogi.Move;
import shogi.Position;
import shogi.Square;
import shogi.records.ParsedPosition;

/**
 * Bidirectional mapping between the SFEN/USI text dialect and the in-memory values.
 *
 * <p>Every {@code parse*} method throws {@link shogi.NotationException} (or one of its subclasses)
 * on malformed input and never returns a partial or default value. Every {@code format*} method is
 * the exact inverse of its parser.
 */
public interface NotationCodec {

  /** Decodes the 9-row board field of an SFEN string. */
  Board parseBoard(String layout);

  /** Decodes the hands field: {@code -} or a run of {@code [count]<letter>}. */
  Hands parseHands(String token);

  /**
   * Decodes a position command: an optional {@code position} keyword, then {@code startpos} or
   * {@code sfen <board> <side> <hands> [n]}, then optionally {@code moves m1 m2 ...}.
   */
  ParsedPosition parsePosition(String command);

  /** Decodes {@code 7g7f}, {@code 8h2b+} or {@code P*5e}. */
  Move parseMove(String token);

  /** Decodes a two-character square such as {@code 7g}. */
  Square parseSquare(String token);

  String formatBoard(Board board);

  String formatHands(Hands hands);

  String formatMove(Move move);

  String formatSquare(Square square);

  /** Encodes {@code sfen <board> <b|w> <hands> <moveNumber>}. */
  String formatPosition(Position position, int moveNumber);

  /**
   * Cuts a position command down to its header plus the first {@code ply} moves, normalised to
   * start with {@code position}. A non-positive {@code ply} keeps the header only.
   */
  String truncateCommand(String command, int ply);
}
