package shogi.records;

import java.util.List;
import java.util.Objects;
import shogi.Board;
import shogi.Hands;
import shogi.Position;
import shogi.Side;

/**
 * Immutable replay of a game record: one snapshot per ply, ply 0 being the header position.
 *
 * @param header    the position header the replay started from ({@code startpos} or {@code sfen
 *                  ...}), used to rebuild commands
 * @param positions snapshots, {@code positions.get(n)} is the position after {@code n} moves
 * @param moves     move tokens; {@code moves.get(n)} leads from ply {@code n} to {@code n + 1}
 * @param result    the game-end token that closed the record ({@code resign}, {@code win},
 *                  {@code draw}), or {@code null}
 */
public record Timeline(String header, List<Position> positions, List<String> moves, String result) {

  public Timeline {
    Objects.requireNonNull(header, "header must not be null");
    positions = List.copyOf(positions);
    moves = List.copyOf(moves);
    if (positions.size() != moves.size() + 1) {
      throw new IllegalArgumentException(
          "expected " + (moves.size() + 1) + " snapshots, got " + positions.size());
    }
  }

  /** Number of moves replayed; valid plies are {@code 0..plyCount()}. */
  public int plyCount() {
    return moves.size();
  }

  public Position positionAt(int ply) {
    return positions.get(ply);
  }

  public Side sideToMoveAt(int ply) {
    return positions.get(ply).sideToMove();
  }

  public Side startingSide() {
    return positions.get(0).sideToMove();
  }

  public List<Board> boards() {
    return positions.stream().map(Position::board).toList();
  }

  public List<Hands> hands() {
    return positions.stream().map(Position::hands).toList();
  }

  public boolean isFinished() {
    return result != null;
  }

  /**
   * Rebuilds the {@code position} command that reaches {@code ply}: the header followed by the
   * first {@code ply} moves. Values outside {@code 0..plyCount()} are clamped.
   */
  public String commandAt(int ply) {
    int n = Math.max(0, Math.min(ply, moves.size()));
    StringBuilder sb = new StringBuilder("position ").append(header);
    if (n > 0) {
      sb.append(" moves");
      for (int i = 0; i < n; i++) sb.append(' ').append(moves.get(i));
    }
    return sb.toString();
  }
}
