package shogi.records;

import java.util.Objects;
import shogi.MoveError;
import shogi.Position;

/**
 * Outcome of applying one move.
 *
 * @param position the next position on success, the unchanged input position on failure
 * @param error    {@code null} on success, otherwise why the move was refused
 */
public record MoveResult(Position position, MoveError error) {

  public MoveResult {
    Objects.requireNonNull(position, "position must not be null");
  }

  public static MoveResult success(Position next) {
    return new MoveResult(next, null);
  }

  public static MoveResult failure(Position unchanged, MoveError error) {
    return new MoveResult(unchanged, Objects.requireNonNull(error, "error must not be null"));
  }

  public boolean isSuccess() {
    return error == null;
  }
}
