package shogi;

import java.util.Objects;

/** Places an unpromoted {@code kind} from the mover's hand on the empty square {@code to}. */
public record Drop(PieceKind kind, Square to) implements Move {

  public Drop {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(to, "to must not be null");
    if (!kind.isDroppable()) {
      throw new IllegalArgumentException(kind + " cannot be dropped");
    }
  }

  @Override
  public boolean isDrop() {
    return true;
  }
}
