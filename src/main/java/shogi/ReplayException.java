package shogi;

/**
 * A move in a replayed game was refused. The timeline is not usable past {@link #ply()} - 1.
 */
public class ReplayException extends RuntimeException {
  private final int ply;
  private final String move;
  private final MoveError error;

  public ReplayException(int ply, String move, MoveError error) {
    super("could not replay ply " + ply + " (" + move + "): " + error.description());
    this.ply = ply;
    this.move = move;
    this.error = error;
  }

  /** 1-based ply of the refused move; the last good snapshot is {@code ply - 1}. */
  public int ply() {
    return ply;
  }

  public String move() {
    return move;
  }

  public MoveError error() {
    return error;
  }
}
