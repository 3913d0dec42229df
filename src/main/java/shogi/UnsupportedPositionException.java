package shogi;

/** A position command whose header is neither {@code startpos} nor {@code sfen}. */
public class UnsupportedPositionException extends NotationException {
  public UnsupportedPositionException(String input) {
    super("Unsupported position header", input);
  }
}
