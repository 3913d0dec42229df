package shogi;

/** A square token outside files 1-9 / ranks a-i. Never clamped. */
public class InvalidSquareException extends NotationException {
  public InvalidSquareException(String input) {
    super("Invalid square", input);
  }
}
