package shogi;

/**
 * Malformed SFEN/USI input. Nothing parsed before the failure is usable.
 */
public class NotationException extends IllegalArgumentException {
  private final String input;

  public NotationException(String message, String input) {
    super(message + ": '" + input + "'");
    this.input = input;
  }

  /** The token or string that could not be parsed. */
  public String input() {
    return input;
  }
}
