package shogi;

/**
 * One of the 81 board cells in display coordinates: x runs 0..8 left to right (file 9 to 1), y
 * runs 0..8 top to bottom (rank a to i). Notation files and ranks exist only at the codec boundary.
 */
public record Square(int x, int y) {
  public static final int SIZE = 9;

  private static final Square[] ALL = new Square[SIZE * SIZE];

  static {
    for (int y = 0; y < SIZE; y++) {
      for (int x = 0; x < SIZE; x++) {
        ALL[y * SIZE + x] = new Square(x, y);
      }
    }
  }

  public Square {
    if (!onBoard(x, y)) {
      throw new IllegalArgumentException("square off the board: (" + x + "," + y + ")");
    }
  }

  public static Square of(int x, int y) {
    if (!onBoard(x, y)) {
      throw new IllegalArgumentException("square off the board: (" + x + "," + y + ")");
    }
    return ALL[y * SIZE + x];
  }

  /** Cell {@code 0..80}, row-major from the top-left corner. */
  public static Square ofIndex(int index) {
    return ALL[index];
  }

  public static boolean onBoard(int x, int y) {
    return x >= 0 && x < SIZE && y >= 0 && y < SIZE;
  }

  public int index() {
    return y * SIZE + x;
  }

  /** Notation file, 9 at the left edge down to 1 at the right. */
  public int file() {
    return SIZE - x;
  }

  /** Notation rank, 1 (a) at the top to 9 (i) at the bottom. */
  public int rank() {
    return y + 1;
  }
}
