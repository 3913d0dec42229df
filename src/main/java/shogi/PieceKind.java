package shogi;

import java.util.List;

/**
 * The eight base kinds of a shogi set, independent of owner and promotion.
 *
 * <p>{@link #materialCount()} is the number of pieces of that kind in a full set (both players
 * together); it bounds every position reachable by play.
 */
public enum PieceKind {
  PAWN('P', 18, "歩", "と"),
  LANCE('L', 4, "香", "成香"),
  KNIGHT('N', 4, "桂", "成桂"),
  SILVER('S', 4, "銀", "成銀"),
  GOLD('G', 4, "金", null),
  BISHOP('B', 2, "角", "馬"),
  ROOK('R', 2, "飛", "龍"),
  KING('K', 2, "玉", null);

  /** Serialization order of hand pieces: R, B, G, S, N, L, P. */
  public static final List<PieceKind> HAND_ORDER =
      List.of(ROOK, BISHOP, GOLD, SILVER, KNIGHT, LANCE, PAWN);

  private final char letter;
  private final int materialCount;
  private final String name;
  private final String promotedName;

  PieceKind(char letter, int materialCount, String name, String promotedName) {
    this.letter = letter;
    this.materialCount = materialCount;
    this.name = name;
    this.promotedName = promotedName;
  }

  /** Uppercase SFEN letter. */
  public char letter() {
    return letter;
  }

  public int materialCount() {
    return materialCount;
  }

  /** Gold and King have no promoted form. */
  public boolean canPromote() {
    return promotedName != null;
  }

  /** Everything but the King can sit in a hand. */
  public boolean isDroppable() {
    return this != KING;
  }

  public String japaneseName(boolean promoted) {
    return promoted ? promotedName : name;
  }

  /**
   * Looks a kind up by its SFEN letter, either case.
   *
   * @return the kind, or {@code null} if {@code c} is not a piece letter
   */
  public static PieceKind fromLetter(char c) {
    return switch (Character.toUpperCase(c)) {
      case 'P' -> PAWN;
      case 'L' -> LANCE;
      case 'N' -> KNIGHT;
      case 'S' -> SILVER;
      case 'G' -> GOLD;
      case 'B' -> BISHOP;
      case 'R' -> ROOK;
      case 'K' -> KING;
      default -> null;
    };
  }
}
