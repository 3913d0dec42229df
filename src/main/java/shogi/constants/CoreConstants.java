package shogi.constants;

import java.util.Set;

/**
 * Central place for the fixed numbers and strings of the shogi core.
 */
public final class CoreConstants {

  private CoreConstants() {}

  /* ────────────── Board geometry ────────────── */
  public static final int BOARD_SIZE = 9;
  /** Ranks counted from the far edge that form a side's promotion zone. */
  public static final int PROMOTION_ZONE_DEPTH = 3;

  /* ────────────── Notation ────────────── */
  public static final String STARTPOS_BOARD =
      "lnsgkgsnl/1r5b1/ppppppppp/9/9/9/PPPPPPPPP/1B5R1/LNSGKGSNL";

  public static final String KW_POSITION = "position";
  public static final String KW_STARTPOS = "startpos";
  public static final String KW_SFEN = "sfen";
  public static final String KW_MOVES = "moves";
  public static final String EMPTY_HAND = "-";

  /** USI tokens that end a game record instead of moving a piece. */
  public static final Set<String> GAME_END_TOKENS = Set.of("resign", "win", "draw");

  /* ────────────── Option defaults ────────────── */
  public static final boolean DEFAULT_CHECK_PIECE_MOVEMENT = true;
  public static final boolean DEFAULT_ALLOW_GAME_END_TOKENS = true;
  public static final boolean DEFAULT_VERIFY_MATERIAL = false;
  public static final int DEFAULT_MAX_REPLAY_PLIES = 1024;
  public static final int MIN_MAX_REPLAY_PLIES = 1;
  public static final int MAX_MAX_REPLAY_PLIES = 100_000;

  /** Optional classpath resource read by {@code CoreOptionsImpl.fromClasspath()}. */
  public static final String OPTIONS_RESOURCE = "/shogi-core.properties";
}
