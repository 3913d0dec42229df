package shogi;

/** The two players. Sente moves first and is written in uppercase; Gote in lowercase. */
public enum Side {
  SENTE('b'),
  GOTE('w');

  private final char sfenToken;

  Side(char sfenToken) {
    this.sfenToken = sfenToken;
  }

  /** SFEN side-to-move letter: {@code b} for Sente, {@code w} for Gote. */
  public char sfenToken() {
    return sfenToken;
  }

  public Side opposite() {
    return this == SENTE ? GOTE : SENTE;
  }

  /** The y delta of one step forward: Sente advances towards y = 0, Gote towards y = 8. */
  public int forward() {
    return this == SENTE ? -1 : 1;
  }
}
