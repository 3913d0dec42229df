package shogi;

/** Why a well-formed move was refused in a given position. */
public enum MoveError {
  /** Board move from an empty square. */
  EMPTY_SOURCE("no piece on the source square"),
  /** Board move of a piece that belongs to the side not on move. */
  WRONG_OWNER("the piece belongs to the other side"),
  /** Board move onto a square held by one of the mover's own pieces. */
  OCCUPIED_BY_SELF("the destination holds one of the mover's own pieces"),
  /** Promotion requested for a Gold or a King. */
  UNPROMOTABLE_PIECE("this piece cannot promote"),
  /** The piece's movement pattern does not reach the destination. */
  UNREACHABLE_SQUARE("the piece cannot reach the destination"),
  /** Drop of a kind the mover does not hold. */
  NO_PIECE_IN_HAND("no such piece in hand"),
  /** Drop onto an occupied square. */
  OCCUPIED("the drop square is occupied"),
  /** Pawn or Lance on the last rank, Knight on the last two. */
  ILLEGAL_DROP_RANK("the dropped piece would have no forward move");

  private final String description;

  MoveError(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
