package shogi.records;

import java.util.List;
import java.util.Objects;
import shogi.Position;

/**
 * A decoded {@code position} command.
 *
 * @param header     {@code startpos}, or the canonical {@code sfen <board> <side> <hands> <n>}
 * @param position   the header position (before any of {@code moves})
 * @param moveNumber the SFEN move-count field, 1 when absent
 * @param moves      move tokens in order, unparsed
 */
public record ParsedPosition(String header, Position position, int moveNumber, List<String> moves) {

  public ParsedPosition {
    Objects.requireNonNull(header, "header must not be null");
    Objects.requireNonNull(position, "position must not be null");
    moves = List.copyOf(moves);
  }
}
