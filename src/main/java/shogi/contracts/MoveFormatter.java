package shogi.contracts;

import java.util.List;
import shogi.Move;
import shogi.Position;
import shogi.records.Timeline;

/** Human-readable rendering of moves. */
public interface MoveFormatter {

  /** Describes {@code move} as played from {@code before}. */
  String describe(Position before, Move move);

  /** One description per ply of {@code timeline}. */
  List<String> describeAll(Timeline timeline);
}
