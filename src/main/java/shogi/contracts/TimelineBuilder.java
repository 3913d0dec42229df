package shogi.contracts;

import shogi.records.Timeline;

/**
 * Replays a position command into per-ply snapshots for review and scrubbing.
 */
public interface TimelineBuilder {

  /**
   * @throws shogi.NotationException if the command or any move token is malformed
   * @throws shogi.ReplayException if a move is refused; no partial timeline is produced
   */
  Timeline build(String notation);
}
