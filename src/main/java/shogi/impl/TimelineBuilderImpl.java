package shogi.impl;

import static shogi.constants.CoreConstants.GAME_END_TOKENS;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shogi.NotationException;
import shogi.PieceKind;
import shogi.Position;
import shogi.ReplayException;
import shogi.contracts.CoreOptions;
import shogi.contracts.MoveApplicator;
import shogi.contracts.NotationCodec;
import shogi.contracts.TimelineBuilder;
import shogi.records.MoveResult;
import shogi.records.ParsedPosition;
import shogi.records.Timeline;

/**
 * Folds the applicator over a game record. The whole record is rebuilt on every call; the first
 * refused move aborts the replay with its ply.
 */
public final class TimelineBuilderImpl implements TimelineBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(TimelineBuilderImpl.class);

  private final NotationCodec codec;
  private final MoveApplicator applicator;
  private final CoreOptions opts;

  public TimelineBuilderImpl(NotationCodec codec, MoveApplicator applicator, CoreOptions opts) {
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.applicator = Objects.requireNonNull(applicator, "applicator must not be null");
    this.opts = Objects.requireNonNull(opts, "opts must not be null");
  }

  @Override
  public Timeline build(String notation) {
    ParsedPosition parsed = codec.parsePosition(notation);
    List<String> tokens = parsed.moves();
    int plies = tokens.size();
    if (plies > 0 && opts.allowGameEndTokens() && GAME_END_TOKENS.contains(tokens.get(plies - 1))) {
      plies--;
    }
    if (plies > opts.maxReplayPlies()) {
      throw new NotationException(
          "Game record longer than " + opts.maxReplayPlies() + " plies", notation);
    }

    Position current = parsed.position();
    List<Position> positions = new ArrayList<>(tokens.size() + 1);
    List<String> played = new ArrayList<>(tokens.size());
    positions.add(current);
    verify(current, 0);

    String result = null;
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (opts.allowGameEndTokens() && GAME_END_TOKENS.contains(token)) {
        if (i != tokens.size() - 1) {
          throw new NotationException("Moves after game end token '" + token + "'", notation);
        }
        result = token;
        break;
      }

      int ply = i + 1;
      MoveResult r = applicator.apply(current, token);
      if (!r.isSuccess()) {
        LOG.debug("replay stopped at ply {} ({}): {}", ply, token, r.error());
        throw new ReplayException(ply, token, r.error());
      }
      current = r.position();
      positions.add(current);
      played.add(token);
      verify(current, ply);
    }

    LOG.debug("replayed {} plies from {}{}", played.size(), parsed.header(),
        result == null ? "" : " (" + result + ")");
    return new Timeline(parsed.header(), positions, played, result);
  }

  private void verify(Position position, int ply) {
    if (!opts.verifyMaterial()) return;
    Map<PieceKind, Integer> excess = position.materialExcess();
    if (!excess.isEmpty()) {
      LOG.warn("ply {}: more pieces than a full set holds: {}", ply, excess);
    }
  }
}
