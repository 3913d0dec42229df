package shogi.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import shogi.BoardMove;
import shogi.Drop;
import shogi.Move;
import shogi.Piece;
import shogi.Position;
import shogi.Side;
import shogi.contracts.MoveFormatter;
import shogi.contracts.NotationCodec;
import shogi.records.Timeline;

/**
 * Kifu-style move text: {@code ▲７六歩}, {@code △３四歩}, {@code ▲２二角成}, {@code ▲５五歩打}.
 *
 * <p>The piece name comes from the board before the move. A piece missing from its source square
 * is written {@code ??}.
 */
public final class JapaneseMoveFormatter implements MoveFormatter {
  private static final String[] FILE_DIGITS = {"", "１", "２", "３", "４", "５", "６", "７", "８", "９"};
  private static final String[] RANK_KANJI = {"", "一", "二", "三", "四", "五", "六", "七", "八", "九"};

  private final NotationCodec codec;

  public JapaneseMoveFormatter(NotationCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
  }

  @Override
  public String describe(Position before, Move move) {
    StringBuilder sb = new StringBuilder(8);
    sb.append(before.sideToMove() == Side.SENTE ? '▲' : '△');
    sb.append(FILE_DIGITS[move.to().file()]).append(RANK_KANJI[move.to().rank()]);

    if (move instanceof Drop drop) {
      return sb.append(drop.kind().japaneseName(false)).append('打').toString();
    }

    BoardMove bm = (BoardMove) move;
    Piece piece = before.pieceAt(bm.from());
    if (piece == null) return sb.append("??").toString();
    if (bm.promote() && !piece.promoted()) {
      return sb.append(piece.kind().japaneseName(false)).append('成').toString();
    }
    return sb.append(piece.kind().japaneseName(piece.promoted())).toString();
  }

  @Override
  public List<String> describeAll(Timeline timeline) {
    List<String> out = new ArrayList<>(timeline.plyCount());
    for (int ply = 0; ply < timeline.plyCount(); ply++) {
      Move move = codec.parseMove(timeline.moves().get(ply));
      out.add(describe(timeline.positionAt(ply), move));
    }
    return out;
  }
}
