package shogi.impl;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import shogi.Board;
import shogi.Side;
import shogi.contracts.MovementGenerator;
import shogi.contracts.TimelineBuilder;
import shogi.records.Timeline;

/**
 * JMH throughput benchmark for full-record replay and board-wide attack sets, fed by the same
 * game vectors as the unit tests.
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
public class ReplayBenchmark {

  /* collaborators */
  private static final ShogiCore CORE = ShogiCore.create(new CoreOptionsImpl());
  private static final TimelineBuilder TIMELINES = CORE.timelines();
  private static final MovementGenerator GEN = CORE.generator();

  private List<String> commands;
  private List<Board> boards;

  /* report plies/sec */
  @AuxCounters(AuxCounters.Type.EVENTS)
  @State(Scope.Thread)
  public static class Metrics { public long plies; }

  /* ── load game records once per fork ─────────────────────────── */
  @Setup(Level.Trial)
  public void init() throws Exception {
    try (var is = getClass().getResourceAsStream("/replay/games.txt");
         var br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
      commands = br.lines()
          .map(String::trim)
          .filter(l -> !(l.isEmpty() || l.startsWith("#")))
          .map(l -> l.split(";")[0].trim())
          .toList();
    }
    boards = commands.stream()
        .map(TIMELINES::build)
        .flatMap(t -> t.boards().stream())
        .toList();
  }

  /* ── benchmark bodies ────────────────────────────────────────── */
  @Benchmark
  public void replayAll(Metrics m, Blackhole bh) {
    for (String cmd : commands) {
      Timeline t = TIMELINES.build(cmd);
      m.plies += t.plyCount();
      bh.consume(t);
    }
  }

  @Benchmark
  public void attackSets(Blackhole bh) {
    for (Board b : boards) {
      bh.consume(GEN.attackSet(b, Side.SENTE));
      bh.consume(GEN.attackSet(b, Side.GOTE));
    }
  }
}
