package shogi.impl;

import java.util.Objects;
import shogi.contracts.CoreOptions;
import shogi.contracts.MoveApplicator;
import shogi.contracts.MoveFormatter;
import shogi.contracts.MovementGenerator;
import shogi.contracts.NotationCodec;
import shogi.contracts.TimelineBuilder;

/**
 * Wires the codec, generator, applicator, timeline builder and formatter around one options
 * instance.
 */
public final class ShogiCore {
  private final CoreOptions options;
  private final NotationCodec codec;
  private final MovementGenerator generator;
  private final MoveApplicator applicator;
  private final TimelineBuilder timelines;
  private final MoveFormatter formatter;

  private ShogiCore(CoreOptions options) {
    this.options = Objects.requireNonNull(options, "options must not be null");
    this.codec = new NotationCodecImpl();
    this.generator = new MovementGeneratorImpl();
    this.applicator = new MoveApplicatorImpl(codec, generator, options);
    this.timelines = new TimelineBuilderImpl(codec, applicator, options);
    this.formatter = new JapaneseMoveFormatter(codec);
  }

  /** Options from {@code /shogi-core.properties} when present, defaults otherwise. */
  public static ShogiCore create() {
    return new ShogiCore(CoreOptionsImpl.fromClasspath());
  }

  public static ShogiCore create(CoreOptions options) {
    return new ShogiCore(options);
  }

  public CoreOptions options() {
    return options;
  }

  public NotationCodec codec() {
    return codec;
  }

  public MovementGenerator generator() {
    return generator;
  }

  public MoveApplicator applicator() {
    return applicator;
  }

  public TimelineBuilder timelines() {
    return timelines;
  }

  public MoveFormatter formatter() {
    return formatter;
  }
}
