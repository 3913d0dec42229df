package shogi;

/**
 * A single ply: either a {@link BoardMove} or a {@link Drop}.
 *
 * <p>Moves are transient. They are decoded from notation, applied, and dropped; only the resulting
 * positions are kept.
 */
public interface Move {

  /** Destination square (never {@code null}). */
  Square to();

  boolean isDrop();
}
