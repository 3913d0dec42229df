package shogi.contracts;

import java.io.PrintStream;
import java.util.Properties;

/**
 * Named, typed settings of the core, set the way a USI front-end sets engine options.
 */
public interface CoreOptions {

  /** Handles {@code setoption name <name> value <value>}. */
  void setOption(String line);

  /** Sets one option by name; unknown names and bad values are reported and ignored. */
  void setOption(String name, String value);

  /** Applies every entry of {@code props} whose key names an option. */
  void load(Properties props);

  /** Prints one {@code option name ... type ...} line per option. */
  void printOptions(PrintStream out);

  boolean checkPieceMovement();

  boolean allowGameEndTokens();

  boolean verifyMaterial();

  int maxReplayPlies();
}
