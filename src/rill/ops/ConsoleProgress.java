package rill.ops;

import java.io.PrintStream;

/**
 * Prints a running percentage on one console line, "\r12.34%", and ends the
 * line when the pass completes.
 */
public class ConsoleProgress implements Progress {
  final PrintStream _out;
  public ConsoleProgress( PrintStream out ) { _out = out; }
  public ConsoleProgress() { this(System.out); }

  @Override public void update( long done, long total ) {
    float perc = total == 0 ? 100f : 100f*done/total;
    _out.print(String.format("\r%.2f%%",perc));
    if( done >= total ) _out.println();
    _out.flush();
  }
}
