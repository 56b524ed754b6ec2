package checkedc.analysis;

import checkedc.hir.PrintTools;
import checkedc.hir.Program;
import checkedc.hir.Tools;

/**
 * A pass that reads the whole program and leaves it unchanged. Results stay
 * on the pass object for the caller to query.
 */
public abstract class AnalysisPass
{
  protected Program program;

  protected AnalysisPass(Program program)
  {
    this.program = program;
  }

  /** Bracketed name used in status messages. */
  public abstract String getPassName();

  /** Analyzes {@link #program}. */
  public abstract void start();

  /**
   * Starts the pass between a begin and an end message; the latter carries
   * the time spent.
   */
  public static void run(AnalysisPass pass)
  {
    String name = pass.getPassName();
    double started = Tools.getTime();
    PrintTools.println(name + " begin", 0);
    pass.start();
    double seconds = Tools.getTime(started);
    PrintTools.println(String.format("%s end in %.2f seconds", name, seconds),
                       0);
  }
}
