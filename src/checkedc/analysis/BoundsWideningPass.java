package checkedc.analysis;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import checkedc.exec.Driver;
import checkedc.hir.DepthFirstIterator;
import checkedc.hir.PrintTools;
import checkedc.hir.Procedure;
import checkedc.hir.Program;
import checkedc.hir.Traversable;

/**
 * Runs {@link BoundsWideningAnalysis} on every procedure of a program. The
 * analyses are kept per procedure so that later passes can query the facts.
 * With the <b>dump-widened-bounds</b> option the widened bounds of each
 * procedure are printed to standard output.
 */
public class BoundsWideningPass extends AnalysisPass
{
  private Map<Procedure, BoundsWideningAnalysis> analyses;

  public BoundsWideningPass(Program program)
  {
    super(program);
    analyses = new LinkedHashMap<Procedure, BoundsWideningAnalysis>();
  }

  public String getPassName()
  {
    return "[BoundsWideningPass]";
  }

  public void start()
  {
    analyses.clear();
    Set<String> skip_set = Driver.getSkipProcedureSet();
    DepthFirstIterator<Traversable> iter =
        new DepthFirstIterator<Traversable>(program);
    iter.pruneOn(Procedure.class);
    List<Procedure> procs = iter.getList(Procedure.class);
    for (Procedure proc : procs)
    {
      if (skip_set.contains(proc.getName()))
      {
        PrintTools.printlnStatus(1, getPassName(), "skipping procedure",
            proc.getName());
        continue;
      }
      PrintTools.printlnStatus(1, getPassName(), "examining procedure",
          proc.getName());
      analyzeProcedure(proc);
    }
  }

  /**
   * Builds the control flow graph of the procedure and runs the analysis.
   *
   * @param proc the procedure.
   * @return the finished analysis.
   */
  protected BoundsWideningAnalysis analyzeProcedure(Procedure proc)
  {
    BoundsWideningAnalysis analysis =
        new BoundsWideningAnalysis(new CFGraph(proc));
    analysis.widenBounds();
    analyses.put(proc, analysis);

    if (Driver.getOptionValue("dump-widened-bounds") != null)
    {
      PrintWriter o = new PrintWriter(System.out);
      analysis.dumpWidenedBounds(o);
      o.flush();
    }
    return analysis;
  }

  /**
   * Returns the analysis of the procedure, or null if the procedure was
   * skipped or does not belong to the program.
   */
  public BoundsWideningAnalysis getAnalysis(Procedure proc)
  {
    return analyses.get(proc);
  }

  /**
   * Returns the analyses in program order.
   */
  public Map<Procedure, BoundsWideningAnalysis> getAnalyses()
  {
    return analyses;
  }
}
