package checkedc.exec;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import checkedc.analysis.AnalysisPass;
import checkedc.analysis.BoundsWideningPass;
import checkedc.hir.PrintTools;
import checkedc.hir.Program;

/**
 * Entry point for a host front end. The host builds the {@link Program},
 * calls {@link #run} with option strings of the form <b>-name</b> or
 * <b>-name=value</b>, and reads the widened bounds back from
 * {@link #getWideningPass()}. Option values are global so that the passes
 * can look them up through {@link #getOptionValue(String)}.
 */
public class Driver
{
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static {
    registerOptions();
  }

  protected Program program;

  // Set by runPasses; null until then.
  protected BoundsWideningPass widening_pass;

  public Driver()
  {
    program = null;
    widening_pass = null;
  }

  /**
   * Declares the known options with their defaults. Calling it again puts
   * every option back to its default.
   */
  public static void registerOptions()
  {
    options.add(CommandLineOptionSet.UTILITY, "help",
                "Print the option summary and run no pass");
    options.add(CommandLineOptionSet.UTILITY, "verbosity", "0", "N",
                "Level of status messages on stderr, 0 (quiet) to 4 (analysis sets)");
    options.add(CommandLineOptionSet.UTILITY, "skip-procedures",
                "proc1,proc2,...",
                "Comma separated functions the passes leave unanalyzed");
    options.add(CommandLineOptionSet.ANALYSIS, "dump-widened-bounds",
                "Print, per basic block and statement, the widened upper bounds of _Nt_array_ptr variables");
    options.add(CommandLineOptionSet.ANALYSIS, "dump-preorder-ast",
                "Print the normalized tree of each pointer expression the analysis compares");
  }

  /** Current value of an option; null when unset or unknown. */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /** Changes an option; unknown names are ignored. */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  /**
   * Names listed by <b>-skip-procedures</b>.
   */
  public static Set<String> getSkipProcedureSet()
  {
    Set<String> names = new HashSet<String>();
    String list = getOptionValue("skip-procedures");
    if (list != null)
      names.addAll(Arrays.asList(list.split(",")));
    return names;
  }

  public static String getUsage()
  {
    return options.getUsage();
  }

  /**
   * Applies one option with its leading dash removed. A flag gets the value
   * "1".
   */
  protected void parseOption(String opt)
  {
    opt = opt.trim();
    if (opt.isEmpty())
      return;
    int eq = opt.indexOf('=');
    String name = (eq < 0) ? opt : opt.substring(0, eq);
    String value = (eq < 0) ? "1" : opt.substring(eq + 1);
    if (options.contains(name))
      setOptionValue(name, value);
    else
      PrintTools.printlnStatus("ignoring unrecognized option " + name, 0);
  }

  /**
   * Applies the option strings in order, then checks the verbosity.
   *
   * @throws IllegalArgumentException if the verbosity is not an integer
   *   from 0 to 4.
   */
  protected void parseCommandLine(String[] args)
  {
    for (String arg : args)
    {
      if (arg.startsWith("-"))
        parseOption(arg.substring(1));
      else
        PrintTools.printlnStatus("ignoring unexpected argument " + arg, 0);
    }
    checkVerbosity(getOptionValue("verbosity"));
  }

  private static void checkVerbosity(String verbosity)
  {
    int level;
    try {
      level = Integer.parseInt(verbosity);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid verbosity " + verbosity, e);
    }
    if (level < 0 || level > 4)
      throw new IllegalArgumentException("verbosity out of range " + level);
  }

  /**
   * The pass sequence. Subclasses may add passes around the widening pass.
   */
  protected void runPasses()
  {
    widening_pass = new BoundsWideningPass(program);
    AnalysisPass.run(widening_pass);
  }

  public void run(String[] args, Program program)
  {
    parseCommandLine(args);
    if (getOptionValue("help") != null)
    {
      System.out.println(getUsage());
      return;
    }
    this.program = program;
    runPasses();
  }

  /** The widening pass of the last run, or null if no pass ran. */
  public BoundsWideningPass getWideningPass()
  {
    return widening_pass;
  }
}
