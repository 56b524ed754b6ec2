package checkedc.exec;

import java.util.Map;
import java.util.TreeMap;

import checkedc.hir.PrintTools;

/**
 * Registry of the options understood by the driver and the passes. An option
 * belongs to a group that decides where its usage text is listed, and has a
 * current value (null while unset), an optional argument name shown in the
 * usage text and a one-line description.
 */
public class CommandLineOptionSet
{
  /** Options that change what the passes compute or print. */
  public static final int ANALYSIS = 1;

  /** Options of the driver itself. */
  public static final int UTILITY = 3;

  private static class Option
  {
    final int group;
    final String arg;
    final String usage;
    String value;

    Option(int group, String value, String arg, String usage)
    {
      this.group = group;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  // Sorted by name for the usage text.
  private final Map<String, Option> options;

  public CommandLineOptionSet()
  {
    options = new TreeMap<String, Option>();
  }

  /** Registers a flag without a default value. */
  public void add(int group, String name, String usage)
  {
    add(group, name, null, null, usage);
  }

  /** Registers an option taking an argument, without a default value. */
  public void add(int group, String name, String arg, String usage)
  {
    add(group, name, null, arg, usage);
  }

  /**
   * Registers an option. Registering a name again replaces the option and
   * its current value.
   */
  public void add(int group, String name, String value, String arg,
                  String usage)
  {
    options.put(name, new Option(group, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return options.containsKey(name);
  }

  /**
   * Returns the usage text of all groups.
   */
  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(1000);
    appendGroup(sb, "UTILITY", UTILITY);
    appendGroup(sb, "ANALYSIS", ANALYSIS);
    return sb.toString();
  }

  private void appendGroup(StringBuilder sb, String title, int group)
  {
    String sep = PrintTools.line_sep;
    String rule = "--------------------------------------------------" +
                  "------------------------------";
    sb.append(rule).append(sep).append(title).append(sep);
    sb.append(rule).append(sep);
    for (Map.Entry<String, Option> e : options.entrySet())
    {
      Option option = e.getValue();
      if (option.group != group)
        continue;
      sb.append("-").append(e.getKey());
      if (option.arg != null)
        sb.append("=").append(option.arg);
      sb.append(sep).append("    ").append(option.usage).append(sep);
      sb.append(sep);
    }
  }

  /**
   * Returns the value of the option, or null if it is unset or unknown.
   */
  public String getValue(String name)
  {
    Option option = options.get(name);
    return (option == null) ? null : option.value;
  }

  /**
   * Sets the value of a registered option; unknown names are ignored.
   */
  public void setValue(String name, String value)
  {
    Option option = options.get(name);
    if (option != null)
      option.value = value;
  }
}
