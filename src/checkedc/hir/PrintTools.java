package checkedc.hir;

import checkedc.exec.Driver;

import java.util.Collection;
import java.util.Iterator;

/**
* Status output of the passes. Messages carry a level and are printed only
* when the <b>verbosity</b> option is at least that level: 0 for pass
* begin/end and warnings, 1 for per-procedure progress, 2 for statistics, 3
* for rejected expressions and 4 for detailed analysis sets.
*/
public final class PrintTools {

    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Returns the current value of the <b>verbosity</b> option. A value that
    * is not a number counts as 0; the driver rejects such values when it
    * parses the command line.
    */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
    * Writes the message to System.err if the verbosity reaches
    * <b>min_verbosity</b>.
    */
    public static void printlnStatus(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.err.println(message);
        }
    }

    /**
    * Writes the items separated by spaces to System.err if the verbosity
    * reaches <b>min_verbosity</b>. The items are converted to strings only in
    * that case, so callers may pass expensive objects directly.
    *
    * @param min_verbosity the level of the message.
    * @param items the message parts.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (getVerbosity() < min_verbosity || items.length == 0) {
            return;
        }
        StringBuilder sb = new StringBuilder(80);
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(items[i]);
        }
        System.err.println(sb);
    }

    /**
    * Writes the message to System.out if the verbosity reaches
    * <b>min_verbosity</b>.
    */
    public static void println(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.out.println(message);
        }
    }

    /**
    * Joins the string forms of the elements with <b>separator</b>.
    *
    * @return the joined string, empty for a null or empty collection.
    */
    public static String collectionToString(Collection<?> coll,
                                            String separator) {
        StringBuilder sb = new StringBuilder(80);
        if (coll == null) {
            return "";
        }
        for (Iterator<?> iter = coll.iterator(); iter.hasNext(); ) {
            sb.append(iter.next());
            if (iter.hasNext()) {
                sb.append(separator);
            }
        }
        return sb.toString();
    }
}
