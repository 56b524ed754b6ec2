package checkedc.hir;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
* Small helpers shared by the IR classes and the passes.
*/
public final class Tools {

    private Tools() {
    }

    /** Wall clock time in seconds. */
    public static double getTime() {
        return System.currentTimeMillis() / 1000.0;
    }

    /** Seconds elapsed since <b>since</b>, a value of {@link #getTime()}. */
    public static double getTime(double since) {
        return getTime() - since;
    }

    /**
    * Renders an IR object through its <code>print</code> method.
    */
    public static String toString(Printable p) {
        StringWriter sw = new StringWriter(80);
        PrintWriter pw = new PrintWriter(sw);
        p.print(pw);
        pw.flush();
        return sw.toString();
    }
}
