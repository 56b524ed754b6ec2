package checkedc.hir;

import java.io.PrintWriter;

/** Leaves the innermost loop or switch. */
public class BreakStatement extends Statement {

    public void print(PrintWriter o) {
        o.print("break;");
    }
}
