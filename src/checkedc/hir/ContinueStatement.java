package checkedc.hir;

import java.io.PrintWriter;

/** Jumps to the next iteration of the innermost loop. */
public class ContinueStatement extends Statement {

    public void print(PrintWriter o) {
        o.print("continue;");
    }
}
