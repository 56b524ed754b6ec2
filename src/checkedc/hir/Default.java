package checkedc.hir;

import java.io.PrintWriter;

/**
* The <code>default:</code> label of a switch body.
*/
public class Default extends Statement {

    public void print(PrintWriter o) {
        o.print("default:");
    }
}
