package checkedc.hir;

import java.io.PrintWriter;

/**
* IR objects print themselves as C source text.
*/
public interface Printable {

    void print(PrintWriter o);
}
