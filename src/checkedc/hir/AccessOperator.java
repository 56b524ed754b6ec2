package checkedc.hir;

/**
* Member selection: <code>s.f</code> and <code>p-&gt;f</code>.
*/
public class AccessOperator extends BinaryOperator {

    public static final AccessOperator MEMBER_ACCESS =
            new AccessOperator(".", 0);

    public static final AccessOperator POINTER_ACCESS =
            new AccessOperator("->", 1);

    private AccessOperator(String symbol, int rank) {
        super(symbol, rank);
    }
}
