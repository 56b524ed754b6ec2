package checkedc.hir;

/**
* Represents a literal in the program. Literals have no children.
*/
public abstract class Literal extends Expression {

    /** Constructs a literal without a child list. */
    protected Literal() {
        super(-1);
    }

    @Override
    public Literal clone() {
        return (Literal)super.clone();
    }
}
