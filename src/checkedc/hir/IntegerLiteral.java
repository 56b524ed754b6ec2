package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents an integer literal in the program.
*/
public class IntegerLiteral extends Literal {

    private long value;

    /**
    * Constructs an integer literal with the specified numeric value.
    *
    * @param value the integer value of the literal.
    */
    public IntegerLiteral(long value) {
        super();
        this.value = value;
    }

    @Override
    public IntegerLiteral clone() {
        return (IntegerLiteral)super.clone();
    }

    /**
    * Returns the value of the literal.
    *
    * @return the numeric value.
    */
    public long getValue() {
        return value;
    }

    public void print(PrintWriter o) {
        o.print(value);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value == ((IntegerLiteral)o).value);
    }

    @Override
    public int hashCode() {
        return Long.valueOf(value).hashCode();
    }
}
