package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a string literal in the program.
*/
public class StringLiteral extends Literal {

    private String value;

    /**
    * Constructs a string literal with the specified contents, without the
    * surrounding quotes.
    *
    * @param value the contents of the string.
    */
    public StringLiteral(String value) {
        super();
        this.value = value;
    }

    @Override
    public StringLiteral clone() {
        return (StringLiteral)super.clone();
    }

    public String getValue() {
        return value;
    }

    public void print(PrintWriter o) {
        o.print("\"" + value + "\"");
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value.equals(((StringLiteral)o).value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
