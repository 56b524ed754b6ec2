package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a character literal in the program, such as the null terminator
* <code>'\0'</code>.
*/
public class CharLiteral extends Literal {

    private char value;

    /**
    * Constructs a character literal with the specified value.
    *
    * @param value the character value.
    */
    public CharLiteral(char value) {
        super();
        this.value = value;
    }

    @Override
    public CharLiteral clone() {
        return (CharLiteral)super.clone();
    }

    /**
    * Returns the value of the literal.
    *
    * @return the character value.
    */
    public char getValue() {
        return value;
    }

    public void print(PrintWriter o) {
        o.print("'");
        switch (value) {
        case '\0':
            o.print("\\0");
            break;
        case '\n':
            o.print("\\n");
            break;
        case '\t':
            o.print("\\t");
            break;
        case '\'':
            o.print("\\'");
            break;
        case '\\':
            o.print("\\\\");
            break;
        default:
            o.print(value);
        }
        o.print("'");
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value == ((CharLiteral)o).value);
    }

    @Override
    public int hashCode() {
        return value;
    }
}
