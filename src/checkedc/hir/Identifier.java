package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a reference to a declared variable. Identifiers are linked to
* their {@link Symbol} and two identifiers are equal only if they refer to the
* same symbol object.
*/
public class Identifier extends Expression {

    /** Linked symbol object */
    private Symbol symbol;

    /**
    * Constructs an identifier linked to the specified symbol.
    *
    * @param symbol the referenced symbol.
    */
    public Identifier(Symbol symbol) {
        super(-1);
        if (symbol == null) {
            throw new IllegalArgumentException("identifier without symbol");
        }
        this.symbol = symbol;
    }

    @Override
    public Identifier clone() {
        return (Identifier)super.clone();
    }

    /**
    * Returns the symbol object linked to this identifier.
    *
    * @return the symbol object.
    */
    public Symbol getSymbol() {
        return symbol;
    }

    /**
    * Returns the name of the identifier.
    *
    * @return the name.
    */
    public String getName() {
        return symbol.getSymbolName();
    }

    public void print(PrintWriter o) {
        o.print(symbol.getSymbolName());
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && symbol == ((Identifier)o).symbol);
    }

    @Override
    public int hashCode() {
        return symbol.getSymbolName().hashCode();
    }
}
