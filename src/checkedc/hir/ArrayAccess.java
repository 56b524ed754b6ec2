package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a subscript expression <code>array[index]</code>.
*/
public class ArrayAccess extends Expression {

    /**
    * Creates a subscript expression.
    *
    * @param array the subscripted pointer or array.
    * @param index the index expression.
    */
    public ArrayAccess(Expression array, Expression index) {
        super(2);
        if (array == null || index == null) {
            throw new IllegalArgumentException();
        }
        addChild(array);
        addChild(index);
        index.setParens(false);
    }

    @Override
    public ArrayAccess clone() {
        return (ArrayAccess)super.clone();
    }

    /**
    * Returns the subscripted expression.
    */
    public Expression getArrayName() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the index expression.
    */
    public Expression getIndex() {
        return (Expression)children.get(1);
    }

    public void print(PrintWriter o) {
        getArrayName().print(o);
        o.print("[");
        getIndex().print(o);
        o.print("]");
    }
}
