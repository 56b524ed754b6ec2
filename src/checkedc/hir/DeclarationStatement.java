package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents the declaration of a single local variable with an optional
* initializer. The initializer is the only child; the bounds annotation of
* the declarator is not evaluated and is not a child.
*/
public class DeclarationStatement extends Statement {

    private VariableDeclarator declarator;

    /**
    * Creates a declaration without initializer.
    *
    * @param declarator the declared variable.
    */
    public DeclarationStatement(VariableDeclarator declarator) {
        this(declarator, null);
    }

    /**
    * Creates a declaration with an initializer.
    *
    * @param declarator the declared variable.
    * @param init the initial value, or null.
    */
    public DeclarationStatement(VariableDeclarator declarator, Expression init) {
        super();
        if (declarator == null) {
            throw new IllegalArgumentException();
        }
        this.declarator = declarator;
        addChild(init);
    }

    public VariableDeclarator getDeclarator() {
        return declarator;
    }

    /**
    * Returns the initializer or null if there is none.
    */
    public Expression getInitializer() {
        return (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        declarator.print(o);
        if (getInitializer() != null) {
            o.print(" = ");
            getInitializer().print(o);
        }
        o.print(";");
    }
}
